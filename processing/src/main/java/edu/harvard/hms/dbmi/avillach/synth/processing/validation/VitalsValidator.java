package edu.harvard.hms.dbmi.avillach.synth.processing.validation;

import edu.harvard.hms.dbmi.avillach.synth.data.result.ValidationCheck;
import edu.harvard.hms.dbmi.avillach.synth.data.result.ValidationReport;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pass/fail checks over an output record set. Failures are reported, never thrown.
 */
@Component
public class VitalsValidator {

    public static final String COLUMNS_PRESENT = "columns_present";
    public static final String RANGES_OK = "ranges_ok";
    public static final String BP_DIFFERENTIAL_OK = "bp_differential_ok";
    public static final String COMPLETE_VISIT_SEQUENCES = "complete_visit_sequences";
    public static final String CONSISTENT_TREATMENT_ARMS = "consistent_treatment_arms";
    public static final String ENDPOINT_EFFECT_NEAR_TARGET = "endpoint_effect_near_target";

    /**
     * Allowed distance, in mmHg, between the observed endpoint effect and the target.
     */
    public static final double EFFECT_TOLERANCE = 2.0;

    public ValidationReport validate(List<VitalsRecord> records, double targetEffect, VisitName endpointVisit) {
        List<ValidationCheck> checks = new ArrayList<>();
        if (records.isEmpty()) {
            for (String name : List.of(
                COLUMNS_PRESENT, RANGES_OK, BP_DIFFERENTIAL_OK, COMPLETE_VISIT_SEQUENCES, CONSISTENT_TREATMENT_ARMS, ENDPOINT_EFFECT_NEAR_TARGET
            )) {
                checks.add(new ValidationCheck(name, false, "no records"));
            }
            return new ValidationReport(0, checks, null);
        }

        long incomplete = records.stream().filter(record -> record.subjectId() == null || record.visitName() == null || record.treatmentArm() == null)
            .count();
        checks.add(new ValidationCheck(COLUMNS_PRESENT, incomplete == 0, incomplete + " records missing identity fields"));
        if (incomplete > 0) {
            records = records.stream().filter(record -> record.subjectId() != null && record.visitName() != null && record.treatmentArm() != null)
                .collect(Collectors.toList());
        }

        long outOfRange = records.stream().filter(record -> VitalField.columns().stream().anyMatch(field -> !field.inRange(record.get(field))))
            .count();
        checks.add(new ValidationCheck(RANGES_OK, outOfRange == 0, outOfRange + " records outside clinical ranges"));

        long narrow = records.stream().filter(record -> record.bpDifferential() < VitalField.MIN_BP_DIFFERENTIAL).count();
        checks.add(new ValidationCheck(BP_DIFFERENTIAL_OK, narrow == 0, narrow + " records with SystolicBP - DiastolicBP below 5"));

        Map<String, List<VitalsRecord>> bySubject = records.stream()
            .collect(Collectors.groupingBy(VitalsRecord::subjectId, LinkedHashMap::new, Collectors.toList()));
        long gaps = bySubject.values().stream().filter(visits -> !isCompleteSequence(visits)).count();
        checks.add(
            new ValidationCheck(COMPLETE_VISIT_SEQUENCES, gaps == 0, gaps + " of " + bySubject.size() + " subjects without exactly one record per visit")
        );

        long mixedArms = bySubject.values().stream().filter(visits -> visits.stream().map(VitalsRecord::treatmentArm).distinct().count() > 1)
            .count();
        checks.add(new ValidationCheck(CONSISTENT_TREATMENT_ARMS, mixedArms == 0, mixedArms + " subjects in more than one arm"));

        Double effect = endpointEffect(records, endpointVisit);
        boolean effectOk = effect != null && Math.abs(effect - targetEffect) <= EFFECT_TOLERANCE;
        checks.add(
            new ValidationCheck(
                ENDPOINT_EFFECT_NEAR_TARGET, effectOk,
                effect == null ? "an arm has no records at " + endpointVisit.label()
                    : String.format(Locale.ROOT, "observed %.2f, target %.2f", effect, targetEffect)
            )
        );
        return new ValidationReport(records.size(), checks, effect);
    }

    private static boolean isCompleteSequence(List<VitalsRecord> visits) {
        Set<VisitName> seen = EnumSet.noneOf(VisitName.class);
        for (VitalsRecord record : visits) {
            if (!seen.add(record.visitName())) {
                return false;
            }
        }
        return seen.size() == VisitName.sequence().size();
    }

    private static Double endpointEffect(List<VitalsRecord> records, VisitName endpointVisit) {
        double active = mean(records, endpointVisit, TreatmentArm.ACTIVE);
        double placebo = mean(records, endpointVisit, TreatmentArm.PLACEBO);
        return Double.isNaN(active) || Double.isNaN(placebo) ? null : active - placebo;
    }

    private static double mean(List<VitalsRecord> records, VisitName visit, TreatmentArm arm) {
        return records.stream().filter(record -> record.visitName() == visit && record.treatmentArm() == arm)
            .mapToDouble(VitalsRecord::systolicBp).average().orElse(Double.NaN);
    }
}
