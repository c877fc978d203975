package edu.harvard.hms.dbmi.avillach.synth.processing.effect;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shifts Active-arm systolic pressure so that Active minus Placebo approximates a target at the endpoint visit. Input
 * records are never modified; the shifted set is re-enforced before it is returned.
 */
@Component
public class TreatmentEffectInjector {

    private static final Logger log = LoggerFactory.getLogger(TreatmentEffectInjector.class);

    private final EffectOnset onset;
    private final EffectCalibration calibration;
    private final ConstraintEnforcer enforcer;

    @Autowired
    public TreatmentEffectInjector(
        @Value("${synth.effect.onset:endpoint}") String onset, @Value("${synth.effect.calibration:additive}") String calibration,
        ConstraintEnforcer enforcer
    ) {
        this(EffectOnset.fromKey(onset), EffectCalibration.fromKey(calibration), enforcer);
    }

    public TreatmentEffectInjector(EffectOnset onset, EffectCalibration calibration, ConstraintEnforcer enforcer) {
        this.onset = onset;
        this.calibration = calibration;
        this.enforcer = enforcer;
    }

    public List<VitalsRecord> injectEffect(List<VitalsRecord> records, double targetEffect, VisitName endpointVisit) {
        Map<VisitName, Double> shifts = new EnumMap<>(VisitName.class);
        for (VisitName visit : VisitName.sequence()) {
            double fraction = onset.fraction(visit, endpointVisit);
            if (fraction > 0.0) {
                shifts.put(visit, shiftFor(records, visit, fraction * targetEffect));
            }
        }
        log.debug("Injecting {} effect {} with {} onset, shifts {}", calibration.key(), targetEffect, onset.key(), shifts);

        ImmutableList.Builder<VitalsRecord> shifted = ImmutableList.builderWithExpectedSize(records.size());
        for (VitalsRecord record : records) {
            Double shift = shifts.get(record.visitName());
            if (shift != null && record.treatmentArm() == TreatmentArm.ACTIVE) {
                shifted.add(record.with(VitalField.SYSTOLIC_BP, record.systolicBp() + shift));
            } else {
                shifted.add(record);
            }
        }
        return enforcer.enforce(shifted.build());
    }

    private double shiftFor(List<VitalsRecord> records, VisitName visit, double scaledTarget) {
        if (calibration == EffectCalibration.ADDITIVE) {
            return scaledTarget;
        }
        double active = meanSystolic(records, visit, TreatmentArm.ACTIVE);
        double placebo = meanSystolic(records, visit, TreatmentArm.PLACEBO);
        if (Double.isNaN(active) || Double.isNaN(placebo)) {
            log.debug("Visit {} lacks one arm, applying the target additively", visit);
            return scaledTarget;
        }
        return scaledTarget - (active - placebo);
    }

    private static double meanSystolic(List<VitalsRecord> records, VisitName visit, TreatmentArm arm) {
        return records.stream().filter(record -> record.visitName() == visit && record.treatmentArm() == arm)
            .mapToDouble(VitalsRecord::systolicBp).average().orElse(Double.NaN);
    }
}
