package edu.harvard.hms.dbmi.avillach.synth.processing.stats;

import edu.harvard.hms.dbmi.avillach.synth.data.result.ArmStatistics;
import edu.harvard.hms.dbmi.avillach.synth.data.result.ClinicalRelevance;
import edu.harvard.hms.dbmi.avillach.synth.data.result.EffectSizeCategory;
import edu.harvard.hms.dbmi.avillach.synth.data.result.TreatmentEffectResult;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.processing.util.VitalsMatrix;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.inference.TTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares Active against Placebo at one visit with a Welch two-sample t-test.
 */
@Component
public class TreatmentEffectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TreatmentEffectAnalyzer.class);

    public static final double ALPHA = 0.05;

    public TreatmentEffectResult weekNEffect(List<VitalsRecord> records, VisitName visit) {
        return weekNEffect(records, visit, VitalField.SYSTOLIC_BP);
    }

    /**
     * @throws InsufficientDataException when either arm has fewer than two distinct subjects at {@code visit}
     */
    public TreatmentEffectResult weekNEffect(List<VitalsRecord> records, VisitName visit, VitalField field) {
        List<VitalsRecord> atVisit = records.stream().filter(record -> record.visitName() == visit).collect(Collectors.toList());
        Map<String, List<String>> shortfalls = new LinkedHashMap<>();
        for (TreatmentArm arm : TreatmentArm.values()) {
            long subjects = atVisit.stream().filter(record -> record.treatmentArm() == arm).map(VitalsRecord::subjectId).distinct().count();
            if (subjects < 2) {
                shortfalls.put(arm.label(), List.of(subjects + " subjects at " + visit.label() + ", at least 2 required"));
            }
        }
        if (!shortfalls.isEmpty()) {
            throw new InsufficientDataException("Not enough subjects to compare arms", shortfalls);
        }

        double[] active = values(atVisit, TreatmentArm.ACTIVE, field);
        double[] placebo = values(atVisit, TreatmentArm.PLACEBO, field);
        ArmStatistics activeStats = armStatistics(TreatmentArm.ACTIVE, active);
        ArmStatistics placeboStats = armStatistics(TreatmentArm.PLACEBO, placebo);

        double difference = activeStats.mean() - placeboStats.mean();
        double activeVarianceOfMean = square(activeStats.std()) / active.length;
        double placeboVarianceOfMean = square(placeboStats.std()) / placebo.length;
        double seDifference = Math.sqrt(activeVarianceOfMean + placeboVarianceOfMean);

        double tStatistic;
        double degreesOfFreedom;
        double pValue;
        double ciLower;
        double ciUpper;
        if (seDifference == 0.0) {
            // both arms constant, the test is undefined
            degreesOfFreedom = active.length + placebo.length - 2;
            tStatistic = difference == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, difference);
            pValue = difference == 0.0 ? 1.0 : 0.0;
            ciLower = difference;
            ciUpper = difference;
        } else {
            TTest tTest = new TTest();
            tStatistic = tTest.t(active, placebo);
            pValue = tTest.tTest(active, placebo);
            degreesOfFreedom = square(activeVarianceOfMean + placeboVarianceOfMean)
                / (square(activeVarianceOfMean) / (active.length - 1) + square(placeboVarianceOfMean) / (placebo.length - 1));
            double critical = new TDistribution(degreesOfFreedom).inverseCumulativeProbability(1 - ALPHA / 2);
            ciLower = difference - critical * seDifference;
            ciUpper = difference + critical * seDifference;
        }
        boolean significant = pValue < ALPHA;

        double pooledStd = Math.sqrt(
            ((active.length - 1) * square(activeStats.std()) + (placebo.length - 1) * square(placeboStats.std()))
                / (active.length + placebo.length - 2)
        );
        double cohensD = pooledStd > 0 ? Math.abs(difference) / pooledStd : 0.0;

        log.info(
            "{} at {}: difference {} (95% CI {} to {}), t={}, df={}, p={}", field.columnName(), visit.label(), difference, ciLower, ciUpper,
            tStatistic, degreesOfFreedom, pValue
        );
        return new TreatmentEffectResult(
            visit, field, activeStats, placeboStats, difference, seDifference, tStatistic, degreesOfFreedom, pValue, ciLower, ciUpper,
            significant, cohensD, EffectSizeCategory.of(cohensD), ClinicalRelevance.of(difference, significant)
        );
    }

    private static double[] values(List<VitalsRecord> records, TreatmentArm arm, VitalField field) {
        return records.stream().filter(record -> record.treatmentArm() == arm).mapToDouble(record -> record.get(field)).toArray();
    }

    private static ArmStatistics armStatistics(TreatmentArm arm, double[] values) {
        double std = VitalsMatrix.sampleStd(values);
        return new ArmStatistics(arm, values.length, VitalsMatrix.mean(values), std, std / Math.sqrt(values.length));
    }

    private static double square(double value) {
        return value * value;
    }
}
