package edu.harvard.hms.dbmi.avillach.synth.processing.effect;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.processing.ReferenceFixtures;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

class TreatmentEffectInjectorTest {

    private final List<VitalsRecord> records = ReferenceFixtures.records(10, 21L, 0.0);

    @Test
    void shouldShiftOnlyActiveEndpointByDefault() {
        TreatmentEffectInjector injector = new TreatmentEffectInjector("endpoint", "additive", new ConstraintEnforcer());
        List<VitalsRecord> copy = new ArrayList<>(records);

        List<VitalsRecord> shifted = injector.injectEffect(records, -5.0, VisitName.WEEK_12);

        Assertions.assertEquals(copy, records);
        for (int i = 0; i < records.size(); i++) {
            VitalsRecord before = records.get(i);
            VitalsRecord after = shifted.get(i);
            int expected = before.treatmentArm() == TreatmentArm.ACTIVE && before.visitName() == VisitName.WEEK_12 ? before.systolicBp() - 5
                : before.systolicBp();
            Assertions.assertEquals(expected, after.systolicBp());
            Assertions.assertEquals(before.diastolicBp(), after.diastolicBp());
        }
    }

    @Test
    void shouldRampLinearlyToEndpoint() {
        TreatmentEffectInjector injector = new TreatmentEffectInjector(EffectOnset.LINEAR, EffectCalibration.ADDITIVE, new ConstraintEnforcer());

        List<VitalsRecord> shifted = injector.injectEffect(records, -6.0, VisitName.WEEK_12);

        Assertions.assertEquals(0.0, difference(shifted, VisitName.SCREENING) - difference(records, VisitName.SCREENING), 1e-9);
        Assertions.assertEquals(-2.0, difference(shifted, VisitName.DAY_1) - difference(records, VisitName.DAY_1), 1e-9);
        Assertions.assertEquals(-4.0, difference(shifted, VisitName.WEEK_4) - difference(records, VisitName.WEEK_4), 1e-9);
        Assertions.assertEquals(-6.0, difference(shifted, VisitName.WEEK_12) - difference(records, VisitName.WEEK_12), 1e-9);
    }

    @Test
    void shouldSnapObservedDifferenceToTarget() {
        List<VitalsRecord> imbalanced = ReferenceFixtures.records(10, 21L, 8.0);
        TreatmentEffectInjector injector = new TreatmentEffectInjector(EffectOnset.ENDPOINT, EffectCalibration.SNAP, new ConstraintEnforcer());

        List<VitalsRecord> shifted = injector.injectEffect(imbalanced, -5.0, VisitName.WEEK_12);

        // per-record rounding moves the mean by at most half a unit
        Assertions.assertEquals(-5.0, difference(shifted, VisitName.WEEK_12), 0.5);
    }

    @Test
    void shouldRejectUnknownOnset() {
        Assertions.assertThrows(
            IllegalArgumentException.class, () -> new TreatmentEffectInjector("sigmoid", "additive", new ConstraintEnforcer())
        );
    }

    @Test
    void shouldComputeOnsetFractions() {
        Assertions.assertEquals(0.0, EffectOnset.ENDPOINT.fraction(VisitName.WEEK_4, VisitName.WEEK_12));
        Assertions.assertEquals(1.0, EffectOnset.ENDPOINT.fraction(VisitName.WEEK_12, VisitName.WEEK_12));
        Assertions.assertEquals(0.5, EffectOnset.LINEAR.fraction(VisitName.DAY_1, VisitName.WEEK_4));
        Assertions.assertEquals(0.0, EffectOnset.LINEAR.fraction(VisitName.WEEK_12, VisitName.WEEK_4));
    }

    private static double difference(List<VitalsRecord> records, VisitName visit) {
        return mean(records, visit, TreatmentArm.ACTIVE) - mean(records, visit, TreatmentArm.PLACEBO);
    }

    private static double mean(List<VitalsRecord> records, VisitName visit, TreatmentArm arm) {
        return records.stream().filter(record -> record.visitName() == visit && record.treatmentArm() == arm).mapToInt(VitalsRecord::systolicBp)
            .average().orElseThrow();
    }
}
