package edu.harvard.hms.dbmi.avillach.synth.etl.reference;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.RawVitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairAction;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairType;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.SchemaException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

class ReferenceRepairerTest {

    private final ReferenceRepairer repairer = new ReferenceRepairer();

    @Test
    void shouldRemoveDuplicateAndClipSystolic() {
        List<RawVitalsRecord> raw = new ArrayList<>(cleanSubject("RA001-001", "Active", 120));
        raw.addAll(cleanSubject("RA001-002", "Placebo", 130));
        raw.add(raw(raw.get(1).subjectId(), "Day 1", "Active", 150.0, 80.0, 70.0, 36.6));
        raw.set(5, raw("RA001-002", "Day 1", "Placebo", 300.0, 85.0, 72.0, 36.7));

        ReferenceDataset dataset = repairer.repair(raw);

        Assertions.assertEquals(8, dataset.size());
        Assertions.assertEquals(2, dataset.repairReport().actions().size());
        RepairAction duplicates = dataset.repairReport().find(RepairType.REMOVE_DUPLICATES).orElseThrow();
        Assertions.assertEquals(1, duplicates.count());
        RepairAction clipped = dataset.repairReport().find(RepairType.CLIP_TO_RANGE).orElseThrow();
        Assertions.assertEquals(VitalField.SYSTOLIC_BP, clipped.field());
        Assertions.assertEquals(1, clipped.count());
        Assertions.assertTrue(dataset.records().stream().allMatch(record -> record.systolicBp() <= 200));
        // the first Day 1 row for RA001-001 wins
        VitalsRecord kept = find(dataset, "RA001-001", VisitName.DAY_1);
        Assertions.assertEquals(121, kept.systolicBp());
    }

    @Test
    void shouldBeIdempotent() {
        List<RawVitalsRecord> raw = new ArrayList<>(cleanSubject("RA001-001", "Active", 120));
        raw.add(raw("RA001-001", "Week 4", "Placebo", 90.0, 100.0, null, 41.2));
        raw.add(raw("RA001-003", "Screening", "Placebo", null, 60.0, 65.0, 36.9));
        raw.add(raw("RA001-003", "Day 1", "Placebo", 118.0, 116.0, 130.0, null));

        ReferenceDataset first = repairer.repair(raw);
        List<RawVitalsRecord> again = first.records().stream().map(RawVitalsRecord::of).collect(Collectors.toList());
        ReferenceDataset second = repairer.repair(again);

        Assertions.assertFalse(first.repairReport().isEmpty());
        Assertions.assertTrue(second.repairReport().isEmpty());
        Assertions.assertEquals(first.records(), second.records());
    }

    @Test
    void shouldReportNothingForCleanInput() {
        ReferenceDataset dataset = repairer.repair(cleanSubject("RA001-001", "Active", 125));

        Assertions.assertTrue(dataset.repairReport().isEmpty());
        Assertions.assertEquals(4, dataset.size());
    }

    @Test
    void shouldFailOnMissingIdentityFields() {
        List<RawVitalsRecord> raw = new ArrayList<>(cleanSubject("RA001-001", "Active", 120));
        raw.add(raw(null, "Day 1", "Active", 120.0, 80.0, 70.0, 36.6));
        raw.add(raw("RA001-004", "Week 8", "Control", 120.0, 80.0, 70.0, 36.6));

        SchemaException exception = Assertions.assertThrows(SchemaException.class, () -> repairer.repair(raw));

        Assertions.assertEquals(List.of("SubjectID is missing"), exception.getDetails().get("record[4]"));
        Assertions.assertEquals(2, exception.getDetails().get("record[5]").size());
        Assertions.assertFalse(exception.getDetails().containsKey("record[0]"));
    }

    @Test
    void shouldFailWhenColumnHasNoValues() {
        List<RawVitalsRecord> raw = List.of(
            raw("RA001-001", "Screening", "Active", 120.0, 80.0, 70.0, null), raw("RA001-002", "Screening", "Placebo", 122.0, 81.0, 71.0, null)
        );

        SchemaException exception = Assertions.assertThrows(SchemaException.class, () -> repairer.repair(raw));

        Assertions.assertEquals(List.of("Temperature"), exception.getDetails().get("columns"));
    }

    @Test
    void shouldAssignMostFrequentArm() {
        List<RawVitalsRecord> raw = List.of(
            raw("RA001-001", "Screening", "Active", 120.0, 80.0, 70.0, 36.6), raw("RA001-001", "Day 1", "Placebo", 121.0, 80.0, 70.0, 36.6),
            raw("RA001-001", "Week 4", "Placebo", 122.0, 80.0, 70.0, 36.6), raw("RA001-002", "Screening", "Placebo", 120.0, 80.0, 70.0, 36.6),
            raw("RA001-002", "Day 1", "Active", 121.0, 80.0, 70.0, 36.6)
        );

        ReferenceDataset dataset = repairer.repair(raw);

        Assertions.assertTrue(
            dataset.records().stream().filter(record -> record.subjectId().equals("RA001-001"))
                .allMatch(record -> record.treatmentArm() == TreatmentArm.PLACEBO)
        );
        // tie, first seen arm wins
        Assertions.assertTrue(
            dataset.records().stream().filter(record -> record.subjectId().equals("RA001-002"))
                .allMatch(record -> record.treatmentArm() == TreatmentArm.PLACEBO)
        );
        Assertions.assertEquals(2, dataset.repairReport().find(RepairType.FIX_TREATMENT_ARM).orElseThrow().count());
    }

    @Test
    void shouldImputeFromSubjectThenCohort() {
        List<RawVitalsRecord> raw = List.of(
            raw("RA001-001", "Screening", "Active", 120.0, 80.0, 70.0, 36.6), raw("RA001-001", "Day 1", "Active", 125.0, 80.0, 70.0, 36.6),
            raw("RA001-001", "Week 4", "Active", null, 80.0, 70.0, 36.6), raw("RA001-002", "Screening", "Placebo", 140.0, 80.0, 70.0, 36.6),
            raw("RA001-003", "Screening", "Placebo", null, 80.0, 70.0, 36.6)
        );

        ReferenceDataset dataset = repairer.repair(raw);

        // subject median of 120 and 125 rounds half up
        Assertions.assertEquals(123, find(dataset, "RA001-001", VisitName.WEEK_4).systolicBp());
        // cohort median of 120, 125, 140
        Assertions.assertEquals(125, find(dataset, "RA001-003", VisitName.SCREENING).systolicBp());
        RepairAction imputed = dataset.repairReport().find(RepairType.IMPUTE_MISSING).orElseThrow();
        Assertions.assertEquals(VitalField.SYSTOLIC_BP, imputed.field());
        Assertions.assertEquals(2, imputed.count());
    }

    @Test
    void shouldSwapAndWidenBloodPressure() {
        List<RawVitalsRecord> raw = List.of(
            raw("RA001-001", "Screening", "Active", 90.0, 120.0, 70.0, 36.6), raw("RA001-001", "Day 1", "Active", 110.0, 108.0, 70.0, 36.6),
            raw("RA001-001", "Week 4", "Active", 100.0, 100.0, 70.0, 36.6)
        );

        ReferenceDataset dataset = repairer.repair(raw);

        VitalsRecord swapped = find(dataset, "RA001-001", VisitName.SCREENING);
        Assertions.assertEquals(120, swapped.systolicBp());
        Assertions.assertEquals(95, swapped.diastolicBp());
        VitalsRecord widened = find(dataset, "RA001-001", VisitName.DAY_1);
        Assertions.assertEquals(110, widened.systolicBp());
        Assertions.assertEquals(105, widened.diastolicBp());
        VitalsRecord equal = find(dataset, "RA001-001", VisitName.WEEK_4);
        Assertions.assertEquals(100, equal.systolicBp());
        Assertions.assertEquals(95, equal.diastolicBp());
        Assertions.assertEquals(2, dataset.repairReport().find(RepairType.SWAP_BP_VALUES).orElseThrow().count());
        Assertions.assertEquals(2, dataset.repairReport().find(RepairType.ADJUST_BP_DIFFERENTIAL).orElseThrow().count());
        Assertions.assertTrue(dataset.records().stream().allMatch(record -> record.bpDifferential() >= VitalField.MIN_BP_DIFFERENTIAL));
    }

    @Test
    void shouldReportRoundingToNativePrecision() {
        List<RawVitalsRecord> raw = new ArrayList<>(cleanSubject("RA001-001", "Active", 120));
        raw.set(1, raw("RA001-001", "Day 1", "Active", 120.4, 80.0, 71.6, 36.84));

        ReferenceDataset dataset = repairer.repair(raw);

        Assertions.assertEquals(3, dataset.repairReport().actions().size());
        Assertions.assertTrue(dataset.repairReport().actions().stream().allMatch(action -> action.type() == RepairType.ROUND_TO_PRECISION));
        Assertions.assertEquals(VitalField.SYSTOLIC_BP, dataset.repairReport().find(RepairType.ROUND_TO_PRECISION).orElseThrow().field());
        VitalsRecord rounded = find(dataset, "RA001-001", VisitName.DAY_1);
        Assertions.assertEquals(120, rounded.systolicBp());
        Assertions.assertEquals(72, rounded.heartRate());
        Assertions.assertEquals(36.8, rounded.temperature());
    }

    private static VitalsRecord find(ReferenceDataset dataset, String subjectId, VisitName visit) {
        return dataset.records().stream().filter(record -> record.subjectId().equals(subjectId) && record.visitName() == visit).findFirst()
            .orElseThrow();
    }

    private static List<RawVitalsRecord> cleanSubject(String subjectId, String arm, int baseSbp) {
        List<RawVitalsRecord> rows = new ArrayList<>();
        for (VisitName visit : VisitName.sequence()) {
            rows.add(raw(subjectId, visit.label(), arm, (double) baseSbp + visit.index(), 80.0, 72.0, 36.8));
        }
        return rows;
    }

    private static RawVitalsRecord raw(String subjectId, String visit, String arm, Double sbp, Double dbp, Double hr, Double temp) {
        return new RawVitalsRecord(subjectId, visit, arm, sbp, dbp, hr, temp);
    }
}
