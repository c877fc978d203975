package edu.harvard.hms.dbmi.avillach.synth.etl.reference;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RawVitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairAction;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairReport;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairType;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a raw study extract into clean reference records. Fixes are applied in a fixed order: duplicates, treatment
 * arms, missing values, ranges, then the blood pressure differential. Values finer than a column's native precision are
 * rounded while parsing and reported as a repair too. Running the repairer over its own output changes
 * nothing and reports nothing.
 */
public class ReferenceRepairer {

    private static final Logger log = LoggerFactory.getLogger(ReferenceRepairer.class);

    private static final List<VitalField> FIELDS = VitalField.columns();

    public ReferenceDataset repair(List<RawVitalsRecord> rawRecords) {
        List<RepairAction> actions = new ArrayList<>();
        List<Row> rows = parseIdentities(rawRecords, actions);

        rows = removeDuplicates(rows, actions);
        fixTreatmentArms(rows, actions);
        imputeMissing(rows, actions);
        clipToRange(rows, actions);
        fixBpDifferential(rows, actions);

        List<VitalsRecord> records = rows.stream().map(Row::toRecord).collect(ImmutableList.toImmutableList());
        RepairReport report = new RepairReport(actions);
        actions.forEach(action -> log.info("Repair {}: {}", action.type(), action.description()));
        if (report.isEmpty()) {
            log.info("Reference data needed no repair, {} records", records.size());
        } else {
            log.info(
                "Repaired reference data: {} input records, {} clean records, {} fixes across {} actions", rawRecords.size(), records.size(),
                report.totalFixes(), actions.size()
            );
        }
        return new ReferenceDataset(records, report);
    }

    private List<Row> parseIdentities(List<RawVitalsRecord> rawRecords, List<RepairAction> actions) {
        Map<String, List<String>> problems = new LinkedHashMap<>();
        int[] rounded = new int[FIELDS.size()];
        List<Row> rows = new ArrayList<>(rawRecords.size());
        for (int i = 0; i < rawRecords.size(); i++) {
            RawVitalsRecord raw = rawRecords.get(i);
            List<String> recordProblems = new ArrayList<>();
            if (raw.subjectId() == null || raw.subjectId().isBlank()) {
                recordProblems.add("SubjectID is missing");
            }
            Optional<VisitName> visit = VisitName.parse(raw.visitName());
            if (visit.isEmpty()) {
                recordProblems.add(raw.visitName() == null ? "VisitName is missing" : "VisitName '" + raw.visitName() + "' is not recognised");
            }
            Optional<TreatmentArm> arm = TreatmentArm.parse(raw.treatmentArm());
            if (arm.isEmpty()) {
                recordProblems.add(
                    raw.treatmentArm() == null ? "TreatmentArm is missing" : "TreatmentArm '" + raw.treatmentArm() + "' is not recognised"
                );
            }
            if (!recordProblems.isEmpty()) {
                problems.put("record[" + i + "]", recordProblems);
                continue;
            }
            Double[] values = new Double[FIELDS.size()];
            for (VitalField field : FIELDS) {
                Double value = raw.get(field);
                if (value == null || value.isNaN()) {
                    continue;
                }
                double nativeValue = field.round(value);
                if (nativeValue != value) {
                    rounded[field.ordinal()]++;
                }
                values[field.ordinal()] = nativeValue;
            }
            rows.add(new Row(raw.subjectId().trim(), visit.get(), arm.get(), values));
        }
        if (!problems.isEmpty()) {
            throw new SchemaException("Reference records have missing or unrecognised identity fields", problems);
        }
        for (VitalField field : FIELDS) {
            int count = rounded[field.ordinal()];
            if (count > 0) {
                String precision = field.isIntegral() ? "whole units" : "one decimal";
                actions.add(
                    new RepairAction(
                        RepairType.ROUND_TO_PRECISION, field, count, "Rounded " + count + " " + field.columnName() + " values to " + precision
                    )
                );
            }
        }
        return rows;
    }

    private List<Row> removeDuplicates(List<Row> rows, List<RepairAction> actions) {
        Set<String> seen = new HashSet<>();
        List<Row> unique = new ArrayList<>(rows.size());
        for (Row row : rows) {
            if (seen.add(row.subjectId + "|" + row.visit.name())) {
                unique.add(row);
            }
        }
        int removed = rows.size() - unique.size();
        if (removed > 0) {
            actions.add(
                new RepairAction(
                    RepairType.REMOVE_DUPLICATES, null, removed, "Removed " + removed + " duplicate (SubjectID, VisitName) rows, kept the first"
                )
            );
        }
        return unique;
    }

    private void fixTreatmentArms(List<Row> rows, List<RepairAction> actions) {
        Map<String, Map<TreatmentArm, Integer>> armCounts = new LinkedHashMap<>();
        for (Row row : rows) {
            armCounts.computeIfAbsent(row.subjectId, id -> new LinkedHashMap<>()).merge(row.arm, 1, Integer::sum);
        }
        Map<String, TreatmentArm> resolved = new LinkedHashMap<>();
        armCounts.forEach((subjectId, counts) -> {
            if (counts.size() > 1) {
                TreatmentArm best = null;
                int bestCount = 0;
                // insertion order, so ties resolve to the arm seen first
                for (Map.Entry<TreatmentArm, Integer> entry : counts.entrySet()) {
                    if (entry.getValue() > bestCount) {
                        best = entry.getKey();
                        bestCount = entry.getValue();
                    }
                }
                resolved.put(subjectId, best);
            }
        });
        if (resolved.isEmpty()) {
            return;
        }
        for (Row row : rows) {
            TreatmentArm arm = resolved.get(row.subjectId);
            if (arm != null) {
                row.arm = arm;
            }
        }
        actions.add(
            new RepairAction(
                RepairType.FIX_TREATMENT_ARM, null, resolved.size(),
                "Set a single TreatmentArm for " + resolved.size() + " subjects: " + resolved
            )
        );
    }

    private void imputeMissing(List<Row> rows, List<RepairAction> actions) {
        if (rows.isEmpty()) {
            return;
        }
        Map<VitalField, Double> cohortMedians = new EnumMap<>(VitalField.class);
        List<String> emptyColumns = new ArrayList<>();
        for (VitalField field : FIELDS) {
            double[] present = rows.stream().map(row -> row.values[field.ordinal()]).filter(Objects::nonNull).mapToDouble(Double::doubleValue)
                .toArray();
            if (present.length == 0) {
                emptyColumns.add(field.columnName());
            } else {
                cohortMedians.put(field, median(present));
            }
        }
        if (!emptyColumns.isEmpty()) {
            throw new SchemaException("Reference data has no values for a required column", Map.of("columns", emptyColumns));
        }

        Map<String, List<Row>> bySubject = rows.stream().collect(Collectors.groupingBy(row -> row.subjectId, LinkedHashMap::new, Collectors.toList()));
        for (VitalField field : FIELDS) {
            int imputed = 0;
            int fromCohort = 0;
            for (List<Row> subjectRows : bySubject.values()) {
                double[] present = subjectRows.stream().map(row -> row.values[field.ordinal()]).filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue).toArray();
                for (Row row : subjectRows) {
                    if (row.values[field.ordinal()] == null) {
                        double fill = present.length > 0 ? median(present) : cohortMedians.get(field);
                        if (present.length == 0) {
                            fromCohort++;
                        }
                        row.values[field.ordinal()] = field.round(fill);
                        imputed++;
                    }
                }
            }
            if (imputed > 0) {
                actions.add(
                    new RepairAction(
                        RepairType.IMPUTE_MISSING, field, imputed,
                        "Imputed " + imputed + " missing " + field.columnName() + " values (" + fromCohort + " from the cohort median)"
                    )
                );
            }
        }
    }

    private void clipToRange(List<Row> rows, List<RepairAction> actions) {
        for (VitalField field : FIELDS) {
            int clipped = 0;
            for (Row row : rows) {
                double value = row.values[field.ordinal()];
                if (!field.inRange(value)) {
                    row.values[field.ordinal()] = field.clip(value);
                    clipped++;
                }
            }
            if (clipped > 0) {
                actions.add(
                    new RepairAction(
                        RepairType.CLIP_TO_RANGE, field, clipped,
                        "Clipped " + clipped + " " + field.columnName() + " values to [" + field.min() + ", " + field.max() + "]"
                    )
                );
            }
        }
    }

    private void fixBpDifferential(List<Row> rows, List<RepairAction> actions) {
        int sbp = VitalField.SYSTOLIC_BP.ordinal();
        int dbp = VitalField.DIASTOLIC_BP.ordinal();
        int swapped = 0;
        int adjusted = 0;
        for (Row row : rows) {
            if (row.values[sbp] <= row.values[dbp]) {
                Double systolic = row.values[sbp];
                row.values[sbp] = row.values[dbp];
                row.values[dbp] = systolic;
                swapped++;
            }
            if (row.values[sbp] - row.values[dbp] < VitalField.MIN_BP_DIFFERENTIAL) {
                row.values[dbp] = VitalField.DIASTOLIC_BP.clip(row.values[sbp] - VitalField.MIN_BP_DIFFERENTIAL);
                adjusted++;
            }
        }
        if (swapped > 0) {
            actions.add(
                new RepairAction(
                    RepairType.SWAP_BP_VALUES, null, swapped, "Swapped SystolicBP and DiastolicBP in " + swapped + " rows where SBP <= DBP"
                )
            );
        }
        if (adjusted > 0) {
            actions.add(
                new RepairAction(
                    RepairType.ADJUST_BP_DIFFERENTIAL, VitalField.DIASTOLIC_BP, adjusted,
                    "Set DiastolicBP to SystolicBP - " + VitalField.MIN_BP_DIFFERENTIAL + " in " + adjusted + " rows"
                )
            );
        }
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static class Row {
        private final String subjectId;
        private final VisitName visit;
        private TreatmentArm arm;
        private final Double[] values;

        private Row(String subjectId, VisitName visit, TreatmentArm arm, Double[] values) {
            this.subjectId = subjectId;
            this.visit = visit;
            this.arm = arm;
            this.values = values;
        }

        private VitalsRecord toRecord() {
            double[] numeric = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                numeric[i] = values[i];
            }
            return VitalsRecord.fromValues(subjectId, visit, arm, numeric);
        }
    }
}
