package edu.harvard.hms.dbmi.avillach.synth.processing.constraint;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.RangeViolationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings records inside the clinical ranges and restores the systolic/diastolic margin. Every field is clipped first,
 * then the differential is fixed, so the result always satisfies {@link #verify(List)}.
 */
@Component
public class ConstraintEnforcer {

    public List<VitalsRecord> enforce(List<VitalsRecord> records) {
        return records.stream().map(this::enforce).collect(ImmutableList.toImmutableList());
    }

    public VitalsRecord enforce(VitalsRecord record) {
        double[] values = record.numericValues();
        for (VitalField field : VitalField.columns()) {
            values[field.ordinal()] = field.clip(values[field.ordinal()]);
        }
        int sbp = VitalField.SYSTOLIC_BP.ordinal();
        int dbp = VitalField.DIASTOLIC_BP.ordinal();
        if (values[sbp] - values[dbp] < VitalField.MIN_BP_DIFFERENTIAL) {
            if (values[dbp] - values[sbp] >= VitalField.MIN_BP_DIFFERENTIAL) {
                double systolic = values[sbp];
                values[sbp] = values[dbp];
                values[dbp] = systolic;
            } else {
                values[dbp] = VitalField.DIASTOLIC_BP.clip(values[sbp] - VitalField.MIN_BP_DIFFERENTIAL);
            }
        }
        VitalsRecord enforced = VitalsRecord.fromValues(record.subjectId(), record.visitName(), record.treatmentArm(), values);
        return enforced.equals(record) ? record : enforced;
    }

    /**
     * @throws RangeViolationException naming every record and field outside its range or below the BP margin
     */
    public void verify(List<VitalsRecord> records) {
        Map<String, List<String>> violations = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            VitalsRecord record = records.get(i);
            List<String> problems = new ArrayList<>();
            for (VitalField field : VitalField.columns()) {
                double value = record.get(field);
                if (!field.inRange(value)) {
                    problems.add(field.columnName() + "=" + value + " outside [" + field.min() + ", " + field.max() + "]");
                }
            }
            if (record.bpDifferential() < VitalField.MIN_BP_DIFFERENTIAL) {
                problems.add("SystolicBP - DiastolicBP = " + record.bpDifferential() + " below " + VitalField.MIN_BP_DIFFERENTIAL);
            }
            if (!problems.isEmpty()) {
                violations.put("record[" + i + "] " + record.subjectId() + " " + record.visitName().label(), problems);
            }
        }
        if (!violations.isEmpty()) {
            throw new RangeViolationException(violations);
        }
    }
}
