package edu.harvard.hms.dbmi.avillach.synth.data.reference;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;

import javax.annotation.Nullable;

/**
 * A vitals row as it arrives from a study extract, before repair. Identity fields are kept as text so unknown codes
 * can be reported, and any numeric field may be missing.
 */
public record RawVitalsRecord(
    @Nullable String subjectId, @Nullable String visitName, @Nullable String treatmentArm, @Nullable Double systolicBp,
    @Nullable Double diastolicBp, @Nullable Double heartRate, @Nullable Double temperature
) {

    public static RawVitalsRecord of(VitalsRecord record) {
        return new RawVitalsRecord(
            record.subjectId(), record.visitName().label(), record.treatmentArm().label(), (double) record.systolicBp(),
            (double) record.diastolicBp(), (double) record.heartRate(), record.temperature()
        );
    }

    @Nullable
    public Double get(VitalField field) {
        return switch (field) {
            case SYSTOLIC_BP -> systolicBp;
            case DIASTOLIC_BP -> diastolicBp;
            case HEART_RATE -> heartRate;
            case TEMPERATURE -> temperature;
        };
    }
}
