package edu.harvard.hms.dbmi.avillach.synth.data.vitals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import edu.harvard.hms.dbmi.avillach.synth.exception.SchemaException;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One subject's vital signs at one visit. Integral fields hold whole units; temperature is in degrees Celsius.
 */
@JsonPropertyOrder({"SubjectID", "VisitName", "TreatmentArm", "SystolicBP", "DiastolicBP", "HeartRate", "Temperature"})
public record VitalsRecord(
    @Schema(description = "Subject identifier", example = "RA001-001") @JsonProperty("SubjectID") String subjectId,
    @Schema(description = "Visit the measurement belongs to") @JsonProperty("VisitName") VisitName visitName,
    @Schema(description = "Arm the subject is randomized to") @JsonProperty("TreatmentArm") TreatmentArm treatmentArm,
    @Schema(description = "Systolic blood pressure, mmHg, 95-200") @JsonProperty("SystolicBP") int systolicBp,
    @Schema(description = "Diastolic blood pressure, mmHg, 55-130") @JsonProperty("DiastolicBP") int diastolicBp,
    @Schema(description = "Heart rate, bpm, 50-120") @JsonProperty("HeartRate") int heartRate,
    @Schema(description = "Body temperature, degrees C, 35.0-40.0") @JsonProperty("Temperature") double temperature
) {

    /**
     * Binds a JSON object, rejecting it when any of the seven fields is absent or null.
     *
     * @throws SchemaException naming the missing fields, keyed by the subject when it is known
     */
    @JsonCreator
    public static VitalsRecord fromJson(
        @JsonProperty("SubjectID") String subjectId, @JsonProperty("VisitName") VisitName visitName,
        @JsonProperty("TreatmentArm") TreatmentArm treatmentArm, @JsonProperty("SystolicBP") Integer systolicBp,
        @JsonProperty("DiastolicBP") Integer diastolicBp, @JsonProperty("HeartRate") Integer heartRate,
        @JsonProperty("Temperature") Double temperature
    ) {
        List<String> missing = new ArrayList<>();
        if (subjectId == null || subjectId.isBlank()) {
            missing.add("SubjectID is missing");
        }
        if (visitName == null) {
            missing.add("VisitName is missing");
        }
        if (treatmentArm == null) {
            missing.add("TreatmentArm is missing");
        }
        if (systolicBp == null) {
            missing.add("SystolicBP is missing");
        }
        if (diastolicBp == null) {
            missing.add("DiastolicBP is missing");
        }
        if (heartRate == null) {
            missing.add("HeartRate is missing");
        }
        if (temperature == null || temperature.isNaN()) {
            missing.add("Temperature is missing");
        }
        if (!missing.isEmpty()) {
            String key = missing.contains("SubjectID is missing") ? "record" : subjectId;
            throw new SchemaException("Vitals record is missing required fields", Map.of(key, missing));
        }
        return new VitalsRecord(subjectId, visitName, treatmentArm, systolicBp, diastolicBp, heartRate, temperature);
    }

    public double get(VitalField field) {
        return switch (field) {
            case SYSTOLIC_BP -> systolicBp;
            case DIASTOLIC_BP -> diastolicBp;
            case HEART_RATE -> heartRate;
            case TEMPERATURE -> temperature;
        };
    }

    /**
     * Returns a copy with {@code field} set to {@code value}. Integral fields are rounded half-up, temperature is kept
     * as given. No clipping is applied.
     */
    public VitalsRecord with(VitalField field, double value) {
        double rounded = field.round(value);
        return switch (field) {
            case SYSTOLIC_BP -> new VitalsRecord(subjectId, visitName, treatmentArm, (int) rounded, diastolicBp, heartRate, temperature);
            case DIASTOLIC_BP -> new VitalsRecord(subjectId, visitName, treatmentArm, systolicBp, (int) rounded, heartRate, temperature);
            case HEART_RATE -> new VitalsRecord(subjectId, visitName, treatmentArm, systolicBp, diastolicBp, (int) rounded, temperature);
            case TEMPERATURE -> new VitalsRecord(subjectId, visitName, treatmentArm, systolicBp, diastolicBp, heartRate, value);
        };
    }

    /**
     * Builds a record from a numeric row in {@link VitalField#columns()} order, rounding each value to native precision.
     */
    public static VitalsRecord fromValues(String subjectId, VisitName visitName, TreatmentArm treatmentArm, double[] values) {
        return new VitalsRecord(
            subjectId, visitName, treatmentArm, (int) VitalField.SYSTOLIC_BP.round(values[0]), (int) VitalField.DIASTOLIC_BP.round(values[1]),
            (int) VitalField.HEART_RATE.round(values[2]), VitalField.TEMPERATURE.round(values[3])
        );
    }

    @JsonIgnore
    public double[] numericValues() {
        return new double[] {systolicBp, diastolicBp, heartRate, temperature};
    }

    @JsonIgnore
    public int bpDifferential() {
        return systolicBp - diastolicBp;
    }
}
