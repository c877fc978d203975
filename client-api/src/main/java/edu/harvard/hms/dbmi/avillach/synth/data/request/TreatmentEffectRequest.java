package edu.harvard.hms.dbmi.avillach.synth.data.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record TreatmentEffectRequest(
    @Schema(description = "Records to analyse; only those at `visit` are used") @JsonProperty("vitals_data") List<VitalsRecord> vitalsData,
    @Schema(description = "Visit to compare the arms at, defaults to the endpoint visit", example = "Week 12") @JsonProperty("visit") VisitName visit,
    @Schema(description = "Column to compare, defaults to SystolicBP", example = "SystolicBP") @JsonProperty("field") VitalField field
) {

    public TreatmentEffectRequest {
        vitalsData = vitalsData == null ? List.of() : List.copyOf(vitalsData);
        visit = visit == null ? VisitName.endpoint() : visit;
        field = field == null ? VitalField.SYSTOLIC_BP : field;
    }

    public TreatmentEffectRequest(List<VitalsRecord> vitalsData) {
        this(vitalsData, null, null);
    }
}
