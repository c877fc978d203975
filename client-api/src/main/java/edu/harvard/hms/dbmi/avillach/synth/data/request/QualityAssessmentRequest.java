package edu.harvard.hms.dbmi.avillach.synth.data.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record QualityAssessmentRequest(
    @Schema(description = "Reference records") @JsonProperty("original_data") List<VitalsRecord> originalData,
    @Schema(description = "Synthetic records to score against the reference") @JsonProperty("synthetic_data") List<VitalsRecord> syntheticData,
    @Schema(description = "Neighbour count for the K-NN imputation score, defaults to 5", example = "5") @JsonProperty("k") Integer k
) {

    public static final int DEFAULT_K = 5;

    public QualityAssessmentRequest {
        originalData = originalData == null ? List.of() : List.copyOf(originalData);
        syntheticData = syntheticData == null ? List.of() : List.copyOf(syntheticData);
        k = k == null ? DEFAULT_K : k;
    }
}
