package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableMap;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@JsonPropertyOrder({
    "wasserstein_distances", "correlation_preservation", "rmse_by_column", "knn_imputation_score", "overall_quality_score", "quality_level",
    "summary", "euclidean_distances"})
public record QualityReport(
    @Schema(description = "1-D Wasserstein distance per numeric column, lower is better") @JsonProperty(
        "wasserstein_distances"
    ) Map<String, Double> wassersteinDistances,
    @Schema(description = "Similarity of the two correlation matrices, 0-1") @JsonProperty(
        "correlation_preservation"
    ) double correlationPreservation,
    @Schema(description = "Distance between per-column mean and std, lower is better") @JsonProperty(
        "rmse_by_column"
    ) Map<String, Double> rmseByColumn,
    @Schema(description = "Recovery accuracy of withheld reference values, 0-1") @JsonProperty(
        "knn_imputation_score"
    ) double knnImputationScore,
    @Schema(description = "Weighted composite of the metrics above, 0-1") @JsonProperty("overall_quality_score") double overallQualityScore,
    @Schema(description = "Band the composite score falls in") @JsonProperty("quality_level") QualityLevel qualityLevel,
    @Schema(description = "Human readable classification") @JsonProperty("summary") String summary,
    @Schema(description = "Nearest-neighbour distances from reference to synthetic rows") @JsonProperty(
        "euclidean_distances"
    ) DistanceSummary euclideanDistances
) {

    public QualityReport {
        wassersteinDistances = ImmutableMap.copyOf(wassersteinDistances);
        rmseByColumn = ImmutableMap.copyOf(rmseByColumn);
    }
}
