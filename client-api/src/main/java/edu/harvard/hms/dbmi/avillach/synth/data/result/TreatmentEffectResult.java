package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Welch two-sample comparison of Active against Placebo. Differences are Active minus Placebo.
 */
public record TreatmentEffectResult(
    @Schema(description = "Visit the arms were compared at") @JsonProperty("visit") VisitName visit,
    @Schema(description = "Column that was compared") @JsonProperty("field") VitalField field,
    @JsonProperty("active") ArmStatistics active,
    @JsonProperty("placebo") ArmStatistics placebo,
    @Schema(description = "Mean difference, Active minus Placebo") @JsonProperty("difference") double difference,
    @JsonProperty("se_difference") double seDifference,
    @JsonProperty("t_statistic") double tStatistic,
    @Schema(description = "Welch-Satterthwaite degrees of freedom") @JsonProperty("degrees_of_freedom") double degreesOfFreedom,
    @Schema(description = "Two-sided p-value") @JsonProperty("p_value") double pValue,
    @JsonProperty("ci_95_lower") double ci95Lower,
    @JsonProperty("ci_95_upper") double ci95Upper,
    @Schema(description = "True when p_value < 0.05") @JsonProperty("significant") boolean significant,
    @Schema(description = "Absolute difference over the pooled standard deviation") @JsonProperty("cohens_d") double cohensD,
    @JsonProperty("effect_size") EffectSizeCategory effectSize,
    @JsonProperty("clinical_relevance") ClinicalRelevance clinicalRelevance
) {
}
