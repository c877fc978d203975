package edu.harvard.hms.dbmi.avillach.synth.data.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.EnumMap;
import java.util.Map;

/**
 * A fully validated generation request. Invalid values and invalid combinations (jitter for a method other than
 * bootstrap) are rejected here, so generators never see them.
 */
public record GenerationRequest(
    @Schema(description = "Subjects per arm", example = "50", requiredMode = Schema.RequiredMode.REQUIRED) @JsonProperty("n_per_arm") int nPerArm,
    @Schema(
        description = "Active minus Placebo systolic difference to inject at the endpoint visit, mmHg. Negative is a reduction", example = "-5.0"
    ) @JsonProperty("target_effect") double targetEffect,
    @Schema(description = "Seed for reproducible output. A random seed is used when absent") @JsonProperty("seed") Long seed,
    @Schema(description = "Generation method", requiredMode = Schema.RequiredMode.REQUIRED) @JsonProperty("method") GenerationMethod method,
    @Schema(
        description = "Jitter scale as a fraction of each column's standard deviation. Bootstrap only, defaults to 0.05", example = "0.05"
    ) @JsonProperty("jitter_frac") Double jitterFrac,
    @Schema(
        description = "Per-field baseline statistics from an upstream provider, used by the rules method"
    ) @JsonProperty("prior_overrides") Map<VitalField, FieldPrior> priorOverrides
) {

    public static final double DEFAULT_JITTER_FRACTION = 0.05;

    public GenerationRequest {
        Preconditions.checkArgument(nPerArm > 0, "n_per_arm must be positive, was %s", nPerArm);
        Preconditions.checkArgument(Double.isFinite(targetEffect), "target_effect must be finite");
        Preconditions.checkArgument(method != null, "method is required");
        if (method == GenerationMethod.BOOTSTRAP) {
            jitterFrac = jitterFrac == null ? DEFAULT_JITTER_FRACTION : jitterFrac;
            Preconditions.checkArgument(jitterFrac >= 0.0 && jitterFrac <= 1.0, "jitter_frac must be in [0, 1], was %s", jitterFrac);
        } else {
            Preconditions.checkArgument(jitterFrac == null, "jitter_frac only applies to the bootstrap method, not %s", method.key());
        }
        priorOverrides = priorOverrides == null || priorOverrides.isEmpty() ? ImmutableMap.of()
            : Maps.immutableEnumMap(new EnumMap<>(priorOverrides));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int nPerArm = 50;
        private double targetEffect = -5.0;
        private Long seed;
        private GenerationMethod method = GenerationMethod.MVN;
        private Double jitterFrac;
        private final Map<VitalField, FieldPrior> priorOverrides = new EnumMap<>(VitalField.class);

        public Builder nPerArm(int nPerArm) {
            this.nPerArm = nPerArm;
            return this;
        }

        public Builder targetEffect(double targetEffect) {
            this.targetEffect = targetEffect;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder method(GenerationMethod method) {
            this.method = method;
            return this;
        }

        public Builder jitterFrac(Double jitterFrac) {
            this.jitterFrac = jitterFrac;
            return this;
        }

        public Builder priorOverride(VitalField field, FieldPrior prior) {
            this.priorOverrides.put(field, prior);
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(nPerArm, targetEffect, seed, method, jitterFrac, priorOverrides);
        }
    }
}
