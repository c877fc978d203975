package edu.harvard.hms.dbmi.avillach.synth.data.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;

public enum GenerationMethod {
    @Schema(description = "Multivariate normal fitted per visit and arm from the reference dataset")
    MVN("mvn"), @Schema(description = "Resampling of reference rows with Gaussian jitter")
    BOOTSTRAP("bootstrap"), @Schema(description = "Independent draws from fixed per-field priors; needs no reference data")
    RULES("rules");

    private final String key;

    GenerationMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static GenerationMethod fromKey(String key) {
        return Arrays.stream(values()).filter(method -> method.key.equalsIgnoreCase(key) || method.name().equalsIgnoreCase(key)).findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown generation method: " + key));
    }
}
