package edu.harvard.hms.dbmi.avillach.synth.data.vitals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;
import java.util.Optional;

@Schema(description = "Study arm a subject is randomized to")
public enum TreatmentArm {
    ACTIVE("Active"), PLACEBO("Placebo");

    private final String label;

    TreatmentArm(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<TreatmentArm> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.trim();
        return Arrays.stream(values()).filter(arm -> arm.label.equalsIgnoreCase(key) || arm.name().equalsIgnoreCase(key)).findFirst();
    }

    @JsonCreator
    public static TreatmentArm fromLabel(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown treatment arm: " + raw));
    }

    @Override
    public String toString() {
        return label;
    }
}
