package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Conventional Cohen's d bands.
 */
public enum EffectSizeCategory {
    NEGLIGIBLE("negligible"), SMALL("small"), MEDIUM("medium"), LARGE("large");

    private final String label;

    EffectSizeCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static EffectSizeCategory of(double cohensD) {
        double d = Math.abs(cohensD);
        if (d < 0.2) {
            return NEGLIGIBLE;
        } else if (d < 0.5) {
            return SMALL;
        } else if (d < 0.8) {
            return MEDIUM;
        }
        return LARGE;
    }
}
