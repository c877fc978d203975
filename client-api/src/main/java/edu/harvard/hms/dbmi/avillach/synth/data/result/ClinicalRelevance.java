package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A reduction of 5 mmHg or more is treated as clinically meaningful; it only counts as clinically significant when the
 * test is also significant.
 */
public enum ClinicalRelevance {
    CLINICALLY_SIGNIFICANT("clinically significant"), BORDERLINE("borderline"), NOT_CLINICALLY_MEANINGFUL("not clinically meaningful");

    public static final double MEANINGFUL_DIFFERENCE = 5.0;

    private final String label;

    ClinicalRelevance(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ClinicalRelevance of(double difference, boolean significant) {
        if (Math.abs(difference) >= MEANINGFUL_DIFFERENCE) {
            return significant ? CLINICALLY_SIGNIFICANT : BORDERLINE;
        }
        return NOT_CLINICALLY_MEANINGFUL;
    }
}
