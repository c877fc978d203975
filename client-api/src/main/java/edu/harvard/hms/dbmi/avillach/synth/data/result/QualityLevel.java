package edu.harvard.hms.dbmi.avillach.synth.data.result;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Locale;

/**
 * Fixed classification bands for the composite quality score.
 */
public enum QualityLevel {
    @Schema(description = "Score of at least 0.85")
    EXCELLENT(0.85, "EXCELLENT", "Production ready"), @Schema(description = "Score of at least 0.70 and below 0.85")
    GOOD(0.70, "GOOD", "Minor adjustments needed"), @Schema(description = "Score below 0.70")
    NEEDS_IMPROVEMENT(Double.NEGATIVE_INFINITY, "NEEDS IMPROVEMENT", "Review parameters");

    private final double lowerBound;
    private final String label;
    private final String advice;

    QualityLevel(double lowerBound, String label, String advice) {
        this.lowerBound = lowerBound;
        this.label = label;
        this.advice = advice;
    }

    public static QualityLevel classify(double score) {
        for (QualityLevel level : values()) {
            if (score >= level.lowerBound) {
                return level;
            }
        }
        return NEEDS_IMPROVEMENT;
    }

    public String summarize(double score) {
        return String.format(Locale.ROOT, "%s - Quality score: %.2f - %s", label, score, advice);
    }
}
