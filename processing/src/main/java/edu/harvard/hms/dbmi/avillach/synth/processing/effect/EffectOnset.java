package edu.harvard.hms.dbmi.avillach.synth.processing.effect;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;

import java.util.Arrays;
import java.util.Locale;

/**
 * How much of the target effect is present at each visit.
 */
public enum EffectOnset {
    /**
     * Only the endpoint visit is shifted.
     */
    ENDPOINT("endpoint"),
    /**
     * The effect grows linearly with visit index and is complete at the endpoint. Visits after the endpoint are left
     * alone.
     */
    LINEAR("linear");

    private final String key;

    EffectOnset(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public double fraction(VisitName visit, VisitName endpoint) {
        if (visit == endpoint) {
            return 1.0;
        }
        return switch (this) {
            case ENDPOINT -> 0.0;
            case LINEAR -> endpoint.index() == 0 || visit.index() > endpoint.index() ? 0.0 : (double) visit.index() / endpoint.index();
        };
    }

    public static EffectOnset fromKey(String key) {
        return Arrays.stream(values()).filter(onset -> onset.key.equals(key.trim().toLowerCase(Locale.ROOT))).findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown effect onset: " + key));
    }
}
