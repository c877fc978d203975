package edu.harvard.hms.dbmi.avillach.synth.processing.effect;

import java.util.Arrays;
import java.util.Locale;

public enum EffectCalibration {
    /**
     * Every Active value moves by the scaled target, whatever the arms already differ by.
     */
    ADDITIVE("additive"),
    /**
     * Active values move by the gap between the scaled target and the observed Active minus Placebo difference, so the
     * observed difference lands on the target before clipping.
     */
    SNAP("snap");

    private final String key;

    EffectCalibration(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static EffectCalibration fromKey(String key) {
        return Arrays.stream(values()).filter(calibration -> calibration.key.equals(key.trim().toLowerCase(Locale.ROOT))).findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown effect calibration: " + key));
    }
}
