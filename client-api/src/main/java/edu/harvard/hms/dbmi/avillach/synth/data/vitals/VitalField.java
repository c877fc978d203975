package edu.harvard.hms.dbmi.avillach.synth.data.vitals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;
import java.util.List;

/**
 * The numeric vitals columns, each with its closed clinical interval and native precision. Declaration order is the
 * column order used for every matrix built from records.
 */
@Schema(description = "Numeric vitals column", example = "SystolicBP")
public enum VitalField {
    SYSTOLIC_BP("SystolicBP", 95, 200, true), DIASTOLIC_BP("DiastolicBP", 55, 130, true), HEART_RATE("HeartRate", 50, 120, true),
    TEMPERATURE("Temperature", 35.0, 40.0, false);

    /**
     * Minimum gap between systolic and diastolic pressure, in mmHg.
     */
    public static final int MIN_BP_DIFFERENTIAL = 5;

    private static final List<VitalField> COLUMNS = List.of(values());

    private final String columnName;
    private final double min;
    private final double max;
    private final boolean integral;

    VitalField(String columnName, double min, double max, boolean integral) {
        this.columnName = columnName;
        this.min = min;
        this.max = max;
        this.integral = integral;
    }

    @JsonValue
    public String columnName() {
        return columnName;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public boolean isIntegral() {
        return integral;
    }

    public static List<VitalField> columns() {
        return COLUMNS;
    }

    public boolean inRange(double value) {
        return value >= min && value <= max;
    }

    public double clip(double value) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Rounds half-up to whole units for integral fields and to one decimal for temperature.
     */
    public double round(double value) {
        if (integral) {
            return Math.round(value);
        }
        return Math.round(value * 10.0) / 10.0;
    }

    @JsonCreator
    public static VitalField fromColumnName(String columnName) {
        return Arrays.stream(values()).filter(field -> field.columnName.equalsIgnoreCase(columnName) || field.name().equalsIgnoreCase(columnName))
            .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown vitals column: " + columnName));
    }

    @Override
    public String toString() {
        return columnName;
    }
}
