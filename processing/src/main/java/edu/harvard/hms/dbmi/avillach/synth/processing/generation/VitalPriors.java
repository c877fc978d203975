package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import edu.harvard.hms.dbmi.avillach.synth.data.request.FieldPrior;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;

import java.util.EnumMap;
import java.util.Map;

/**
 * Population-level normal priors for adult trial vitals, used when no reference data describes a stratum.
 */
public final class VitalPriors {

    public static final Map<VitalField, FieldPrior> DEFAULTS = Maps.immutableEnumMap(
        ImmutableMap.of(
            VitalField.SYSTOLIC_BP, new FieldPrior(130.0, 10.0), VitalField.DIASTOLIC_BP, new FieldPrior(80.0, 8.0), VitalField.HEART_RATE,
            new FieldPrior(80.0, 10.0), VitalField.TEMPERATURE, new FieldPrior(36.8, 0.3)
        )
    );

    private VitalPriors() {
    }

    public static Map<VitalField, FieldPrior> withOverrides(Map<VitalField, FieldPrior> overrides) {
        EnumMap<VitalField, FieldPrior> priors = new EnumMap<>(DEFAULTS);
        priors.putAll(overrides);
        return Maps.immutableEnumMap(priors);
    }

    public static double[] means() {
        return VitalField.columns().stream().mapToDouble(field -> DEFAULTS.get(field).mean()).toArray();
    }

    /**
     * Diagonal covariance built from the default standard deviations.
     */
    public static double[][] diagonalCovariance() {
        int size = VitalField.columns().size();
        double[][] covariance = new double[size][size];
        for (VitalField field : VitalField.columns()) {
            double std = DEFAULTS.get(field).std();
            covariance[field.ordinal()][field.ordinal()] = std * std;
        }
        return covariance;
    }
}
