package edu.harvard.hms.dbmi.avillach.synth.processing.util;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;

/**
 * Numeric views over records. Rows are records, columns follow {@link VitalField#columns()}.
 */
public final class VitalsMatrix {

    private VitalsMatrix() {
    }

    public static double[][] rows(List<VitalsRecord> records) {
        double[][] matrix = new double[records.size()][];
        for (int i = 0; i < records.size(); i++) {
            matrix[i] = records.get(i).numericValues();
        }
        return matrix;
    }

    public static double[] column(List<VitalsRecord> records, VitalField field) {
        return records.stream().mapToDouble(record -> record.get(field)).toArray();
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : new Mean().evaluate(values);
    }

    /**
     * Bias-corrected standard deviation, 0 for fewer than two values.
     */
    public static double sampleStd(double[] values) {
        return values.length < 2 ? 0.0 : new StandardDeviation(true).evaluate(values);
    }

    public static double populationStd(double[] values) {
        return values.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(values);
    }
}
