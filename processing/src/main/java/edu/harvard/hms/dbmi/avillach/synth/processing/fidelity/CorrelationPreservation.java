package edu.harvard.hms.dbmi.avillach.synth.processing.fidelity;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Compares the Pearson correlation matrices of two datasets. 1 means identical structure, 0 means every coefficient
 * is off by the maximum of 2. Undefined coefficients (a constant column) count as 0.
 */
public final class CorrelationPreservation {

    private CorrelationPreservation() {
    }

    public static double score(double[][] reference, double[][] synthetic) {
        double[][] expected = correlations(reference);
        double[][] observed = correlations(synthetic);
        double total = 0.0;
        int cells = 0;
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected.length; j++) {
                total += Math.abs(expected[i][j] - observed[i][j]);
                cells++;
            }
        }
        double score = 1.0 - (total / cells) / 2.0;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double[][] correlations(double[][] rows) {
        int columns = rows[0].length;
        double[][] matrix = new double[columns][columns];
        if (rows.length >= 2) {
            double[][] computed = new PearsonsCorrelation(rows).getCorrelationMatrix().getData();
            for (int i = 0; i < columns; i++) {
                for (int j = 0; j < columns; j++) {
                    matrix[i][j] = Double.isNaN(computed[i][j]) ? 0.0 : computed[i][j];
                }
            }
        }
        for (int i = 0; i < columns; i++) {
            matrix[i][i] = 1.0;
        }
        return matrix;
    }
}
