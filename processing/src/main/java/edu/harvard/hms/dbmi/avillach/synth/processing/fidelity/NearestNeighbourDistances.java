package edu.harvard.hms.dbmi.avillach.synth.processing.fidelity;

import edu.harvard.hms.dbmi.avillach.synth.data.result.DistanceSummary;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Distance from each of the first reference rows to its closest synthetic row, in raw clinical units. Very small
 * distances suggest synthetic rows copy reference rows.
 */
public final class NearestNeighbourDistances {

    public static final int MAX_REFERENCE_ROWS = 100;

    private NearestNeighbourDistances() {
    }

    public static DistanceSummary summarize(double[][] reference, double[][] synthetic) {
        int rows = Math.min(MAX_REFERENCE_ROWS, reference.length);
        double[] nearest = new double[rows];
        for (int i = 0; i < rows; i++) {
            double best = Double.POSITIVE_INFINITY;
            for (double[] candidate : synthetic) {
                best = Math.min(best, euclidean(reference[i], candidate));
            }
            nearest[i] = best;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(nearest);
        return new DistanceSummary(
            stats.getMean(), stats.getPercentile(50), stats.getMin(), stats.getMax(), new StandardDeviation(false).evaluate(nearest)
        );
    }

    static double euclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
