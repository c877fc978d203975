package edu.harvard.hms.dbmi.avillach.synth.processing.fidelity;

import com.google.common.base.Preconditions;
import com.google.common.collect.MinMaxPriorityQueue;
import edu.harvard.hms.dbmi.avillach.synth.processing.util.VitalsMatrix;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Measures how well synthetic rows stand in for reference rows when filling gaps. A fixed stride of reference cells is
 * withheld, one column per row in rotation, and each is imputed from its {@code k} nearest neighbours among the other
 * reference rows and all synthetic rows. Distances use the remaining columns scaled by the reference standard
 * deviation. The score is {@code 1 / (1 + mean absolute error in reference standard deviations)}.
 */
public class KnnImputationScorer {

    private final double withheldFraction;
    private final int maxWithheldCells;

    public KnnImputationScorer(double withheldFraction, int maxWithheldCells) {
        Preconditions.checkArgument(withheldFraction > 0 && withheldFraction <= 1, "Withheld fraction must be in (0, 1]");
        Preconditions.checkArgument(maxWithheldCells > 0, "At least one cell must be withheld");
        this.withheldFraction = withheldFraction;
        this.maxWithheldCells = maxWithheldCells;
    }

    public double score(double[][] reference, double[][] synthetic, int k) {
        int columns = reference[0].length;
        double[] scale = new double[columns];
        for (int column = 0; column < columns; column++) {
            double std = VitalsMatrix.sampleStd(column(reference, column));
            scale[column] = std > 0 ? std : 1.0;
        }

        int cells = withheldCells(reference.length);
        double stride = (double) reference.length / cells;
        // gathered by index so the parallel run sums in a fixed order
        double[] errors = IntStream.range(0, cells).parallel().mapToDouble(cell -> {
            int row = (int) Math.floor(cell * stride);
            int column = cell % columns;
            double imputed = impute(reference, synthetic, row, column, scale, k);
            return Math.abs(imputed - reference[row][column]) / scale[column];
        }).toArray();

        double meanError = Arrays.stream(errors).sum() / errors.length;
        return 1.0 / (1.0 + meanError);
    }

    int withheldCells(int rows) {
        int cells = (int) Math.round(rows * withheldFraction);
        return Math.max(1, Math.min(Math.min(cells, maxWithheldCells), rows));
    }

    private static double impute(double[][] reference, double[][] synthetic, int withheldRow, int column, double[] scale, int k) {
        int poolSize = reference.length - 1 + synthetic.length;
        double[][] pool = new double[poolSize][];
        int next = 0;
        for (int i = 0; i < reference.length; i++) {
            if (i != withheldRow) {
                pool[next++] = reference[i];
            }
        }
        for (double[] row : synthetic) {
            pool[next++] = row;
        }

        double[] target = reference[withheldRow];
        double[] distances = new double[poolSize];
        for (int i = 0; i < poolSize; i++) {
            distances[i] = distance(target, pool[i], column, scale);
        }
        int[] order = nearest(distances, k);

        double exactSum = 0.0;
        int exactMatches = 0;
        for (int n = 0; n < order.length; n++) {
            int index = order[n];
            if (distances[index] == 0.0) {
                exactSum += pool[index][column];
                exactMatches++;
            }
        }
        if (exactMatches > 0) {
            return exactSum / exactMatches;
        }

        double weighted = 0.0;
        double weights = 0.0;
        for (int n = 0; n < order.length; n++) {
            int index = order[n];
            double weight = 1.0 / distances[index];
            weighted += weight * pool[index][column];
            weights += weight;
        }
        return weighted / weights;
    }

    /**
     * Indices of the {@code k} smallest distances, nearest first. Equal distances keep index order.
     */
    static int[] nearest(double[] distances, int k) {
        int neighbours = Math.min(k, distances.length);
        MinMaxPriorityQueue<Integer> closest = MinMaxPriorityQueue.orderedBy(
            Comparator.<Integer>comparingDouble(i -> distances[i]).thenComparingInt(i -> i)
        ).maximumSize(neighbours).create();
        for (int i = 0; i < distances.length; i++) {
            closest.offer(i);
        }
        int[] order = new int[neighbours];
        for (int n = 0; n < neighbours; n++) {
            order[n] = closest.pollFirst();
        }
        return order;
    }

    private static double distance(double[] a, double[] b, int skippedColumn, double[] scale) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            if (i != skippedColumn) {
                double diff = (a[i] - b[i]) / scale[i];
                sum += diff * diff;
            }
        }
        return Math.sqrt(sum);
    }

    private static double[] column(double[][] rows, int column) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][column];
        }
        return values;
    }
}
