package edu.harvard.hms.dbmi.avillach.synth.processing.fidelity;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * First Wasserstein distance between two one-dimensional empirical distributions, computed exactly as the area
 * between their CDFs.
 */
public final class WassersteinDistance {

    private WassersteinDistance() {
    }

    public static double between(double[] first, double[] second) {
        Preconditions.checkArgument(first.length > 0 && second.length > 0, "Wasserstein distance needs two non-empty samples");
        double[] a = first.clone();
        double[] b = second.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        double[] all = new double[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        Arrays.sort(all);

        double distance = 0.0;
        int ia = 0;
        int ib = 0;
        for (int i = 0; i < all.length - 1; i++) {
            double x = all[i];
            while (ia < a.length && a[ia] <= x) {
                ia++;
            }
            while (ib < b.length && b[ib] <= x) {
                ib++;
            }
            double width = all[i + 1] - x;
            if (width > 0) {
                distance += Math.abs((double) ia / a.length - (double) ib / b.length) * width;
            }
        }
        return distance;
    }
}
