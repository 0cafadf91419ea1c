package com.stochastic.sde.kernel;

/**
 * Dot products over stage arrays, used by the vectorized kernels.
 */
final class StageVectors {
    private StageVectors() {
    }

    /** @return {@code sum_j a[j] * b[j]} over the first {@code n} entries. */
    static double dot(double[] a, double[] b, int n) {
        double sum = 0.0;
        for (int j = 0; j < n; j++)
            sum += a[j] * b[j];
        return sum;
    }

    /** @return {@code sum_j a[j] * b[j]} over all entries. */
    static double dot(double[] a, double[] b) {
        return dot(a, b, a.length);
    }
}
