package com.stochastic.sde.tableau;

/**
 * Structural and order-condition checks applied when a tableau is built.
 *
 * Checks:
 * - Shape: every coefficient vector has {@code stages} entries and every
 * matrix is {@code stages x stages}.
 * - Explicitness: stage matrices are strictly lower triangular.
 * - Consistency: stage times equal the row sums of their drift matrices.
 * - Basic order conditions: weights of the drift and of the dW term sum to 1,
 * weights of the iterated-integral terms sum to 0.
 */
final class TableauValidator {
    private static final double TOLERANCE = 1e-12;

    private TableauValidator() {
    }

    static void checkVector(String tableau, String label, double[] v, int stages) {
        if (v == null || v.length != stages)
            throw new IllegalArgumentException(String.format("%s: %s must have %d entries, got %s",
                    tableau, label, stages, v == null ? "null" : String.valueOf(v.length)));
        for (double x : v) {
            if (!Double.isFinite(x))
                throw new IllegalArgumentException(tableau + ": non-finite coefficient in " + label);
        }
    }

    static void checkLowerTriangular(String tableau, String label, double[][] m, int stages) {
        if (m == null || m.length != stages)
            throw new IllegalArgumentException(tableau + ": " + label + " must have " + stages + " rows");
        for (int i = 0; i < stages; i++) {
            checkVector(tableau, label + "[" + i + "]", m[i], stages);
            for (int j = i; j < stages; j++) {
                if (m[i][j] != 0.0)
                    throw new IllegalArgumentException(String.format(
                            "%s: %s must be strictly lower triangular (entry [%d][%d] = %s)",
                            tableau, label, i, j, m[i][j]));
            }
        }
    }

    static void checkRowSums(String tableau, String matrix, double[][] m, String times, double[] c) {
        for (int i = 0; i < c.length; i++) {
            double sum = 0.0;
            for (double x : m[i])
                sum += x;
            if (Math.abs(sum - c[i]) > TOLERANCE)
                throw new IllegalArgumentException(String.format(
                        "%s: row %d of %s sums to %s but %s[%d] = %s", tableau, i, matrix, sum, times, i, c[i]));
        }
    }

    static void checkSum(String tableau, String label, double[] v, double expected) {
        double sum = 0.0;
        for (double x : v)
            sum += x;
        if (Math.abs(sum - expected) > TOLERANCE)
            throw new IllegalArgumentException(String.format(
                    "%s: order condition violated, sum(%s) = %s, expected %s", tableau, label, sum, expected));
    }

    static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++)
            out[i] = m[i].clone();
        return out;
    }
}
