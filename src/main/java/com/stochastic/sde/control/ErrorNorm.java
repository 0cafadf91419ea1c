package com.stochastic.sde.control;

/**
 * Scaled p-norm of a per-component error vector.
 *
 * Each component is divided by {@code max(floor, abstol + max(|uPrev|, |uNext|) * reltol)}
 * before the norm is taken, with the floor at {@code ulp(1.0)} so that zero
 * tolerances on a zero state never divide by zero. {@code p = Infinity} gives
 * the max norm.
 */
public final class ErrorNorm {
    static final double DENOMINATOR_FLOOR = Math.ulp(1.0);

    private final double p;
    private final double abstol;
    private final double reltol;

    public ErrorNorm(double p, double abstol, double reltol) {
        if (!(p >= 1))
            throw new IllegalArgumentException("Norm order must be >= 1, got " + p);
        if (!(abstol >= 0) || !(reltol >= 0))
            throw new IllegalArgumentException("Tolerances must be non-negative: abstol=" + abstol + ", reltol=" + reltol);
        this.p = p;
        this.abstol = abstol;
        this.reltol = reltol;
    }

    /** Divides {@code error} in place by the tolerance scale of each component. */
    public void scale(double[] error, double[] uPrev, double[] uNext) {
        for (int i = 0; i < error.length; i++) {
            double magnitude = Math.max(Math.abs(uPrev[i]), Math.abs(uNext[i]));
            double denominator = Math.max(DENOMINATOR_FLOOR, abstol + magnitude * reltol);
            error[i] /= denominator;
        }
    }

    /** @return The p-norm of {@code v}. */
    public double norm(double[] v) {
        if (Double.isInfinite(p)) {
            double max = 0.0;
            for (double x : v) {
                double a = Math.abs(x);
                if (a > max || Double.isNaN(a))
                    max = a;
            }
            return max;
        }
        if (p == 2.0) {
            double sum = 0.0;
            for (double x : v)
                sum += x * x;
            return Math.sqrt(sum);
        }
        if (p == 1.0) {
            double sum = 0.0;
            for (double x : v)
                sum += Math.abs(x);
            return sum;
        }
        double sum = 0.0;
        for (double x : v)
            sum += Math.pow(Math.abs(x), p);
        return Math.pow(sum, 1.0 / p);
    }

    public double p() {
        return p;
    }

    public double abstol() {
        return abstol;
    }

    public double reltol() {
        return reltol;
    }
}
