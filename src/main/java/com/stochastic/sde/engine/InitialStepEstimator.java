package com.stochastic.sde.engine;

import com.stochastic.sde.api.SdeFunction;

/**
 * Picks a starting step size when the caller passes {@code dt = 0}.
 *
 * With {@code sk = max(ulp(1), abstol + |u0| reltol)} and the diffusion
 * scaled by 3:
 * <pre>
 * d0 = ||u0 / sk||
 * d1 = ||max(|f0 + g0|, |f0 - g0|) / sk||
 * dt0 = (d0 &lt; 1e-5 || d1 &lt; 1e-5) ? 1e-6 : 0.01 * d0 / d1
 * u1 = u0 + dt0 f0, f1 = f(t0 + dt0, u1), g1 = 3 g(t0 + dt0, u1)
 * dg = max(|g0 - g1|, |g0 + g1|)
 * d2 = ||max(|f1 - f0 + dg|, |f1 - f0 - dg|) / sk|| / dt0
 * dt1 = max(d1, d2) &lt;= 1e-15 ? max(1e-6, 1e-3 dt0) : 10^(-(2 + log10(max(d1, d2))) / (order + 1/2))
 * dt = min(100 dt0, dt1)
 * </pre>
 * Norms are Euclidean.
 */
public final class InitialStepEstimator {
    private static final double DIFFUSION_SCALE = 3.0;
    private static final double FLOOR = Math.ulp(1.0);

    private InitialStepEstimator() {
    }

    public static double estimate(double[] u0, double t0, double abstol, double reltol, SdeFunction f,
            SdeFunction g, double order) {
        int n = u0.length;
        double[] sk = new double[n];
        for (int i = 0; i < n; i++)
            sk[i] = Math.max(FLOOR, abstol + Math.abs(u0[i]) * reltol);

        double[] f0 = new double[n];
        double[] g0 = new double[n];
        f.evaluate(t0, u0, f0);
        g.evaluate(t0, u0, g0);
        double d0 = 0.0, d1 = 0.0;
        for (int i = 0; i < n; i++) {
            g0[i] *= DIFFUSION_SCALE;
            double a = u0[i] / sk[i];
            double b = Math.max(Math.abs(f0[i] + g0[i]), Math.abs(f0[i] - g0[i])) / sk[i];
            d0 += a * a;
            d1 += b * b;
        }
        d0 = Math.sqrt(d0);
        d1 = Math.sqrt(d1);

        double dt0 = (d0 < 1e-5 || d1 < 1e-5) ? 1e-6 : 0.01 * (d0 / d1);

        double[] u1 = new double[n];
        for (int i = 0; i < n; i++)
            u1[i] = u0[i] + dt0 * f0[i];
        double[] f1 = new double[n];
        double[] g1 = new double[n];
        f.evaluate(t0 + dt0, u1, f1);
        g.evaluate(t0 + dt0, u1, g1);

        double d2 = 0.0;
        for (int i = 0; i < n; i++) {
            g1[i] *= DIFFUSION_SCALE;
            double dg = Math.max(Math.abs(g0[i] - g1[i]), Math.abs(g0[i] + g1[i]));
            double df = f1[i] - f0[i];
            double c = Math.max(Math.abs(df + dg), Math.abs(df - dg)) / sk[i];
            d2 += c * c;
        }
        d2 = Math.sqrt(d2) / dt0;

        double dmax = Math.max(d1, d2);
        double dt1 = dmax <= 1e-15
                ? Math.max(1e-6, dt0 * 1e-3)
                : Math.pow(10.0, -(2.0 + Math.log10(dmax)) / (order + 0.5));
        return Math.min(100 * dt0, dt1);
    }
}
