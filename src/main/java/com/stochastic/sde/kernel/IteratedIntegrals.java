package com.stochastic.sde.kernel;

/**
 * Approximations of the iterated stochastic integrals used by Rößler schemes,
 * normalized as they enter the update formulas.
 *
 * chi1 = I_(1,1) / sqrt(h) = (dW^2 - h) / (2 sqrt(h))
 * chi2 = I_(1,0) / h = (dW + dZ / sqrt(3)) / 2
 * chi3 = I_(1,1,1) / h = (dW^3 - 3 h dW) / (6 h)
 */
final class IteratedIntegrals {
    private static final double INV_SQRT3 = 1.0 / Math.sqrt(3.0);

    private IteratedIntegrals() {
    }

    static double chi1(double dW, double h, double sqrtH) {
        return (dW * dW - h) / (2.0 * sqrtH);
    }

    static double chi2(double dW, double dZ) {
        return 0.5 * (dW + dZ * INV_SQRT3);
    }

    static double chi3(double dW, double h) {
        return (dW * dW * dW - 3.0 * h * dW) / (6.0 * h);
    }
}
