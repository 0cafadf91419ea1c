package com.stochastic.sde.api;

/**
 * Pre-allocated scratch space shared between a kernel and the error estimator
 * for one attempted step.
 *
 * The kernel writes the candidate state into {@link #uNext()}. Kernels with an
 * embedded estimate also write the deterministic and noise error terms; kernels
 * that evaluate f and g at the start of the step publish those values so that
 * the heuristic estimator does not repeat the evaluation.
 */
public final class StepWorkspace {
    private final double[] uNext;
    private final double[] deterministicError;
    private final double[] noiseError;
    private final double[] fStart;
    private final double[] gStart;
    private boolean errorTermsValid;
    private boolean startValuesValid;

    public StepWorkspace(int dimension) {
        this.uNext = new double[dimension];
        this.deterministicError = new double[dimension];
        this.noiseError = new double[dimension];
        this.fStart = new double[dimension];
        this.gStart = new double[dimension];
    }

    /** Invalidates per-attempt flags. Called by the integrator before every attempt. */
    public void clear() {
        errorTermsValid = false;
        startValuesValid = false;
    }

    public double[] uNext() {
        return uNext;
    }

    public double[] deterministicError() {
        return deterministicError;
    }

    public double[] noiseError() {
        return noiseError;
    }

    public double[] fStart() {
        return fStart;
    }

    public double[] gStart() {
        return gStart;
    }

    public boolean errorTermsValid() {
        return errorTermsValid;
    }

    public void markErrorTermsValid() {
        this.errorTermsValid = true;
    }

    public boolean startValuesValid() {
        return startValuesValid;
    }

    public void markStartValuesValid() {
        this.startValuesValid = true;
    }

    public int dimension() {
        return uNext.length;
    }
}
