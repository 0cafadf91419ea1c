package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.NonFiniteStateException;
import com.stochastic.sde.api.StepKernel;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Base class for step kernels. Runs the scheme and rejects candidate states
 * containing NaN or infinite components.
 */
public abstract class AbstractStepKernel implements StepKernel {
    private final String name;
    private final double order;
    protected final int dimension;

    protected AbstractStepKernel(String name, double order, int dimension) {
        if (dimension <= 0)
            throw new IllegalArgumentException("State dimension must be positive: " + dimension);
        this.name = name;
        this.order = order;
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double order() {
        return order;
    }

    @Override
    public final void perform(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace workspace) {
        advance(t, dt, uPrev, noise, workspace);
        double[] uNext = workspace.uNext();
        for (int i = 0; i < dimension; i++) {
            double v = uNext[i];
            if (!Double.isFinite(v))
                throw new NonFiniteStateException(name, t, dt, i, v);
        }
    }

    /**
     * Subclasses implement the scheme here, writing the candidate state into
     * {@code workspace.uNext()}.
     */
    protected abstract void advance(double t, double dt, double[] uPrev, NoiseIncrement noise,
            StepWorkspace workspace);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", order=" + order + ", dim=" + dimension + "}";
    }
}
