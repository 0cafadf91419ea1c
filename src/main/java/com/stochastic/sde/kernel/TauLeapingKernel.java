package com.stochastic.sde.kernel;

import com.stochastic.sde.api.JumpProblem;
import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Explicit tau-leaping.
 * <p>
 * Formula: {@code u' = u + c(u, p, t, counts, mark)}, with
 * {@code counts_j ~ Poisson(rate_j(u, p, t) * dt)} drawn by the jump process.
 */
public final class TauLeapingKernel extends AbstractStepKernel {
    private final JumpProblem jumps;
    private final double[] change;

    public TauLeapingKernel(JumpProblem jumps, int dimension) {
        super("TauLeaping", 0.5, dimension);
        this.jumps = jumps;
        this.change = new double[dimension];
    }

    @Override
    protected void advance(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        java.util.Arrays.fill(change, 0.0);
        jumps.change().change(change, uPrev, jumps.parameters(), t, noise.jumpCounts(), jumps.mark());
        double[] uNext = ws.uNext();
        for (int i = 0; i < dimension; i++)
            uNext[i] = uPrev[i] + change[i];
    }
}
