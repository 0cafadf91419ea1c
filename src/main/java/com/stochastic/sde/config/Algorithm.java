package com.stochastic.sde.config;

import com.stochastic.sde.api.SdeProblem;
import com.stochastic.sde.api.StepKernel;
import com.stochastic.sde.api.UnimplementedSchemeException;
import com.stochastic.sde.kernel.EulerMaruyamaKernel;
import com.stochastic.sde.kernel.RkMilsteinKernel;
import com.stochastic.sde.kernel.Sra1OptimizedKernel;
import com.stochastic.sde.kernel.SraKernel;
import com.stochastic.sde.kernel.SraVectorizedKernel;
import com.stochastic.sde.kernel.SriKernel;
import com.stochastic.sde.kernel.SriVectorizedKernel;
import com.stochastic.sde.kernel.Sriw1OptimizedKernel;
import com.stochastic.sde.kernel.TauLeapingKernel;
import com.stochastic.sde.tableau.SraTableau;
import com.stochastic.sde.tableau.SriTableau;
import com.stochastic.sde.tableau.Tableau;
import com.stochastic.sde.tableau.TableauFamily;
import com.stochastic.sde.tableau.Tableaus;

/**
 * Stepping schemes selectable through {@link SolverOptions#algorithm()}.
 *
 * Each constant builds its {@link StepKernel} once per run; the stepping loop
 * only ever talks to the kernel interface.
 */
public enum Algorithm {
    EM(0.5, null, false),
    RK_MIL(1.0, null, false),
    SRI(1.5, TableauFamily.SRI, true),
    SRIW1_OPTIMIZED(1.5, TableauFamily.SRI, false),
    SRI_VECTORIZED(1.5, TableauFamily.SRI, true),
    SRA(2.0, TableauFamily.SRA, true),
    SRA1_OPTIMIZED(2.0, TableauFamily.SRA, false),
    SRA_VECTORIZED(2.0, TableauFamily.SRA, true),
    TAU_LEAPING(0.5, null, false);

    private final double defaultOrder;
    private final TableauFamily family;
    private final boolean acceptsTableau;

    Algorithm(double defaultOrder, TableauFamily family, boolean acceptsTableau) {
        this.defaultOrder = defaultOrder;
        this.family = family;
        this.acceptsTableau = acceptsTableau;
    }

    /** @return Strong order with the default tableau. */
    public double defaultOrder() {
        return defaultOrder;
    }

    /** @return Tableau family driving the scheme, or null for tableau-free schemes. */
    public TableauFamily family() {
        return family;
    }

    public boolean isTauLeaping() {
        return this == TAU_LEAPING;
    }

    /** @return true for the additive-noise SRA family. */
    public boolean requiresAdditiveNoise() {
        return family == TableauFamily.SRA;
    }

    /**
     * Builds the kernel for {@code problem}.
     *
     * @param tableau Tableau override, or null for the family default.
     * @throws UnimplementedSchemeException if the combination has no implementation.
     */
    public StepKernel createKernel(SdeProblem problem, Tableau tableau) {
        Tableau resolved = resolveTableau(tableau);
        int dim = problem.dimension();
        return switch (this) {
            case EM -> new EulerMaruyamaKernel(problem.drift(), problem.diffusion(), dim);
            case RK_MIL -> new RkMilsteinKernel(problem.drift(), problem.diffusion(), dim);
            case SRI -> new SriKernel(problem.drift(), problem.diffusion(), dim, (SriTableau) resolved);
            case SRIW1_OPTIMIZED -> new Sriw1OptimizedKernel(problem.drift(), problem.diffusion(), dim);
            case SRI_VECTORIZED -> new SriVectorizedKernel(problem.drift(), problem.diffusion(), dim,
                    (SriTableau) resolved);
            case SRA -> new SraKernel(problem.drift(), problem.diffusion(), dim, (SraTableau) resolved);
            case SRA1_OPTIMIZED -> new Sra1OptimizedKernel(problem.drift(), problem.diffusion(), dim);
            case SRA_VECTORIZED -> new SraVectorizedKernel(problem.drift(), problem.diffusion(), dim,
                    (SraTableau) resolved);
            case TAU_LEAPING -> new TauLeapingKernel(problem.jumps(), dim);
        };
    }

    private Tableau resolveTableau(Tableau tableau) {
        if (family == null) {
            if (tableau != null)
                throw new UnimplementedSchemeException(name() + " does not use a tableau, got " + tableau.name());
            return null;
        }
        if (tableau == null)
            return Tableaus.defaultFor(family);
        if (tableau.family() != family)
            throw new UnimplementedSchemeException(String.format(
                    "%s requires an %s tableau, got %s (%s)", name(), family, tableau.name(), tableau.family()));
        if (!acceptsTableau && !tableau.name().equalsIgnoreCase(Tableaus.defaultFor(family).name()))
            throw new UnimplementedSchemeException(String.format(
                    "%s is hard-coded to %s; use %s for tableau %s", name(), Tableaus.defaultFor(family).name(),
                    family, tableau.name()));
        return tableau;
    }
}
