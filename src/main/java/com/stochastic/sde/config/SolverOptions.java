package com.stochastic.sde.config;

import com.stochastic.sde.tableau.Tableau;

/**
 * Immutable options of a solve.
 *
 * <p>
 * Defaults:
 * <ul>
 * <li>{@code dt = 0} (estimated automatically), fixed-step unless
 * {@code adaptive}</li>
 * <li>{@code algorithm = SRIW1_OPTIMIZED}</li>
 * <li>{@code abstol = 1e-3}, {@code reltol = 1e-6}, {@code internalNorm = 2}</li>
 * <li>{@code gamma = 2}, {@code qmin = 0.2}, {@code qmax = 1.125},
 * {@code delta = 1/6}</li>
 * <li>{@code maxiters = 1e9}, {@code dtmax} = half the time span,
 * {@code dtmin = 10 * ulp(1.0)}</li>
 * <li>{@code discardLength = 1e-15}, {@code progressSteps = 1000}</li>
 * <li>{@code seed} unset: the run draws from an unseeded generator</li>
 * </ul>
 */
public final class SolverOptions {
    public static final double DEFAULT_DTMIN = 10 * Math.ulp(1.0);

    private final double dt;
    private final boolean saveTimeseries;
    private final int timeseriesSteps;
    private final boolean adaptive;
    private final Algorithm algorithm;
    private final double abstol;
    private final double reltol;
    private final double gamma;
    private final double qmax;
    private final double qmin;
    private final double delta;
    private final long maxiters;
    private final double dtmax;
    private final double dtmin;
    private final double internalNorm;
    private final double discardLength;
    private final AdaptiveControllerType adaptiveController;
    private final NoiseRefinement noiseRefinement;
    private final Tableau tableau;
    private final long progressSteps;
    private final Long seed;

    private SolverOptions(Builder b) {
        this.dt = b.dt;
        this.saveTimeseries = b.saveTimeseries;
        this.timeseriesSteps = b.timeseriesSteps;
        this.adaptive = b.adaptive;
        this.algorithm = b.algorithm;
        this.abstol = b.abstol;
        this.reltol = b.reltol;
        this.gamma = b.gamma;
        this.qmax = b.qmax;
        this.qmin = b.qmin;
        this.delta = b.delta;
        this.maxiters = b.maxiters;
        this.dtmax = b.dtmax;
        this.dtmin = b.dtmin;
        this.internalNorm = b.internalNorm;
        this.discardLength = b.discardLength;
        this.adaptiveController = b.adaptiveController;
        this.noiseRefinement = b.noiseRefinement;
        this.tableau = b.tableau;
        this.progressSteps = b.progressSteps;
        this.seed = b.seed;
    }

    public static SolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return A builder pre-filled with these options. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.dt = dt;
        b.saveTimeseries = saveTimeseries;
        b.timeseriesSteps = timeseriesSteps;
        b.adaptive = adaptive;
        b.algorithm = algorithm;
        b.abstol = abstol;
        b.reltol = reltol;
        b.gamma = gamma;
        b.qmax = qmax;
        b.qmin = qmin;
        b.delta = delta;
        b.maxiters = maxiters;
        b.dtmax = dtmax;
        b.dtmin = dtmin;
        b.internalNorm = internalNorm;
        b.discardLength = discardLength;
        b.adaptiveController = adaptiveController;
        b.noiseRefinement = noiseRefinement;
        b.tableau = tableau;
        b.progressSteps = progressSteps;
        b.seed = seed;
        return b;
    }

    /** @return Initial step size; 0 requests automatic estimation. */
    public double dt() {
        return dt;
    }

    public boolean saveTimeseries() {
        return saveTimeseries;
    }

    public int timeseriesSteps() {
        return timeseriesSteps;
    }

    public boolean adaptive() {
        return adaptive;
    }

    public Algorithm algorithm() {
        return algorithm;
    }

    public double abstol() {
        return abstol;
    }

    public double reltol() {
        return reltol;
    }

    public double gamma() {
        return gamma;
    }

    public double qmax() {
        return qmax;
    }

    public double qmin() {
        return qmin;
    }

    public double delta() {
        return delta;
    }

    public long maxiters() {
        return maxiters;
    }

    /** @return Maximum step size; NaN means half the time span. */
    public double dtmax() {
        return dtmax;
    }

    public double dtmin() {
        return dtmin;
    }

    public double internalNorm() {
        return internalNorm;
    }

    public double discardLength() {
        return discardLength;
    }

    public AdaptiveControllerType adaptiveController() {
        return adaptiveController;
    }

    public NoiseRefinement noiseRefinement() {
        return noiseRefinement;
    }

    /** @return Tableau override, or null for the algorithm's default. */
    public Tableau tableau() {
        return tableau;
    }

    public long progressSteps() {
        return progressSteps;
    }

    public boolean hasSeed() {
        return seed != null;
    }

    /** @return The random seed, or null when unset. */
    public Long seed() {
        return seed;
    }

    @Override
    public String toString() {
        return "SolverOptions{algorithm=" + algorithm + ", adaptive=" + adaptive + ", dt=" + dt
                + ", abstol=" + abstol + ", reltol=" + reltol + ", saveTimeseries=" + saveTimeseries
                + ", timeseriesSteps=" + timeseriesSteps + ", maxiters=" + maxiters
                + ", noiseRefinement=" + noiseRefinement
                + (tableau != null ? ", tableau=" + tableau.name() : "")
                + (seed != null ? ", seed=" + seed : "") + "}";
    }

    public static final class Builder {
        private double dt = 0.0;
        private boolean saveTimeseries = true;
        private int timeseriesSteps = 1;
        private boolean adaptive = false;
        private Algorithm algorithm = Algorithm.SRIW1_OPTIMIZED;
        private double abstol = 1e-3;
        private double reltol = 1e-6;
        private double gamma = 2.0;
        private double qmax = 1.125;
        private double qmin = 0.2;
        private double delta = 1.0 / 6.0;
        private long maxiters = 1_000_000_000L;
        private double dtmax = Double.NaN;
        private double dtmin = DEFAULT_DTMIN;
        private double internalNorm = 2.0;
        private double discardLength = 1e-15;
        private AdaptiveControllerType adaptiveController = AdaptiveControllerType.RSWM3;
        private NoiseRefinement noiseRefinement = NoiseRefinement.DISCARD;
        private Tableau tableau;
        private long progressSteps = 1000;
        private Long seed;

        private Builder() {
        }

        public Builder dt(double dt) {
            this.dt = dt;
            return this;
        }

        public Builder saveTimeseries(boolean save) {
            this.saveTimeseries = save;
            return this;
        }

        public Builder timeseriesSteps(int steps) {
            this.timeseriesSteps = steps;
            return this;
        }

        public Builder adaptive(boolean adaptive) {
            this.adaptive = adaptive;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder abstol(double abstol) {
            this.abstol = abstol;
            return this;
        }

        public Builder reltol(double reltol) {
            this.reltol = reltol;
            return this;
        }

        public Builder gamma(double gamma) {
            this.gamma = gamma;
            return this;
        }

        public Builder qmax(double qmax) {
            this.qmax = qmax;
            return this;
        }

        public Builder qmin(double qmin) {
            this.qmin = qmin;
            return this;
        }

        public Builder delta(double delta) {
            this.delta = delta;
            return this;
        }

        public Builder maxiters(long maxiters) {
            this.maxiters = maxiters;
            return this;
        }

        public Builder dtmax(double dtmax) {
            this.dtmax = dtmax;
            return this;
        }

        public Builder dtmin(double dtmin) {
            this.dtmin = dtmin;
            return this;
        }

        public Builder internalNorm(double p) {
            this.internalNorm = p;
            return this;
        }

        public Builder discardLength(double discardLength) {
            this.discardLength = discardLength;
            return this;
        }

        public Builder adaptiveController(AdaptiveControllerType type) {
            this.adaptiveController = type;
            return this;
        }

        public Builder noiseRefinement(NoiseRefinement refinement) {
            this.noiseRefinement = refinement;
            return this;
        }

        public Builder tableau(Tableau tableau) {
            this.tableau = tableau;
            return this;
        }

        public Builder progressSteps(long steps) {
            this.progressSteps = steps;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder unseeded() {
            this.seed = null;
            return this;
        }

        /**
         * @throws IllegalArgumentException if an option is out of range.
         */
        public SolverOptions build() {
            require(dt >= 0 && Double.isFinite(dt), "dt must be finite and >= 0", dt);
            require(timeseriesSteps >= 1, "timeseriesSteps must be >= 1", timeseriesSteps);
            require(algorithm != null, "algorithm must not be null", algorithm);
            require(abstol >= 0, "abstol must be >= 0", abstol);
            require(reltol >= 0, "reltol must be >= 0", reltol);
            require(gamma > 0, "gamma must be > 0", gamma);
            require(qmin > 0 && qmin < 1, "qmin must lie in (0, 1)", qmin);
            require(qmax >= 1, "qmax must be >= 1", qmax);
            require(delta >= 0, "delta must be >= 0", delta);
            require(maxiters >= 1, "maxiters must be >= 1", maxiters);
            require(Double.isNaN(dtmax) || dtmax > 0, "dtmax must be > 0", dtmax);
            require(dtmin >= 0 && Double.isFinite(dtmin), "dtmin must be finite and >= 0", dtmin);
            require(internalNorm >= 1, "internalNorm must be >= 1", internalNorm);
            require(discardLength >= 0, "discardLength must be >= 0", discardLength);
            require(adaptiveController != null, "adaptiveController must not be null", adaptiveController);
            require(noiseRefinement != null, "noiseRefinement must not be null", noiseRefinement);
            require(progressSteps >= 1, "progressSteps must be >= 1", progressSteps);
            return new SolverOptions(this);
        }

        private static void require(boolean condition, String message, Object value) {
            if (!condition)
                throw new IllegalArgumentException(message + ", got " + value);
        }
    }
}
