package com.stochastic.sde.api;

import java.util.Objects;

/**
 * Jump-process definition consumed by the tau-leaping kernel.
 *
 * <p>
 * A jump problem consists of a number of reaction channels, each firing with a
 * state-dependent rate. Over a leap of length {@code dt} channel {@code j}
 * fires {@code Poisson(rate_j * dt)} times; the change function maps the
 * drawn counts to a state update.
 */
public final class JumpProblem {
    private final int channels;
    private final double[] parameters;
    private final RateFunction rates;
    private final ChangeFunction change;
    private final Object mark;

    public JumpProblem(int channels, double[] parameters, RateFunction rates, ChangeFunction change, Object mark) {
        if (channels <= 0)
            throw new IllegalArgumentException("Jump problem needs at least one channel, got " + channels);
        this.channels = channels;
        this.parameters = parameters != null ? parameters.clone() : new double[0];
        this.rates = Objects.requireNonNull(rates, "rates");
        this.change = Objects.requireNonNull(change, "change");
        this.mark = mark;
    }

    public JumpProblem(int channels, double[] parameters, RateFunction rates, ChangeFunction change) {
        this(channels, parameters, rates, change, null);
    }

    public int channels() {
        return channels;
    }

    public double[] parameters() {
        return parameters;
    }

    public RateFunction rates() {
        return rates;
    }

    public ChangeFunction change() {
        return change;
    }

    public Object mark() {
        return mark;
    }

    /** Computes the firing rate of every channel into {@code out}. */
    @FunctionalInterface
    public interface RateFunction {
        void rates(double[] u, double[] p, double t, double[] out);
    }

    /**
     * Computes the state change {@code du} caused by {@code counts[j]} firings of
     * each channel.
     */
    @FunctionalInterface
    public interface ChangeFunction {
        void change(double[] du, double[] u, double[] p, double t, double[] counts, Object mark);
    }
}
