package com.stochastic.sde.tableau;

import static com.stochastic.sde.tableau.TableauValidator.*;

/**
 * Tableau of a Rößler SRA scheme for additive noise.
 *
 * Stage equations (h = dt):
 * H0_i = u + h * sum_j A0[i][j] f(t + c0[j] h, H0_j) + I_(1,0)/h * sum_j B0[i][j] g(t + c1[j] h)
 *
 * Update:
 * u' = u + h * sum_i alpha[i] f_i + sum_i (beta1[i] I_(1) + beta2[i] I_(1,0)/h) g(t + c1[i] h)
 */
public final class SraTableau implements Tableau {
    private final String name;
    private final double[] c0, c1, alpha, beta1, beta2;
    private final double[][] a0, b0;
    private final double order;

    public SraTableau(String name, double[] c0, double[] c1, double[][] a0, double[][] b0,
            double[] alpha, double[] beta1, double[] beta2, double order) {
        int s = alpha == null ? 0 : alpha.length;
        if (s == 0)
            throw new IllegalArgumentException(name + ": tableau needs at least one stage");
        checkVector(name, "c0", c0, s);
        checkVector(name, "c1", c1, s);
        checkVector(name, "alpha", alpha, s);
        checkVector(name, "beta1", beta1, s);
        checkVector(name, "beta2", beta2, s);
        checkLowerTriangular(name, "A0", a0, s);
        checkLowerTriangular(name, "B0", b0, s);
        checkRowSums(name, "A0", a0, "c0", c0);
        checkSum(name, "alpha", alpha, 1.0);
        checkSum(name, "beta1", beta1, 1.0);
        checkSum(name, "beta2", beta2, 0.0);
        if (!(order > 0))
            throw new IllegalArgumentException(name + ": order must be positive");

        this.name = name;
        this.c0 = c0.clone();
        this.c1 = c1.clone();
        this.a0 = copy(a0);
        this.b0 = copy(b0);
        this.alpha = alpha.clone();
        this.beta1 = beta1.clone();
        this.beta2 = beta2.clone();
        this.order = order;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TableauFamily family() {
        return TableauFamily.SRA;
    }

    @Override
    public int stages() {
        return alpha.length;
    }

    @Override
    public double order() {
        return order;
    }

    public double[] c0() {
        return c0.clone();
    }

    public double[] c1() {
        return c1.clone();
    }

    public double[][] a0() {
        return copy(a0);
    }

    public double[][] b0() {
        return copy(b0);
    }

    public double[] alpha() {
        return alpha.clone();
    }

    public double[] beta1() {
        return beta1.clone();
    }

    public double[] beta2() {
        return beta2.clone();
    }

    @Override
    public String toString() {
        return "SraTableau{" + name + ", stages=" + stages() + ", order=" + order + "}";
    }
}
