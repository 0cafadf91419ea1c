package com.stochastic.sde.tableau;

import static com.stochastic.sde.tableau.TableauValidator.*;

/**
 * Tableau of a Rößler SRI scheme for diagonal/scalar noise.
 *
 * Stage equations (h = dt, I_(1) = dW):
 * H0_i = u + h * sum_j A0[i][j] f(t + c0[j] h, H0_j) + I_(1,0)/h * sum_j B0[i][j] g(t + c1[j] h, H1_j)
 * H1_i = u + h * sum_j A1[i][j] f(t + c0[j] h, H0_j) + sqrt(h) * sum_j B1[i][j] g(t + c1[j] h, H1_j)
 *
 * Update:
 * u' = u + h * sum_i alpha[i] f_i
 * + sum_i (beta1[i] I_(1) + beta2[i] I_(1,1)/sqrt(h) + beta3[i] I_(1,0)/h + beta4[i] I_(1,1,1)/h) g_i
 */
public final class SriTableau implements Tableau {
    private final String name;
    private final double[] c0, c1, alpha, beta1, beta2, beta3, beta4;
    private final double[][] a0, a1, b0, b1;
    private final double order;

    public SriTableau(String name, double[] c0, double[] c1, double[][] a0, double[][] a1,
            double[][] b0, double[][] b1, double[] alpha, double[] beta1, double[] beta2,
            double[] beta3, double[] beta4, double order) {
        int s = alpha == null ? 0 : alpha.length;
        if (s == 0)
            throw new IllegalArgumentException(name + ": tableau needs at least one stage");
        checkVector(name, "c0", c0, s);
        checkVector(name, "c1", c1, s);
        checkVector(name, "alpha", alpha, s);
        checkVector(name, "beta1", beta1, s);
        checkVector(name, "beta2", beta2, s);
        checkVector(name, "beta3", beta3, s);
        checkVector(name, "beta4", beta4, s);
        checkLowerTriangular(name, "A0", a0, s);
        checkLowerTriangular(name, "A1", a1, s);
        checkLowerTriangular(name, "B0", b0, s);
        checkLowerTriangular(name, "B1", b1, s);
        checkRowSums(name, "A0", a0, "c0", c0);
        checkRowSums(name, "A1", a1, "c1", c1);
        checkSum(name, "alpha", alpha, 1.0);
        checkSum(name, "beta1", beta1, 1.0);
        checkSum(name, "beta2", beta2, 0.0);
        checkSum(name, "beta3", beta3, 0.0);
        checkSum(name, "beta4", beta4, 0.0);
        if (!(order > 0))
            throw new IllegalArgumentException(name + ": order must be positive");

        this.name = name;
        this.c0 = c0.clone();
        this.c1 = c1.clone();
        this.a0 = copy(a0);
        this.a1 = copy(a1);
        this.b0 = copy(b0);
        this.b1 = copy(b1);
        this.alpha = alpha.clone();
        this.beta1 = beta1.clone();
        this.beta2 = beta2.clone();
        this.beta3 = beta3.clone();
        this.beta4 = beta4.clone();
        this.order = order;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TableauFamily family() {
        return TableauFamily.SRI;
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

    public double[][] a1() {
        return copy(a1);
    }

    public double[][] b0() {
        return copy(b0);
    }

    public double[][] b1() {
        return copy(b1);
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

    public double[] beta3() {
        return beta3.clone();
    }

    public double[] beta4() {
        return beta4.clone();
    }

    @Override
    public String toString() {
        return "SriTableau{" + name + ", stages=" + stages() + ", order=" + order + "}";
    }
}
