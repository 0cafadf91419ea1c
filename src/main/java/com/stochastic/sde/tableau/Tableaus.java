package com.stochastic.sde.tableau;

/**
 * Built-in tableaus.
 */
public final class Tableaus {
    public static final String SRIW1 = "SRIW1";
    public static final String SRA1 = "SRA1";

    private static final SriTableau SRIW1_TABLEAU = new SriTableau(SRIW1,
            new double[] { 0, 3.0 / 4, 0, 0 },
            new double[] { 0, 1.0 / 4, 1, 1.0 / 4 },
            new double[][] {
                    { 0, 0, 0, 0 },
                    { 3.0 / 4, 0, 0, 0 },
                    { 0, 0, 0, 0 },
                    { 0, 0, 0, 0 } },
            new double[][] {
                    { 0, 0, 0, 0 },
                    { 1.0 / 4, 0, 0, 0 },
                    { 1, 0, 0, 0 },
                    { 0, 0, 1.0 / 4, 0 } },
            new double[][] {
                    { 0, 0, 0, 0 },
                    { 3.0 / 2, 0, 0, 0 },
                    { 0, 0, 0, 0 },
                    { 0, 0, 0, 0 } },
            new double[][] {
                    { 0, 0, 0, 0 },
                    { 1.0 / 2, 0, 0, 0 },
                    { -1, 0, 0, 0 },
                    { -5, 3, 1.0 / 2, 0 } },
            new double[] { 1.0 / 3, 2.0 / 3, 0, 0 },
            new double[] { -1, 4.0 / 3, 2.0 / 3, 0 },
            new double[] { -1, 4.0 / 3, -1.0 / 3, 0 },
            new double[] { 2, -4.0 / 3, -2.0 / 3, 0 },
            new double[] { -2, 5.0 / 3, -2.0 / 3, 1 },
            1.5);

    private static final SraTableau SRA1_TABLEAU = new SraTableau(SRA1,
            new double[] { 0, 3.0 / 4 },
            new double[] { 1, 0 },
            new double[][] {
                    { 0, 0 },
                    { 3.0 / 4, 0 } },
            new double[][] {
                    { 0, 0 },
                    { 3.0 / 2, 0 } },
            new double[] { 1.0 / 3, 2.0 / 3 },
            new double[] { 1, 0 },
            new double[] { -1, 1 },
            2.0);

    private Tableaus() {
    }

    /** Rößler SRIW1: 4 stages, strong order 1.5 for diagonal/scalar noise. */
    public static SriTableau sriw1() {
        return SRIW1_TABLEAU;
    }

    /** Rößler SRA1: 2 stages, order 2.0 for additive noise. */
    public static SraTableau sra1() {
        return SRA1_TABLEAU;
    }

    /** Default tableau for a family: SRA1 for SRA, SRIW1 for SRI. */
    public static Tableau defaultFor(TableauFamily family) {
        return family == TableauFamily.SRA ? SRA1_TABLEAU : SRIW1_TABLEAU;
    }

    /** Resolves a built-in tableau by name (case-insensitive). */
    public static Tableau byName(String name) {
        if (SRIW1.equalsIgnoreCase(name))
            return SRIW1_TABLEAU;
        if (SRA1.equalsIgnoreCase(name))
            return SRA1_TABLEAU;
        throw new IllegalArgumentException("Unknown tableau: " + name);
    }
}
