package com.stochastic.sde.tableau;

import org.junit.Test;

import static org.junit.Assert.*;

public class TableausTest {

    private static double sum(double[] v) {
        double s = 0;
        for (double x : v)
            s += x;
        return s;
    }

    @Test
    public void testSriw1Coefficients() {
        SriTableau t = Tableaus.sriw1();
        assertEquals(TableauFamily.SRI, t.family());
        assertEquals(4, t.stages());
        assertEquals(1.5, t.order(), 0.0);
        assertEquals(1.0, sum(t.alpha()), 1e-15);
        assertEquals(1.0, sum(t.beta1()), 1e-15);
        assertEquals(0.0, sum(t.beta2()), 1e-15);
        assertEquals(0.0, sum(t.beta3()), 1e-15);
        assertEquals(0.0, sum(t.beta4()), 1e-15);
        assertEquals(-5.0, t.b1()[3][0], 0.0);
        assertEquals(0.25, t.a1()[3][2], 0.0);
    }

    @Test
    public void testSra1Coefficients() {
        SraTableau t = Tableaus.sra1();
        assertEquals(TableauFamily.SRA, t.family());
        assertEquals(2, t.stages());
        assertEquals(2.0, t.order(), 0.0);
        assertArrayEquals(new double[] { 1, 0 }, t.c1(), 0.0);
        assertArrayEquals(new double[] { -1, 1 }, t.beta2(), 0.0);
    }

    @Test
    public void testAccessorsReturnCopies() {
        SriTableau t = Tableaus.sriw1();
        t.alpha()[0] = 42;
        t.a0()[1][0] = 42;
        assertEquals(1.0 / 3, t.alpha()[0], 0.0);
        assertEquals(0.75, t.a0()[1][0], 0.0);
    }

    @Test
    public void testLookupByName() {
        assertSame(Tableaus.sriw1(), Tableaus.byName("sriw1"));
        assertSame(Tableaus.sra1(), Tableaus.byName("SRA1"));
        assertSame(Tableaus.sra1(), Tableaus.defaultFor(TableauFamily.SRA));
        try {
            Tableaus.byName("RK4");
            fail("Unknown tableau should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("RK4"));
        }
    }

    @Test
    public void testImplicitStageMatrixRejected() {
        try {
            new SraTableau("bad", new double[] { 0, 1 }, new double[] { 0, 0 },
                    new double[][] { { 0.5, 0 }, { 0.5, 0 } }, new double[2][2],
                    new double[] { 0.5, 0.5 }, new double[] { 1, 0 }, new double[] { 0, 0 }, 1.0);
            fail("Diagonal entry should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("strictly lower triangular"));
        }
    }

    @Test
    public void testInconsistentStageTimesRejected() {
        try {
            new SraTableau("bad", new double[] { 0, 0.5 }, new double[] { 0, 0 },
                    new double[][] { { 0, 0 }, { 0.75, 0 } }, new double[2][2],
                    new double[] { 0.5, 0.5 }, new double[] { 1, 0 }, new double[] { 0, 0 }, 1.0);
            fail("c0 must equal the row sums of A0");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("row 1 of A0"));
        }
    }

    @Test
    public void testOrderConditionViolationRejected() {
        try {
            new SraTableau("bad", new double[] { 0, 0 }, new double[] { 0, 0 },
                    new double[2][2], new double[2][2],
                    new double[] { 0.5, 0.4 }, new double[] { 1, 0 }, new double[] { 0, 0 }, 1.0);
            fail("Drift weights must sum to one");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("sum(alpha)"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongShapeRejected() {
        new SraTableau("bad", new double[] { 0 }, new double[] { 0, 0 },
                new double[2][2], new double[2][2],
                new double[] { 0.5, 0.5 }, new double[] { 1, 0 }, new double[] { 0, 0 }, 1.0);
    }
}
