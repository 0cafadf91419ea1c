package com.stochastic.sde.noise;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.NoiseType;
import com.stochastic.sde.config.NoiseRefinement;
import org.junit.Test;

import static org.junit.Assert.*;

public class WienerProcessTest {

    private static WienerProcess process(long seed, NoiseRefinement refinement) {
        return new WienerProcess(NoiseShape.of(NoiseType.DIAGONAL, 2), RandomProviders.create(seed), true,
                refinement, 1e-15, true);
    }

    @Test
    public void testSameSeedSameIncrements() {
        WienerProcess a = process(11, NoiseRefinement.DISCARD);
        WienerProcess b = process(11, NoiseRefinement.DISCARD);
        for (int k = 0; k < 20; k++) {
            NoiseIncrement ia = a.draw(k * 0.1, 0.1, null);
            NoiseIncrement ib = b.draw(k * 0.1, 0.1, null);
            assertArrayEquals(ia.dW(), ib.dW(), 0.0);
            assertArrayEquals(ia.dZ(), ib.dZ(), 0.0);
            a.accept();
            b.accept();
        }
        assertArrayEquals(a.w(), b.w(), 0.0);
    }

    @Test
    public void testWEqualsSumOfAcceptedIncrements() {
        WienerProcess p = process(3, NoiseRefinement.DISCARD);
        double[] sum = new double[2];
        double t = 0;
        for (int k = 0; k < 50; k++) {
            double dt = 0.01 * (1 + k % 3);
            NoiseIncrement inc = p.draw(t, dt, null);
            if (k % 4 == 3) {
                p.reject(dt / 2);
                continue;
            }
            sum[0] += inc.dW()[0];
            sum[1] += inc.dW()[1];
            p.accept();
            t += dt;
        }
        assertArrayEquals(sum, p.w(), 1e-12);

        NoiseBuffer buffer = p.buffer();
        double[] fromBuffer = new double[2];
        for (int k = 0; k < buffer.size(); k++) {
            fromBuffer[0] += buffer.increment(k)[0];
            fromBuffer[1] += buffer.increment(k)[1];
        }
        assertArrayEquals(sum, fromBuffer, 1e-12);
    }

    @Test
    public void testRejectedIncrementNeverReachesThePath() {
        WienerProcess p = process(5, NoiseRefinement.DISCARD);
        double rejected = p.draw(0.0, 0.5, null).dW()[0];
        p.reject(0.25);

        double retry = p.draw(0.0, 0.25, null).dW()[0];
        p.accept();

        assertEquals(1, p.buffer().size());
        assertEquals(retry, p.buffer().increment(0)[0], 0.0);
        assertEquals(retry, p.w()[0], 0.0);
        assertNotEquals(rejected, p.w()[0], 0.0);
        assertEquals(0, p.maxStackSize());
    }

    @Test
    public void testBrownianBridgeReusesRejectedNoise() {
        WienerProcess p = process(8, NoiseRefinement.BROWNIAN_BRIDGE);
        double[] rejected = p.draw(0.0, 1.0, null).dW().clone();
        p.reject(0.5);
        assertEquals(1, p.pendingFuturePieces());

        double[] first = p.draw(0.0, 0.5, null).dW().clone();
        p.accept();
        assertEquals(1, p.pendingFuturePieces());
        double[] second = p.draw(0.5, 0.5, null).dW().clone();
        p.accept();

        assertEquals(0, p.pendingFuturePieces());
        assertEquals(rejected[0], first[0] + second[0], 1e-12);
        assertEquals(rejected[1], first[1] + second[1], 1e-12);
        assertArrayEquals(rejected, p.w(), 1e-12);
        assertEquals(1, p.maxStackSize());
    }

    @Test
    public void testBrownianBridgeTopsUpBeyondStoredFuture() {
        WienerProcess p = process(9, NoiseRefinement.BROWNIAN_BRIDGE);
        p.draw(0.0, 0.5, null);
        p.reject(0.25);

        // The stored piece covers only half of this interval; the rest is drawn fresh.
        NoiseIncrement inc = p.draw(0.0, 1.0, null);
        assertEquals(1.0, inc.dt(), 0.0);
        assertEquals(0, p.pendingFuturePieces());
        p.accept();
        assertEquals(1, p.buffer().size());
    }

    @Test
    public void testScalarNoiseIsBroadcast() {
        WienerProcess p = new WienerProcess(NoiseShape.of(NoiseType.SCALAR, 3), RandomProviders.create(1), false,
                NoiseRefinement.DISCARD, 1e-15, true);
        NoiseIncrement inc = p.draw(0.0, 0.2, null);
        assertNull(inc.dZ());
        assertEquals(inc.dW()[0], inc.dW()[1], 0.0);
        assertEquals(inc.dW()[0], inc.dW()[2], 0.0);
    }

    @Test
    public void testIncrementVarianceMatchesStepSize() {
        WienerProcess p = new WienerProcess(NoiseShape.of(NoiseType.DIAGONAL, 1), RandomProviders.create(2024),
                false, NoiseRefinement.DISCARD, 1e-15, false);
        int n = 40_000;
        double dt = 0.25;
        double sum = 0, sumSq = 0;
        for (int k = 0; k < n; k++) {
            double w = p.draw(k * dt, dt, null).dW()[0];
            p.accept();
            sum += w;
            sumSq += w * w;
        }
        double mean = sum / n;
        double variance = sumSq / n - mean * mean;
        assertEquals(0.0, mean, 0.02);
        assertEquals(dt, variance, 0.02);
    }

    @Test(expected = IllegalStateException.class)
    public void testAcceptWithoutDrawFails() {
        process(1, NoiseRefinement.DISCARD).accept();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveIntervalRejected() {
        process(1, NoiseRefinement.DISCARD).draw(0.0, 0.0, null);
    }
}
