package com.stochastic.sde.util;

import com.stochastic.sde.api.ReturnCode;
import org.junit.Test;

import static org.junit.Assert.*;

public class ProgressListenersTest {

    @Test
    public void testStepStatistics() {
        var stats = new StepStatisticsListener();
        stats.onIntegrationStart(0, 1, 0.1);
        stats.onProgress(1, 0.1, 0.1, new double[] { 1 });
        stats.onStepRejected(1, 0.1, 0.2, 0.05, 3.5);
        stats.onStepRejected(1, 0.1, 0.05, 0.02, 1.5);
        stats.onProgress(2, 0.12, 0.02, new double[] { 1 });
        stats.onIntegrationEnd(6, 2, 1.0, ReturnCode.SUCCESS);

        assertEquals(6, stats.acceptedSteps());
        assertEquals(2, stats.rejectedSteps());
        assertEquals(2, stats.progressEvents());
        assertEquals(0.25, stats.rejectionRatio(), 1e-15);
        assertEquals(0.02, stats.minDt(), 0.0);
        assertEquals(0.1, stats.maxDt(), 0.0);
        assertEquals(3.5, stats.maxRejectedError(), 0.0);
        assertEquals(ReturnCode.SUCCESS, stats.lastRetcode());
        assertTrue(stats.lastRunMillis() >= 0);

        String dump = stats.dump();
        assertTrue(dump.contains("Retcode"));
        assertTrue(dump.contains("SUCCESS"));

        stats.reset();
        assertEquals(0, stats.acceptedSteps());
        assertEquals(0.0, stats.minDt(), 0.0);
        assertEquals(0.0, stats.rejectionRatio(), 0.0);
        assertNull(stats.lastRetcode());
    }

    @Test
    public void testNonFiniteRejectionDoesNotMaskErrors() {
        var stats = new StepStatisticsListener();
        stats.onStepRejected(0, 0, 0.1, 0.05, Double.NaN);
        assertEquals(0.0, stats.maxRejectedError(), 0.0);
    }

    @Test
    public void testCompositeFansOut() {
        var composite = new CompositeProgressListener();
        var a = new StepStatisticsListener();
        var b = new StepStatisticsListener();
        composite.add(a);
        composite.add(b);
        composite.add(new LoggingProgressListener());
        assertEquals(3, composite.size());

        composite.onIntegrationStart(0, 1, 0.5);
        composite.onProgress(1, 0.5, 0.5, new double[] { 2 });
        composite.onStepRejected(1, 0.5, 0.5, 0.25, 2.0);
        composite.onIntegrationEnd(2, 1, 1.0, ReturnCode.SUCCESS);

        assertEquals(2, a.acceptedSteps());
        assertEquals(1, b.rejectedSteps());
        assertEquals(1, b.progressEvents());
    }
}
