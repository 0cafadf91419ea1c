package com.stochastic.sde.io;

import com.stochastic.sde.config.Algorithm;
import com.stochastic.sde.config.NoiseRefinement;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.tableau.SriTableau;
import com.stochastic.sde.tableau.TableauFamily;
import com.stochastic.sde.tableau.Tableaus;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class OptionsLoaderTest {

    @Test
    public void testInlineTableauResource() throws IOException {
        OptionsDefinition def = OptionsLoader.readResource("options/sri_inline_tableau.json");
        assertTrue(def.getTableau().isInline());

        SolverOptions options = OptionsLoader.toOptions(def);
        assertEquals(Algorithm.SRI, options.algorithm());
        assertTrue(options.adaptive());
        assertEquals(1e-4, options.abstol(), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, options.internalNorm(), 0.0);
        assertEquals(100000, options.maxiters());
        assertEquals(Long.valueOf(42), options.seed());

        assertTrue(options.tableau() instanceof SriTableau);
        SriTableau tableau = (SriTableau) options.tableau();
        assertEquals("SRIW1-inline", tableau.name());
        assertEquals(TableauFamily.SRI, tableau.family());
        assertArrayEquals(Tableaus.sriw1().beta4(), tableau.beta4(), 1e-15);
    }

    @Test
    public void testBundledOptions() throws IOException {
        OptionsDefinition gbm = OptionsLoader.readResource("options/gbm_adaptive.json");
        SolverOptions options = OptionsLoader.toOptions(gbm);
        assertEquals(Algorithm.SRIW1_OPTIMIZED, options.algorithm());
        assertEquals(NoiseRefinement.BROWNIAN_BRIDGE, options.noiseRefinement());
        assertArrayEquals(new double[] { 0.0, 1.0 }, gbm.getTimeSpan(), 0.0);

        SolverOptions em = OptionsLoader.toOptions(OptionsLoader.readResource("options/em_fixed_step.json"));
        assertEquals(Algorithm.EM, em.algorithm());
        assertEquals(1.0 / 512, em.dt(), 0.0);
        assertFalse(em.adaptive());
    }

    @Test
    public void testAbsentFieldsKeepDefaults() {
        SolverOptions options = OptionsLoader.parse("{\"dt\": 0.25}");
        SolverOptions defaults = SolverOptions.defaults();

        assertEquals(0.25, options.dt(), 0.0);
        assertEquals(defaults.algorithm(), options.algorithm());
        assertEquals(defaults.gamma(), options.gamma(), 0.0);
        assertEquals(defaults.qmax(), options.qmax(), 0.0);
        assertFalse(options.hasSeed());
        assertNull(options.tableau());
    }

    @Test
    public void testEnumAliases() {
        assertEquals(Algorithm.RK_MIL, OptionsLoader.parseEnum(Algorithm.class, "RKMil"));
        assertEquals(Algorithm.SRA1_OPTIMIZED, OptionsLoader.parseEnum(Algorithm.class, "sra1-optimized"));
        assertEquals(Algorithm.TAU_LEAPING, OptionsLoader.parseEnum(Algorithm.class, "TauLeaping"));
        assertEquals(NoiseRefinement.DISCARD, OptionsLoader.parseEnum(NoiseRefinement.class, "discard"));
        try {
            OptionsLoader.parseEnum(Algorithm.class, "Heun");
            fail("Unknown algorithm should be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown Algorithm: Heun", e.getMessage());
        }
    }

    @Test
    public void testNormNames() {
        assertEquals(Double.POSITIVE_INFINITY, OptionsLoader.parseNorm("inf"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, OptionsLoader.parseNorm(" MAX "), 0.0);
        assertEquals(1.0, OptionsLoader.parseNorm("1"), 0.0);
        assertEquals(2.0, OptionsLoader.parse("{\"internalNorm\": 2}").internalNorm(), 0.0);
        try {
            OptionsLoader.parseNorm("euclid");
            fail("Unknown norm should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("euclid"));
        }
    }

    @Test
    public void testBuiltInTableauByName() {
        SolverOptions options = OptionsLoader.parse("{\"algorithm\": \"SRA\", \"tableau\": {\"name\": \"sra1\"}}");
        assertEquals("SRA1", options.tableau().name());
    }

    @Test
    public void testInvalidInput() {
        try {
            OptionsLoader.parse("{\"dt\": ");
            fail("Truncated JSON should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Invalid options JSON"));
        }
        try {
            OptionsLoader.parse("{\"qmin\": 2.0}");
            fail("Out-of-range qmin should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("qmin"));
        }
        try {
            OptionsLoader.parse("{\"tableau\": {\"name\": \"x\", \"alpha\": [1], \"order\": 1}}");
            fail("Inline tableau without family should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("family"));
        }
    }

    @Test
    public void testWriteThenLoadFile() throws IOException {
        OptionsDefinition def = new OptionsDefinition();
        def.setAlgorithm("RK_MIL");
        def.setDt(0.125);
        def.setSeed(7L);
        String json = OptionsLoader.write(def);
        assertFalse(json.contains("inline"));

        Path file = Files.createTempFile("options", ".json");
        try {
            Files.writeString(file, json);
            SolverOptions options = OptionsLoader.load(file);
            assertEquals(Algorithm.RK_MIL, options.algorithm());
            assertEquals(0.125, options.dt(), 0.0);
            assertEquals(Long.valueOf(7), options.seed());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        OptionsLoader.readResource("options/does_not_exist.json");
    }
}
