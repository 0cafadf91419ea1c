package com.stochastic.sde.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stochastic.sde.config.AdaptiveControllerType;
import com.stochastic.sde.config.Algorithm;
import com.stochastic.sde.config.NoiseRefinement;
import com.stochastic.sde.config.SolverOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SolverOptions} from JSON.
 *
 * <pre>
 * {
 *   "algorithm": "SRI",
 *   "adaptive": true,
 *   "abstol": 1e-4,
 *   "tableau": { "name": "SRIW1" },
 *   "seed": 42
 * }
 * </pre>
 *
 * Enum values match case-insensitively and ignore underscores, so
 * {@code "SRIW1Optimized"}, {@code "sriw1_optimized"} and {@code "RKMil"} are
 * all accepted.
 */
public final class OptionsLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OptionsLoader() {
        // Utility class
    }

    /** Parses a JSON file into a definition. */
    public static OptionsDefinition readFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), OptionsDefinition.class);
    }

    /** Parses a classpath resource into a definition. */
    public static OptionsDefinition readResource(String resource) throws IOException {
        try (InputStream in = OptionsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, OptionsDefinition.class);
        }
    }

    /** Parses a JSON string into a definition. */
    public static OptionsDefinition read(String json) {
        try {
            return MAPPER.readValue(json, OptionsDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid options JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON string straight into options. */
    public static SolverOptions parse(String json) {
        return toOptions(read(json));
    }

    /** Loads options from a JSON file. */
    public static SolverOptions load(Path path) throws IOException {
        return toOptions(readFile(path));
    }

    /** Serializes a definition, e.g. to record the options of a run. */
    public static String write(OptionsDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize options", e);
        }
    }

    /**
     * Converts a definition into options, applying defaults for absent fields.
     *
     * @throws IllegalArgumentException on unknown enum names or out-of-range values.
     */
    public static SolverOptions toOptions(OptionsDefinition def) {
        SolverOptions.Builder b = SolverOptions.builder();
        if (def.getDt() != null)
            b.dt(def.getDt());
        if (def.getSaveTimeseries() != null)
            b.saveTimeseries(def.getSaveTimeseries());
        if (def.getTimeseriesSteps() != null)
            b.timeseriesSteps(def.getTimeseriesSteps());
        if (def.getAdaptive() != null)
            b.adaptive(def.getAdaptive());
        if (def.getAlgorithm() != null)
            b.algorithm(parseEnum(Algorithm.class, def.getAlgorithm()));
        if (def.getAbstol() != null)
            b.abstol(def.getAbstol());
        if (def.getReltol() != null)
            b.reltol(def.getReltol());
        if (def.getGamma() != null)
            b.gamma(def.getGamma());
        if (def.getQmax() != null)
            b.qmax(def.getQmax());
        if (def.getQmin() != null)
            b.qmin(def.getQmin());
        if (def.getDelta() != null)
            b.delta(def.getDelta());
        if (def.getMaxiters() != null)
            b.maxiters(def.getMaxiters());
        if (def.getDtmax() != null)
            b.dtmax(def.getDtmax());
        if (def.getDtmin() != null)
            b.dtmin(def.getDtmin());
        if (def.getInternalNorm() != null)
            b.internalNorm(parseNorm(def.getInternalNorm()));
        if (def.getDiscardLength() != null)
            b.discardLength(def.getDiscardLength());
        if (def.getAdaptiveController() != null)
            b.adaptiveController(parseEnum(AdaptiveControllerType.class, def.getAdaptiveController()));
        if (def.getNoiseRefinement() != null)
            b.noiseRefinement(parseEnum(NoiseRefinement.class, def.getNoiseRefinement()));
        if (def.getTableau() != null)
            b.tableau(def.getTableau().toTableau());
        if (def.getProgressSteps() != null)
            b.progressSteps(def.getProgressSteps());
        if (def.getSeed() != null)
            b.seed(def.getSeed());
        return b.build();
    }

    static double parseNorm(String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("inf") || v.equalsIgnoreCase("infinity") || v.equalsIgnoreCase("max"))
            return Double.POSITIVE_INFINITY;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid internalNorm: " + value, e);
        }
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        String wanted = normalize(value);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted))
                return constant;
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value);
    }

    private static String normalize(String s) {
        return s.replace("_", "").replace("-", "").trim().toUpperCase();
    }
}
