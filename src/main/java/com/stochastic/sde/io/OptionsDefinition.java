package com.stochastic.sde.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of solver options in JSON. Absent fields keep the
 * defaults of {@link com.stochastic.sde.config.SolverOptions}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OptionsDefinition {
    private Double dt;
    private Boolean saveTimeseries;
    private Integer timeseriesSteps;
    private Boolean adaptive;
    private String algorithm;
    private Double abstol, reltol;
    private Double gamma, qmax, qmin, delta;
    private Long maxiters;
    private Double dtmax, dtmin;
    /** A number, or "Infinity"/"inf" for the max norm. */
    private String internalNorm;
    private Double discardLength;
    private String adaptiveController;
    private String noiseRefinement;
    private TableauDefinition tableau;
    private Long progressSteps;
    private Long seed;
    private double[] timeSpan;
}
