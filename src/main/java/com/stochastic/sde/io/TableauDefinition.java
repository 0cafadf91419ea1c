package com.stochastic.sde.io;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stochastic.sde.tableau.SraTableau;
import com.stochastic.sde.tableau.SriTableau;
import com.stochastic.sde.tableau.Tableau;
import com.stochastic.sde.tableau.TableauFamily;
import com.stochastic.sde.tableau.Tableaus;

import lombok.Data;

/**
 * POJO representation of a tableau in an options file.
 *
 * Either names a built-in tableau ({@code {"name": "SRA1"}}) or defines one
 * inline with its family, order and coefficients. SRA tableaus ignore the
 * {@code a1}, {@code b1}, {@code beta3} and {@code beta4} entries.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TableauDefinition {
    private String name;
    private String family;
    private Double order;
    private double[] c0, c1, alpha, beta1, beta2, beta3, beta4;
    private double[][] a0, a1, b0, b1;

    /** @return true if the definition carries coefficients rather than a built-in name. */
    @JsonIgnore
    public boolean isInline() {
        return alpha != null;
    }

    /**
     * Builds the tableau.
     *
     * @throws IllegalArgumentException if the definition is incomplete or fails
     *                                  validation.
     */
    public Tableau toTableau() {
        if (!isInline()) {
            if (name == null)
                throw new IllegalArgumentException("Tableau definition needs a built-in name or coefficients");
            return Tableaus.byName(name);
        }
        if (family == null)
            throw new IllegalArgumentException("Inline tableau '" + name + "' needs a family (SRI or SRA)");
        if (order == null)
            throw new IllegalArgumentException("Inline tableau '" + name + "' needs an order");
        String label = name != null ? name : "inline";
        return switch (TableauFamily.valueOf(family.trim().toUpperCase())) {
            case SRI -> new SriTableau(label, c0, c1, a0, a1, b0, b1, alpha, beta1, beta2, beta3, beta4, order);
            case SRA -> new SraTableau(label, c0, c1, a0, b0, alpha, beta1, beta2, order);
        };
    }
}
