package com.phillippitts.mathscrap.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Externally visible validation outcome for one expression.
 *
 * @param valid           markup translated into a parseable symbolic expression
 * @param expression      printed symbolic form, or the placeholder name when unparseable
 * @param simplified      simplified symbolic form (valid results only)
 * @param analysis        structural analysis (valid results only)
 * @param canonicalMarkup the canonical markup that was validated
 * @param error           failure description (invalid results only)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
        boolean valid,
        @JsonProperty("sympy_expression") String expression,
        String simplified,
        AnalysisReport analysis,
        @JsonProperty("original_latex") String canonicalMarkup,
        String error
) {

    public ValidationResult {
        Objects.requireNonNull(canonicalMarkup, "canonicalMarkup");
    }

    public static ValidationResult valid(String expression, String simplified,
                                         AnalysisReport analysis, String canonicalMarkup) {
        return new ValidationResult(true, expression, simplified,
                Objects.requireNonNull(analysis, "analysis"), canonicalMarkup, null);
    }

    public static ValidationResult invalid(String placeholder, String canonicalMarkup, String error) {
        return new ValidationResult(false, placeholder, null, null, canonicalMarkup,
                Objects.requireNonNull(error, "error"));
    }
}
