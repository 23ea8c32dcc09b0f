package com.phillippitts.mathscrap.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural properties of a symbolic expression. Derived read-only; never mutates the expression.
 *
 * @param classification     primary classification
 * @param variables          free symbols, sorted
 * @param constants          numeric atoms and named constants, sorted
 * @param degree             polynomial degree; present only for single-variable polynomials
 * @param isPolynomial       polynomial in its free symbols
 * @param isRationalFunction ratio of polynomials in its free symbols
 * @param isEquation         analyzed expression came from an equation (lhs - rhs)
 * @param specialForms       trigonometric, exponential/logarithmic, radical
 * @param numericValue       floating-point value when the expression is constant
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReport(
        @JsonProperty("type") ExpressionClass classification,
        Set<String> variables,
        Set<String> constants,
        Integer degree,
        @JsonProperty("is_polynomial") boolean isPolynomial,
        @JsonProperty("is_rational") boolean isRationalFunction,
        @JsonProperty("is_equation") boolean isEquation,
        @JsonProperty("special_forms") Set<String> specialForms,
        @JsonProperty("numeric_value") Double numericValue
) {

    public AnalysisReport {
        Objects.requireNonNull(classification, "classification");
        variables = sorted(variables);
        constants = sorted(constants);
        specialForms = sorted(specialForms);
        if (degree != null && (!isPolynomial || variables.isEmpty())) {
            throw new IllegalArgumentException("degree requires a polynomial with at least one variable");
        }
    }

    private static Set<String> sorted(Set<String> values) {
        return values == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
