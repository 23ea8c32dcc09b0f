package com.phillippitts.mathscrap.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of solving an equation for each of its variables.
 *
 * @param solvable       an equation with at least one variable was found
 * @param equation       printed symbolic equation
 * @param variables      variables solved for, sorted
 * @param solutions      roots per variable that could be solved
 * @param unsolved       variables the solver could not isolate
 * @param originalMarkup markup as submitted
 * @param error          failure description when not solvable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResult(
        boolean solvable,
        String equation,
        List<String> variables,
        Map<String, List<String>> solutions,
        List<String> unsolved,
        @JsonProperty("original_latex") String originalMarkup,
        String error
) {

    public SolveResult {
        Objects.requireNonNull(originalMarkup, "originalMarkup");
        variables = variables == null ? null : List.copyOf(variables);
        solutions = solutions == null ? null : Map.copyOf(solutions);
        unsolved = unsolved == null ? null : List.copyOf(unsolved);
    }

    public static SolveResult notSolvable(String originalMarkup, String error) {
        return new SolveResult(false, null, null, null, null, originalMarkup, error);
    }
}
