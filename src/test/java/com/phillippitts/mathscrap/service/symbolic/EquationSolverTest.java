package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.config.properties.TranslatorProperties;
import com.phillippitts.mathscrap.domain.SolveResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EquationSolverTest {

    private final EquationSolver solver = new EquationSolver(new SymbolicTranslator(new TranslatorProperties()));

    @Test
    void quadraticWithRationalRoots() {
        SolveResult result = solver.solve("x^{2} + 5x + 6 = 0");

        assertThat(result.solvable()).isTrue();
        assertThat(result.equation()).isEqualTo("Eq(x**2 + 5*x + 6, 0)");
        assertThat(result.variables()).containsExactly("x");
        assertThat(result.solutions()).containsEntry("x", List.of("-3", "-2"));
        assertThat(result.unsolved()).isEmpty();
        assertThat(result.error()).isNull();
    }

    @Test
    void linearEquation() {
        SolveResult result = solver.solve("2x + 3 = 7");

        assertThat(result.solutions().get("x")).containsExactly("2");
    }

    @Test
    void irrationalRootsAreExactSurds() {
        SolveResult result = solver.solve("x^{2} = 2");

        assertThat(result.solutions().get("x")).containsExactly("-sqrt(2)", "sqrt(2)");
    }

    @Test
    void negativeDiscriminantGivesConjugatePair() {
        SolveResult result = solver.solve("x^{2} + 1 = 0");

        assertThat(result.solutions().get("x")).containsExactly("-I", "I");
    }

    @Test
    void variableThatCancelsHasNoRoots() {
        SolveResult result = solver.solve("x + 1 = x + 2");

        assertThat(result.solvable()).isTrue();
        assertThat(result.solutions().get("x")).isEmpty();
    }

    @Test
    void cubicIsReportedUnsolved() {
        SolveResult result = solver.solve("x^{3} = 1");

        assertThat(result.solvable()).isTrue();
        assertThat(result.solutions()).isEmpty();
        assertThat(result.unsolved()).containsExactly("x");
    }

    @Test
    void solvesForEachVariable() {
        SolveResult result = solver.solve("x + y = 3");

        assertThat(result.variables()).containsExactly("x", "y");
        assertThat(result.solutions().get("x")).containsExactly("-y + 3");
        assertThat(result.solutions().get("y")).containsExactly("-x + 3");
    }

    @Test
    void missingEqualsSign() {
        SolveResult result = solver.solve("x + 1");

        assertThat(result.solvable()).isFalse();
        assertThat(result.error()).isEqualTo(EquationSolver.NO_EQUATION);
        assertThat(result.originalMarkup()).isEqualTo("x + 1");
    }

    @Test
    void unparseableSides() {
        assertThat(solver.solve("x + = 3").error()).isEqualTo(EquationSolver.UNPARSEABLE_SIDES);
    }

    @Test
    void noVariables() {
        assertThat(solver.solve("2 = 2").error()).isEqualTo(EquationSolver.NO_VARIABLES);
    }

    @Test
    void nullMarkupIsNotSolvable() {
        SolveResult result = solver.solve(null);

        assertThat(result.solvable()).isFalse();
        assertThat(result.originalMarkup()).isEmpty();
    }
}
