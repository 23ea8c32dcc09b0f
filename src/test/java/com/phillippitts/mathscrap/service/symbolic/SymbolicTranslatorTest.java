package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.config.properties.TranslatorProperties;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker.Reason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolicTranslatorTest {

    private final SymbolicTranslator translator = new SymbolicTranslator(new TranslatorProperties());

    private String printed(String markup) {
        return ExpressionPrinter.print(translator.translate(markup));
    }

    @Test
    void quadraticEquation() {
        SymbolicExpression e = translator.translate("x^{2} + 5x + 6 = 0");

        assertThat(e).isInstanceOf(Equation.class);
        assertThat(ExpressionPrinter.print(e)).isEqualTo("Eq(x**2 + 5*x + 6, 0)");
        assertThat(e.freeSymbols()).containsExactly("x");
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "\\frac{3}{4}            | 3/4",
            "\\frac{1}{2}x           | x/2",
            "\\sqrt{2}               | sqrt(2)",
            "x_{1} + x_{2}           | x_1 + x_2",
            "\\pi r^{2}              | pi*r**2",
            "\\sin x                 | sin(x)",
            "2 \\cdot 3              | 6",
            "\\mathrm{a} - 1         | a - 1",
            "\\int 2x \\, dx         | 2*x",
            "complex_expression      | complex_expression"
    })
    void translatesMarkup(String markup, String expected) {
        assertThat(printed(markup)).isEqualTo(expected);
    }

    @Test
    void lengthWindowYieldsComplexMarker() {
        assertThat(translator.translate("")).isEqualTo(new UnparseableMarker(Reason.COMPLEX));
        assertThat(translator.translate((String) null)).isEqualTo(new UnparseableMarker(Reason.COMPLEX));
        assertThat(translator.translate("x")).isEqualTo(new UnparseableMarker(Reason.COMPLEX));
        assertThat(translator.translate("x+".repeat(150))).isEqualTo(new UnparseableMarker(Reason.COMPLEX));
    }

    @Test
    void malformedTextYieldsUnparseableMarker() {
        assertThat(translator.translate("x + * y")).isEqualTo(new UnparseableMarker(Reason.UNPARSEABLE));
        assertThat(translator.translate("a = b = c")).isEqualTo(new UnparseableMarker(Reason.UNPARSEABLE));
    }

    @Test
    void divisionByZeroYieldsUnparseableMarker() {
        assertThat(translator.translate("\\frac{1}{0}")).isEqualTo(new UnparseableMarker(Reason.UNPARSEABLE));
    }

    @Test
    void tabularTakesFirstCellThatTranslates() {
        SymbolicExpression e = translator.translate(
                "\\begin{aligned} x + y &= 3 \\\\ x - y &= 1 \\end{aligned}");

        assertThat(ExpressionPrinter.print(e)).isEqualTo("x + y");
    }

    @Test
    void tabularWithoutOperatorCellsIsComplexArray() {
        SymbolicExpression e = translator.translate("\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix}");

        assertThat(e).isEqualTo(new UnparseableMarker(Reason.COMPLEX_ARRAY));
    }

    @Test
    void unterminatedTabularIsArrayMarker() {
        assertThat(translator.translate("\\begin{array}{cc} 1 & 2"))
                .isEqualTo(new UnparseableMarker(Reason.ARRAY));
    }

    @Test
    void candidateCellsNeedOperatorAndLength() {
        assertThat(SymbolicTranslator.candidateCells(" a+b & 7 & c \\\\ (d) ")).containsExactly("a+b", "(d)");
    }

    @Test
    void windowIsConfigurable() {
        SymbolicTranslator strict = new SymbolicTranslator(new TranslatorProperties(2, 5));

        assertThat(strict.translate("a + b + c + d")).isEqualTo(new UnparseableMarker(Reason.COMPLEX));
        assertThat(ExpressionPrinter.print(strict.translate("a + b"))).isEqualTo("a + b");
    }
}
