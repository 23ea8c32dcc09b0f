package com.phillippitts.mathscrap.service.symbolic;

import net.objecthunter.exp4j.ExpressionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalDouble;

/**
 * Floating-point evaluation of constant expressions through exp4j.
 */
final class NumericEvaluator {

    private static final Logger LOG = LogManager.getLogger(NumericEvaluator.class);

    private NumericEvaluator() {
    }

    /**
     * Evaluates an expression without free symbols.
     *
     * @return the value, or empty when the expression has free symbols or the value is not a
     *         finite real number
     */
    static OptionalDouble evaluate(SymbolicExpression expression) {
        if (!expression.isNumber()) {
            return OptionalDouble.empty();
        }
        String infix = ExpressionPrinter.toInfix(expression);
        try {
            double value = new ExpressionBuilder(infix).build().evaluate();
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (IllegalArgumentException | ArithmeticException e) {
            LOG.debug("Numeric evaluation of {} failed: {}", infix, e.getMessage());
            return OptionalDouble.empty();
        }
    }
}
