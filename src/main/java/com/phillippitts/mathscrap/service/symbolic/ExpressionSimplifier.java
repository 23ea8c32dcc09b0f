package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Simplifies expressions by expanding products and powers and collecting like terms.
 *
 * <p>An equation whose sides differ by a constant reduces to {@code True} or {@code False};
 * otherwise both sides are simplified and printed as {@code Eq(lhs, rhs)}.
 */
@Component
public class ExpressionSimplifier {

    public static final String TRUE = "True";
    public static final String FALSE = "False";

    /** Absolute tolerance when a constant difference can only be compared numerically. */
    static final double EQUALITY_TOLERANCE = 1e-12;

    public SymbolicExpression simplify(SymbolicExpression expression) {
        if (expression instanceof UnparseableMarker || expression instanceof Equation) {
            return expression;
        }
        return Polynomial.expand(expression).toExpression();
    }

    /**
     * Simplified form as printed text.
     */
    public String simplifyToString(SymbolicExpression expression) {
        if (expression instanceof UnparseableMarker marker) {
            return marker.placeholder();
        }
        if (!(expression instanceof Equation eq)) {
            return ExpressionPrinter.print(simplify(expression));
        }
        SymbolicExpression lhs = simplify(eq.lhs());
        SymbolicExpression rhs = simplify(eq.rhs());
        SymbolicExpression difference = simplify(Expressions.sub(lhs, rhs));
        if (difference instanceof Num num) {
            return num.value().isZero() ? TRUE : FALSE;
        }
        if (difference.isNumber()) {
            OptionalDouble value = NumericEvaluator.evaluate(difference);
            if (value.isPresent()) {
                return Math.abs(value.getAsDouble()) < EQUALITY_TOLERANCE ? TRUE : FALSE;
            }
        }
        return ExpressionPrinter.print(new Equation(lhs, rhs));
    }
}
