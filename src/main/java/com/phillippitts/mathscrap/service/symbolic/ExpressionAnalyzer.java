package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.domain.AnalysisReport;
import com.phillippitts.mathscrap.domain.ExpressionClass;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Add;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Constant;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Func;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Mul;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Pow;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Sym;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies a symbolic expression and extracts its structural properties.
 *
 * <p>An equation is analyzed as {@code lhs - rhs}. Classification follows a fixed decision
 * order: constant, variable, sum, product, power, trigonometric, exponential, polynomial,
 * rational, general.
 */
@Component
public class ExpressionAnalyzer {

    static final String TRIGONOMETRIC = "trigonometric";
    static final String EXPONENTIAL = "exponential/logarithmic";
    static final String RADICAL = "radical";

    /**
     * Analyzes an expression.
     *
     * @throws IllegalArgumentException for an {@link UnparseableMarker}; callers check first
     */
    public AnalysisReport analyze(SymbolicExpression expression) {
        if (expression instanceof UnparseableMarker marker) {
            throw new IllegalArgumentException("Cannot analyze placeholder " + marker.placeholder());
        }
        boolean equation = expression instanceof Equation;
        SymbolicExpression target = expression instanceof Equation eq
                ? Expressions.sub(eq.lhs(), eq.rhs())
                : expression;

        Set<String> variables = target.freeSymbols();
        boolean polynomial = isPolynomial(target);
        boolean rational = isRational(target);
        Integer degree = polynomial && variables.size() == 1
                ? degree(target, variables.iterator().next()).orElse(null)
                : null;
        OptionalDouble numeric = NumericEvaluator.evaluate(target);

        return new AnalysisReport(
                classify(target, polynomial, rational),
                variables,
                constants(target),
                degree,
                polynomial,
                rational,
                equation,
                specialForms(target),
                numeric.isPresent() ? numeric.getAsDouble() : null);
    }

    static ExpressionClass classify(SymbolicExpression e, boolean polynomial, boolean rational) {
        if (e.isNumber()) {
            return ExpressionClass.CONSTANT;
        }
        if (e instanceof Sym) {
            return ExpressionClass.VARIABLE;
        }
        if (e instanceof Add) {
            return ExpressionClass.SUM;
        }
        if (e instanceof Mul) {
            return ExpressionClass.PRODUCT;
        }
        if (e instanceof Pow) {
            return ExpressionClass.POWER;
        }
        if (hasTrigonometric(e)) {
            return ExpressionClass.TRIGONOMETRIC;
        }
        if (hasExponential(e)) {
            return ExpressionClass.EXPONENTIAL;
        }
        if (polynomial) {
            return ExpressionClass.POLYNOMIAL;
        }
        return rational ? ExpressionClass.RATIONAL : ExpressionClass.GENERAL;
    }

    /** Polynomial in its free symbols; symbol-free sub-expressions count as coefficients. */
    static boolean isPolynomial(SymbolicExpression e) {
        if (e.isNumber()) {
            return true;
        }
        if (e instanceof Sym) {
            return true;
        }
        if (e instanceof Add || e instanceof Mul) {
            return e.children().stream().allMatch(ExpressionAnalyzer::isPolynomial);
        }
        if (e instanceof Pow pow) {
            Optional<Rational> exponent = pow.rationalExponent();
            return exponent.isPresent() && exponent.get().isInteger() && exponent.get().signum() > 0
                    && isPolynomial(pow.base());
        }
        return false;
    }

    /** Ratio of polynomials in its free symbols. */
    static boolean isRational(SymbolicExpression e) {
        if (e.isNumber() || e instanceof Sym) {
            return true;
        }
        if (e instanceof Add || e instanceof Mul) {
            return e.children().stream().allMatch(ExpressionAnalyzer::isRational);
        }
        if (e instanceof Pow pow) {
            Optional<Rational> exponent = pow.rationalExponent();
            return exponent.isPresent() && exponent.get().isInteger() && isRational(pow.base());
        }
        return false;
    }

    /**
     * Degree in one variable: from the expanded form when expansion succeeds, from the tree
     * when powers are too large to expand.
     */
    static Optional<Integer> degree(SymbolicExpression e, String variable) {
        try {
            Optional<Integer> expanded = Polynomial.expand(e).coefficientsIn(Expressions.sym(variable))
                    .map(List::size)
                    .map(size -> size - 1);
            return expanded.isPresent() ? expanded : Optional.of(structuralDegree(e, variable));
        } catch (ArithmeticException ex) {
            return Optional.empty();
        }
    }

    /**
     * Degree of a polynomial read from its tree: sums take the maximum, products the sum and
     * integer powers multiply.
     *
     * @throws ArithmeticException when the degree does not fit in an {@code int}
     */
    private static int structuralDegree(SymbolicExpression e, String variable) {
        if (!e.freeSymbols().contains(variable)) {
            return 0;
        }
        if (e instanceof Sym) {
            return 1;
        }
        if (e instanceof Add) {
            int max = 0;
            for (SymbolicExpression term : e.children()) {
                max = Math.max(max, structuralDegree(term, variable));
            }
            return max;
        }
        if (e instanceof Mul) {
            int sum = 0;
            for (SymbolicExpression factor : e.children()) {
                sum = Math.addExact(sum, structuralDegree(factor, variable));
            }
            return sum;
        }
        if (e instanceof Pow pow) {
            int exponent = pow.rationalExponent()
                    .orElseThrow(() -> new ArithmeticException("Symbolic exponent"))
                    .intValueExact();
            return Math.multiplyExact(structuralDegree(pow.base(), variable), exponent);
        }
        throw new ArithmeticException("Not a polynomial node: " + ExpressionPrinter.print(e));
    }

    private static Set<String> constants(SymbolicExpression e) {
        Set<String> out = new TreeSet<>();
        collectConstants(e, out);
        return out;
    }

    private static void collectConstants(SymbolicExpression e, Set<String> out) {
        if (e instanceof Num num) {
            out.add(num.value().toString());
        } else if (e instanceof Constant constant) {
            out.add(constant.name());
        } else {
            for (SymbolicExpression child : e.children()) {
                collectConstants(child, out);
            }
        }
    }

    private static Set<String> specialForms(SymbolicExpression e) {
        Set<String> forms = new TreeSet<>();
        if (hasTrigonometric(e)) {
            forms.add(TRIGONOMETRIC);
        }
        if (hasExponential(e)) {
            forms.add(EXPONENTIAL);
        }
        if (e.contains(node -> node instanceof Pow pow
                && pow.rationalExponent().map(r -> !r.isInteger()).orElse(false))) {
            forms.add(RADICAL);
        }
        return forms;
    }

    private static boolean hasTrigonometric(SymbolicExpression e) {
        return e.contains(node -> node instanceof Func func && func.function().isTrigonometric());
    }

    private static boolean hasExponential(SymbolicExpression e) {
        return e.contains(node -> node instanceof Func func
                && (func.function() == FunctionName.EXP || func.function() == FunctionName.LOG));
    }
}
