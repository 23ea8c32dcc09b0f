package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.domain.SolveResult;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Mul;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Sym;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Solves equations of degree one or two in each of their variables.
 *
 * <p>Coefficients may involve the other variables. Real roots of numeric quadratics are exact
 * (rational or surd, with square factors pulled out of the root) and sorted ascending;
 * negative discriminants give a complex-conjugate pair written with {@code I}. A variable the
 * equation is not polynomial in, or is of degree three or more in, is reported as unsolved.
 */
@Component
public class EquationSolver {

    private static final Logger LOG = LogManager.getLogger(EquationSolver.class);

    public static final String NO_EQUATION = "No equation found (missing = sign)";
    public static final String UNPARSEABLE_SIDES = "Could not parse equation sides";
    public static final String NO_VARIABLES = "No variables found in equation";

    /** Largest factor tried when pulling square factors out of a root. */
    private static final long MAX_SQUARE_FACTOR = 1_000_000L;

    private final SymbolicTranslator translator;

    public EquationSolver(SymbolicTranslator translator) {
        this.translator = Objects.requireNonNull(translator, "translator");
    }

    /**
     * Solves an equation given as canonical markup.
     *
     * @param markup markup containing a single {@code =}
     * @return solve result; never null
     */
    public SolveResult solve(String markup) {
        String source = markup == null ? "" : markup;
        if (!source.contains("=")) {
            return SolveResult.notSolvable(source, NO_EQUATION);
        }
        SymbolicExpression translated = translator.translate(source);
        if (!(translated instanceof Equation equation)) {
            return SolveResult.notSolvable(source, UNPARSEABLE_SIDES);
        }
        List<String> variables = new ArrayList<>(equation.freeSymbols());
        if (variables.isEmpty()) {
            return SolveResult.notSolvable(source, NO_VARIABLES);
        }

        Polynomial difference = Polynomial.expand(Expressions.sub(equation.lhs(), equation.rhs()));
        Map<String, List<String>> solutions = new LinkedHashMap<>();
        List<String> unsolved = new ArrayList<>();
        for (String variable : variables) {
            Optional<List<String>> roots = roots(difference, Expressions.sym(variable));
            if (roots.isPresent()) {
                solutions.put(variable, roots.get());
            } else {
                unsolved.add(variable);
            }
        }
        LOG.debug("Solved for {} of {} variables", solutions.size(), variables.size());
        return new SolveResult(true, ExpressionPrinter.print(equation), variables, solutions, unsolved, source, null);
    }

    static Optional<List<String>> roots(Polynomial polynomial, Sym variable) {
        Optional<List<SymbolicExpression>> coefficients = polynomial.coefficientsIn(variable);
        if (coefficients.isEmpty()) {
            return Optional.empty();
        }
        List<SymbolicExpression> c = coefficients.get();
        try {
            switch (c.size() - 1) {
                case 0:
                    return Optional.of(List.of());
                case 1:
                    return Optional.of(List.of(ExpressionPrinter.print(
                            simplify(Expressions.div(Expressions.neg(c.get(0)), c.get(1))))));
                case 2:
                    return Optional.of(quadraticRoots(c.get(2), c.get(1), c.get(0)));
                default:
                    return Optional.empty();
            }
        } catch (ArithmeticException e) {
            LOG.debug("Could not solve for {}: {}", variable.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> quadraticRoots(SymbolicExpression a, SymbolicExpression b, SymbolicExpression c) {
        SymbolicExpression discriminant = simplify(Expressions.sub(
                Expressions.pow(b, Expressions.num(2)),
                Expressions.mul(Expressions.num(4), a, c)));
        SymbolicExpression twoA = Expressions.mul(Expressions.num(2), a);
        SymbolicExpression minusB = Expressions.neg(b);

        if (!(discriminant instanceof Num d)) {
            SymbolicExpression root = Expressions.sqrt(discriminant);
            return List.of(
                    ExpressionPrinter.print(simplify(Expressions.div(Expressions.sub(minusB, root), twoA))),
                    ExpressionPrinter.print(simplify(Expressions.div(Expressions.add(minusB, root), twoA))));
        }
        Rational value = d.value();
        if (value.isZero()) {
            return List.of(ExpressionPrinter.print(simplify(Expressions.div(minusB, twoA))));
        }
        if (value.signum() > 0) {
            SymbolicExpression root = surd(value);
            List<SymbolicExpression> roots = new ArrayList<>(List.of(
                    simplify(Expressions.div(Expressions.sub(minusB, root), twoA)),
                    simplify(Expressions.div(Expressions.add(minusB, root), twoA))));
            sortNumerically(roots);
            return roots.stream().map(ExpressionPrinter::print).toList();
        }
        SymbolicExpression real = simplify(Expressions.div(minusB, twoA));
        SymbolicExpression imaginary = simplify(Expressions.div(surd(value.negate()), twoA));
        OptionalDouble im = NumericEvaluator.evaluate(imaginary);
        if (im.isPresent() && im.getAsDouble() < 0) {
            imaginary = simplify(Expressions.neg(imaginary));
        }
        return List.of(complexRoot(real, imaginary, false), complexRoot(real, imaginary, true));
    }

    private static void sortNumerically(List<SymbolicExpression> roots) {
        List<OptionalDouble> values = roots.stream().map(NumericEvaluator::evaluate).toList();
        if (values.stream().allMatch(OptionalDouble::isPresent)) {
            roots.sort(Comparator.comparingDouble(r -> NumericEvaluator.evaluate(r).getAsDouble()));
        }
    }

    /** {@code re - im*I} or {@code re + im*I}, with the imaginary unit placed after the surd. */
    private static String complexRoot(SymbolicExpression real, SymbolicExpression imaginary, boolean plus) {
        Rational coefficient = imaginary instanceof Num n ? n.value()
                : imaginary instanceof Mul m ? m.coefficient() : Rational.ONE;
        SymbolicExpression rest = simplify(Expressions.div(imaginary, Expressions.num(coefficient)));
        StringBuilder unit = new StringBuilder();
        if (!coefficient.numerator().equals(BigInteger.ONE)) {
            unit.append(coefficient.numerator()).append('*');
        }
        if (!(rest instanceof Num)) {
            unit.append(ExpressionPrinter.print(rest)).append('*');
        }
        unit.append('I');
        if (!coefficient.denominator().equals(BigInteger.ONE)) {
            unit.append('/').append(coefficient.denominator());
        }
        if (real instanceof Num n && n.value().isZero()) {
            return plus ? unit.toString() : "-" + unit;
        }
        return ExpressionPrinter.print(real) + (plus ? " + " : " - ") + unit;
    }

    /** Square root of a non-negative rational with square factors moved outside. */
    static SymbolicExpression surd(Rational value) {
        BigInteger radicand = value.numerator().multiply(value.denominator());
        if (radicand.bitLength() > 62) {
            return Expressions.sqrt(Expressions.num(value));
        }
        long n = radicand.longValueExact();
        long outside = 1;
        for (long k = 2; k <= MAX_SQUARE_FACTOR && k * k <= n; k++) {
            while (n % (k * k) == 0) {
                n /= k * k;
                outside *= k;
            }
        }
        SymbolicExpression root = Expressions.mul(Expressions.num(outside), Expressions.sqrt(Expressions.num(n)));
        return Expressions.div(root, new Num(new Rational(value.denominator(), BigInteger.ONE)));
    }

    private static SymbolicExpression simplify(SymbolicExpression e) {
        return Polynomial.expand(e).toExpression();
    }
}
