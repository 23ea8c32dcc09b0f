package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Add;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Constant;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Func;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Mul;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Pow;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Sym;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints expression trees.
 *
 * <p>{@link #print(SymbolicExpression)} produces computer-algebra style text
 * ({@code x**2 + 5*x + 6}, {@code 3*x/4}, {@code sqrt(2)}, {@code Eq(2*x + 3, 7)}), with sum
 * terms ordered by descending degree. {@link #toInfix(SymbolicExpression)} produces a fully
 * parenthesized {@code ^}-power form for numeric evaluation.
 */
public final class ExpressionPrinter {

    private static final Comparator<SymbolicExpression> DISPLAY_ORDER =
            Comparator.comparingInt(ExpressionPrinter::displayDegree).reversed()
                    .thenComparing(ExpressionPrinter::print);

    private ExpressionPrinter() {
    }

    public static String print(SymbolicExpression e) {
        if (e instanceof Num n) {
            return n.value().toString();
        }
        if (e instanceof Sym s) {
            return s.name();
        }
        if (e instanceof Constant c) {
            return c.name();
        }
        if (e instanceof Add add) {
            return printSum(add);
        }
        if (e instanceof Mul mul) {
            return printProduct(mul);
        }
        if (e instanceof Pow pow) {
            return printPower(pow);
        }
        if (e instanceof Func func) {
            return func.function().symbol() + "(" + print(func.argument()) + ")";
        }
        if (e instanceof Equation eq) {
            return "Eq(" + print(eq.lhs()) + ", " + print(eq.rhs()) + ")";
        }
        return ((UnparseableMarker) e).placeholder();
    }

    /**
     * Fully parenthesized infix form understood by exp4j. Only meaningful for expressions
     * without equations or markers.
     *
     * @throws IllegalArgumentException for equations and unparseable markers
     */
    public static String toInfix(SymbolicExpression e) {
        if (e instanceof Num n) {
            Rational v = n.value();
            return v.isInteger() ? "(" + v.numerator() + ")" : "(" + v.numerator() + "/" + v.denominator() + ")";
        }
        if (e instanceof Sym s) {
            return s.name();
        }
        if (e instanceof Constant c) {
            return c.name();
        }
        if (e instanceof Add add) {
            return add.terms().stream().map(ExpressionPrinter::toInfix).collect(Collectors.joining(" + ", "(", ")"));
        }
        if (e instanceof Mul mul) {
            return mul.factors().stream().map(ExpressionPrinter::toInfix).collect(Collectors.joining(" * ", "(", ")"));
        }
        if (e instanceof Pow pow) {
            return "(" + toInfix(pow.base()) + "^" + toInfix(pow.exponent()) + ")";
        }
        if (e instanceof Func func) {
            return func.function().symbol() + "(" + toInfix(func.argument()) + ")";
        }
        throw new IllegalArgumentException("No infix form for " + print(e));
    }

    static boolean isNegative(SymbolicExpression e) {
        if (e instanceof Num n) {
            return n.value().signum() < 0;
        }
        return e instanceof Mul mul && mul.coefficient().signum() < 0;
    }

    private static String printSum(Add add) {
        List<SymbolicExpression> terms = new ArrayList<>(add.terms());
        terms.sort(DISPLAY_ORDER);
        StringBuilder sb = new StringBuilder(print(terms.get(0)));
        for (SymbolicExpression term : terms.subList(1, terms.size())) {
            if (isNegative(term)) {
                sb.append(" - ").append(print(Expressions.neg(term)));
            } else {
                sb.append(" + ").append(print(term));
            }
        }
        return sb.toString();
    }

    private static String printProduct(Mul mul) {
        Rational coefficient = mul.coefficient();
        List<SymbolicExpression> rest = coefficient.isOne() && !(mul.factors().get(0) instanceof Num)
                ? mul.factors()
                : mul.factors().subList(1, mul.factors().size());
        String sign = coefficient.signum() < 0 ? "-" : "";
        Rational magnitude = coefficient.signum() < 0 ? coefficient.negate() : coefficient;

        List<String> numerator = new ArrayList<>();
        List<SymbolicExpression> denominator = new ArrayList<>();
        if (!magnitude.numerator().equals(BigInteger.ONE)) {
            numerator.add(magnitude.numerator().toString());
        }
        for (SymbolicExpression factor : rest) {
            if (factor instanceof Pow pow && pow.rationalExponent().map(r -> r.signum() < 0).orElse(false)) {
                denominator.add(Expressions.pow(pow.base(), Expressions.neg(pow.exponent())));
            } else {
                numerator.add(factor instanceof Add ? "(" + print(factor) + ")" : print(factor));
            }
        }
        List<String> denominatorText = new ArrayList<>();
        if (!magnitude.denominator().equals(BigInteger.ONE)) {
            denominatorText.add(magnitude.denominator().toString());
        }
        for (SymbolicExpression factor : denominator) {
            denominatorText.add(factor instanceof Add ? "(" + print(factor) + ")" : print(factor));
        }

        String top = numerator.isEmpty() ? "1" : String.join("*", numerator);
        if (denominatorText.isEmpty()) {
            return sign + top;
        }
        String bottom;
        if (denominatorText.size() == 1) {
            SymbolicExpression only = denominator.size() == 1 && denominatorText.size() == 1 ? denominator.get(0) : null;
            bottom = only instanceof Mul ? "(" + denominatorText.get(0) + ")" : denominatorText.get(0);
        } else {
            bottom = "(" + String.join("*", denominatorText) + ")";
        }
        return sign + top + "/" + bottom;
    }

    private static String printPower(Pow pow) {
        Rational exponent = pow.rationalExponent().orElse(null);
        if (exponent != null && exponent.equals(Rational.HALF)) {
            return "sqrt(" + print(pow.base()) + ")";
        }
        if (exponent != null && exponent.signum() < 0) {
            SymbolicExpression inverted = Expressions.pow(pow.base(), Expressions.num(exponent.negate()));
            boolean wrap = inverted instanceof Add || inverted instanceof Mul;
            return "1/" + (wrap ? "(" + print(inverted) + ")" : print(inverted));
        }
        return wrapBase(pow.base()) + "**" + wrapExponent(pow.exponent());
    }

    private static String wrapBase(SymbolicExpression base) {
        boolean atomic = base instanceof Sym || base instanceof Constant || base instanceof Func
                || (base instanceof Num n && n.value().isInteger() && n.value().signum() >= 0);
        return atomic ? print(base) : "(" + print(base) + ")";
    }

    private static String wrapExponent(SymbolicExpression exponent) {
        boolean atomic = exponent instanceof Sym
                || (exponent instanceof Num n && n.value().isInteger() && n.value().signum() >= 0);
        return atomic ? print(exponent) : "(" + print(exponent) + ")";
    }

    /** Degree used only to order sum terms for display; numbers sort last. */
    static int displayDegree(SymbolicExpression e) {
        if (e instanceof Num) {
            return -1;
        }
        if (e instanceof Sym) {
            return 1;
        }
        if (e instanceof Pow pow && pow.base() instanceof Sym) {
            return pow.rationalExponent().filter(Rational::isSmallInteger).map(Rational::intValueExact).orElse(0);
        }
        if (e instanceof Mul mul) {
            int total = 0;
            for (SymbolicExpression factor : mul.factors()) {
                total += Math.max(0, displayDegree(factor));
            }
            return total;
        }
        return 0;
    }
}
