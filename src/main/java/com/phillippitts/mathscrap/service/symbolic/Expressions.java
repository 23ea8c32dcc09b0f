package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Add;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Func;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Mul;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Pow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonicalizing constructors for {@link SymbolicExpression} trees.
 *
 * <p>Evaluation is automatic and cheap, in the manner of a computer-algebra system:
 * nested sums and products are flattened, numeric parts are folded exactly, like terms and
 * like bases are combined, numeric coefficients distribute over a single sum, and exact
 * roots of rationals are taken. No expansion of products of sums happens here; that is the
 * simplifier's job.
 */
public final class Expressions {

    public static final Num ZERO = new Num(Rational.ZERO);
    public static final Num ONE = new Num(Rational.ONE);
    public static final Num MINUS_ONE = new Num(Rational.MINUS_ONE);

    /** Numeric powers whose result would need more bits than this stay symbolic. */
    static final long MAX_FOLDED_BITS = 10_000;

    static final Comparator<SymbolicExpression> CANONICAL_ORDER =
            Comparator.comparing(ExpressionPrinter::print);

    private Expressions() {
    }

    public static Num num(long value) {
        return new Num(Rational.of(value));
    }

    public static Num num(Rational value) {
        return new Num(value);
    }

    public static SymbolicExpression.Sym sym(String name) {
        return new SymbolicExpression.Sym(name);
    }

    public static SymbolicExpression add(SymbolicExpression... terms) {
        return add(Arrays.asList(terms));
    }

    /**
     * Canonical sum: flattened, constants folded, like terms combined, zero terms dropped.
     */
    public static SymbolicExpression add(List<SymbolicExpression> terms) {
        List<SymbolicExpression> flat = new ArrayList<>();
        for (SymbolicExpression term : terms) {
            if (term instanceof Add nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }

        Rational constant = Rational.ZERO;
        Map<SymbolicExpression, Rational> coefficients = new LinkedHashMap<>();
        for (SymbolicExpression term : flat) {
            if (term instanceof Num n) {
                constant = constant.add(n.value());
                continue;
            }
            Rational coefficient = Rational.ONE;
            SymbolicExpression rest = term;
            if (term instanceof Mul mul && mul.factors().get(0) instanceof Num lead) {
                coefficient = lead.value();
                rest = mul(mul.factors().subList(1, mul.factors().size()));
            }
            coefficients.merge(rest, coefficient, Rational::add);
        }

        List<SymbolicExpression> out = new ArrayList<>();
        for (Map.Entry<SymbolicExpression, Rational> entry : coefficients.entrySet()) {
            if (!entry.getValue().isZero()) {
                out.add(entry.getValue().isOne() ? entry.getKey() : scale(entry.getValue(), entry.getKey()));
            }
        }
        out.sort(CANONICAL_ORDER);
        if (!constant.isZero()) {
            out.add(new Num(constant));
        }
        if (out.isEmpty()) {
            return ZERO;
        }
        return out.size() == 1 ? out.get(0) : new Add(out);
    }

    public static SymbolicExpression mul(SymbolicExpression... factors) {
        return mul(Arrays.asList(factors));
    }

    /**
     * Canonical product: flattened, coefficient folded, equal bases merged by adding
     * exponents. A non-unit coefficient times a single sum is distributed.
     */
    public static SymbolicExpression mul(List<SymbolicExpression> factors) {
        Rational coefficient = Rational.ONE;
        Map<SymbolicExpression, List<SymbolicExpression>> exponents = new LinkedHashMap<>();
        List<SymbolicExpression> pending = new ArrayList<>(factors);

        while (!pending.isEmpty()) {
            SymbolicExpression factor = pending.remove(0);
            if (factor instanceof Mul nested) {
                pending.addAll(0, nested.factors());
            } else if (factor instanceof Num n) {
                coefficient = coefficient.multiply(n.value());
            } else if (factor instanceof Pow p) {
                exponents.computeIfAbsent(p.base(), k -> new ArrayList<>()).add(p.exponent());
            } else {
                exponents.computeIfAbsent(factor, k -> new ArrayList<>()).add(ONE);
            }
        }
        if (coefficient.isZero()) {
            return ZERO;
        }

        List<SymbolicExpression> out = new ArrayList<>();
        boolean refold = false;
        for (Map.Entry<SymbolicExpression, List<SymbolicExpression>> entry : exponents.entrySet()) {
            SymbolicExpression combined = pow(entry.getKey(), add(entry.getValue()));
            if (combined instanceof Num n) {
                coefficient = coefficient.multiply(n.value());
            } else if (combined instanceof Mul) {
                out.add(combined);
                refold = true;
            } else {
                out.add(combined);
            }
        }
        if (refold) {
            out.add(new Num(coefficient));
            return mul(out);
        }
        if (coefficient.isZero()) {
            return ZERO;
        }
        out.sort(CANONICAL_ORDER);
        if (out.isEmpty()) {
            return new Num(coefficient);
        }
        if (out.size() == 1 && out.get(0) instanceof Add sum && !coefficient.isOne()) {
            List<SymbolicExpression> scaled = new ArrayList<>();
            for (SymbolicExpression term : sum.terms()) {
                scaled.add(mul(new Num(coefficient), term));
            }
            return add(scaled);
        }
        if (coefficient.isOne()) {
            return out.size() == 1 ? out.get(0) : new Mul(out);
        }
        out.add(0, new Num(coefficient));
        return new Mul(out);
    }

    /**
     * Canonical power. Folds numeric powers exactly, takes exact rational roots, multiplies
     * nested integer exponents and distributes integer exponents over products. Numeric powers
     * whose exact value would exceed {@link #MAX_FOLDED_BITS} bits stay symbolic.
     *
     * @throws ArithmeticException on zero raised to a negative power
     */
    public static SymbolicExpression pow(SymbolicExpression base, SymbolicExpression exponent) {
        if (exponent instanceof Num e) {
            Rational ev = e.value();
            if (ev.isZero()) {
                return ONE;
            }
            if (ev.isOne()) {
                return base;
            }
            if (base instanceof Num b) {
                Optional<SymbolicExpression> folded = foldNumericPower(b.value(), ev);
                if (folded.isPresent()) {
                    return folded.get();
                }
            }
            if (ev.isInteger()) {
                if (base instanceof Pow inner) {
                    return pow(inner.base(), mul(inner.exponent(), exponent));
                }
                if (base instanceof Mul product) {
                    List<SymbolicExpression> raised = new ArrayList<>();
                    for (SymbolicExpression factor : product.factors()) {
                        raised.add(pow(factor, exponent));
                    }
                    return mul(raised);
                }
            }
        }
        if (base instanceof Num b && b.value().isOne()) {
            return ONE;
        }
        return new Pow(base, exponent);
    }

    private static Optional<SymbolicExpression> foldNumericPower(Rational base, Rational exponent) {
        if (exponent.isInteger()) {
            if (!exponent.isSmallInteger() || !withinFoldBound(base, exponent.intValueExact())) {
                return Optional.empty();
            }
            if (base.isZero() && exponent.signum() < 0) {
                throw new ArithmeticException("Zero raised to a negative power");
            }
            return Optional.of(new Num(base.pow(exponent.intValueExact())));
        }
        if (base.isZero() && exponent.signum() > 0) {
            return Optional.of(ZERO);
        }
        if (base.signum() < 0) {
            return Optional.empty();
        }
        if (exponent.denominator().bitLength() > 31 || exponent.numerator().bitLength() > 31) {
            return Optional.empty();
        }
        int q = exponent.denominator().intValue();
        int p = exponent.numerator().intValue();
        return base.root(q)
                .filter(r -> withinFoldBound(r, p))
                .map(r -> new Num(r.pow(p)));
    }

    /** Bit length of {@code base ** exponent} stays within {@link #MAX_FOLDED_BITS}. */
    private static boolean withinFoldBound(Rational base, long exponent) {
        long bits = Math.max(base.numerator().bitLength(), base.denominator().bitLength());
        return bits <= 1 || bits * Math.abs(exponent) <= MAX_FOLDED_BITS;
    }

    public static SymbolicExpression neg(SymbolicExpression e) {
        return mul(MINUS_ONE, e);
    }

    public static SymbolicExpression sub(SymbolicExpression a, SymbolicExpression b) {
        return add(a, neg(b));
    }

    public static SymbolicExpression div(SymbolicExpression a, SymbolicExpression b) {
        return mul(a, pow(b, MINUS_ONE));
    }

    public static SymbolicExpression sqrt(SymbolicExpression e) {
        return pow(e, new Num(Rational.HALF));
    }

    /**
     * Function application with the obvious exact values folded
     * ({@code sin(0)}, {@code cos(0)}, {@code tan(0)}, {@code log(1)}, {@code exp(0)}).
     */
    public static SymbolicExpression func(FunctionName function, SymbolicExpression argument) {
        if (argument instanceof Num n) {
            boolean zero = n.value().isZero();
            if (zero && (function == FunctionName.SIN || function == FunctionName.TAN)) {
                return ZERO;
            }
            if (zero && (function == FunctionName.COS || function == FunctionName.EXP)) {
                return ONE;
            }
            if (n.value().isOne() && function == FunctionName.LOG) {
                return ZERO;
            }
        }
        return new Func(function, argument);
    }

    private static SymbolicExpression scale(Rational coefficient, SymbolicExpression term) {
        return mul(new Num(coefficient), term);
    }
}
