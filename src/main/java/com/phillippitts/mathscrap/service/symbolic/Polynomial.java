package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Add;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Func;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Mul;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Num;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Pow;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Sym;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Expanded sum of monomials over generators.
 *
 * <p>A generator is any sub-expression that is not a sum, product or small integer power:
 * symbols, constants, function applications (with their arguments expanded) and powers with
 * symbolic or fractional exponents. Negative integer exponents are kept on the generator, so
 * {@code x * x**-1} cancels. Expansion is bounded: integer powers above
 * {@link #MAX_EXPANSION_EXPONENT} and products that would exceed {@link #MAX_TERMS} terms
 * stay unexpanded, as generators.
 */
final class Polynomial {

    static final int MAX_EXPANSION_EXPONENT = 12;
    static final int MAX_TERMS = 512;

    /** Monomial (generator key to exponent) to coefficient. */
    private final Map<SortedMap<String, Integer>, Rational> terms;
    private final Map<String, SymbolicExpression> generators;

    private Polynomial(Map<SortedMap<String, Integer>, Rational> terms, Map<String, SymbolicExpression> generators) {
        this.terms = terms;
        this.generators = generators;
    }

    static Polynomial constant(Rational value) {
        Map<SortedMap<String, Integer>, Rational> terms = new LinkedHashMap<>();
        if (!value.isZero()) {
            terms.put(Collections.emptySortedMap(), value);
        }
        return new Polynomial(terms, new HashMap<>());
    }

    static Polynomial generator(SymbolicExpression g, int exponent) {
        String key = ExpressionPrinter.print(g);
        SortedMap<String, Integer> monomial = new TreeMap<>();
        monomial.put(key, exponent);
        Map<SortedMap<String, Integer>, Rational> terms = new LinkedHashMap<>();
        terms.put(Collections.unmodifiableSortedMap(monomial), Rational.ONE);
        Map<String, SymbolicExpression> generators = new HashMap<>();
        generators.put(key, g);
        return new Polynomial(terms, generators);
    }

    /** Expands an expression. Equations and markers are not accepted. */
    static Polynomial expand(SymbolicExpression e) {
        if (e instanceof Num n) {
            return constant(n.value());
        }
        if (e instanceof Add add) {
            Polynomial sum = constant(Rational.ZERO);
            for (SymbolicExpression term : add.terms()) {
                sum = sum.add(expand(term));
            }
            return sum;
        }
        if (e instanceof Mul mul) {
            Polynomial product = constant(Rational.ONE);
            for (SymbolicExpression factor : mul.factors()) {
                Optional<Polynomial> next = product.multiplyBounded(expand(factor));
                if (next.isEmpty()) {
                    return generator(e, 1);
                }
                product = next.get();
            }
            return product;
        }
        if (e instanceof Pow pow) {
            return expandPower(pow);
        }
        if (e instanceof Func func) {
            return generator(Expressions.func(func.function(), expand(func.argument()).toExpression()), 1);
        }
        if (e instanceof SymbolicExpression.Equation || e instanceof SymbolicExpression.UnparseableMarker) {
            throw new IllegalArgumentException("Cannot expand " + ExpressionPrinter.print(e));
        }
        return generator(e, 1);
    }

    private static Polynomial expandPower(Pow pow) {
        Optional<Rational> exponent = pow.rationalExponent().filter(Rational::isSmallInteger);
        if (exponent.isEmpty()) {
            SymbolicExpression base = expand(pow.base()).toExpression();
            SymbolicExpression rebuilt = Expressions.pow(base, expand(pow.exponent()).toExpression());
            return rebuilt instanceof Pow ? generator(rebuilt, 1) : expand(rebuilt);
        }
        int n = exponent.get().intValueExact();
        Polynomial base = expand(pow.base());
        if (n < 0 || n > MAX_EXPANSION_EXPONENT) {
            SymbolicExpression baseExpression = base.toExpression();
            if (baseExpression instanceof Add || baseExpression instanceof Mul || baseExpression instanceof Pow
                    || baseExpression instanceof Num) {
                return generator(Expressions.pow(baseExpression, Expressions.num(n)), 1);
            }
            return generator(baseExpression, n);
        }
        Polynomial result = constant(Rational.ONE);
        for (int i = 0; i < n; i++) {
            Optional<Polynomial> next = result.multiplyBounded(base);
            if (next.isEmpty()) {
                return generator(pow, 1);
            }
            result = next.get();
        }
        return result;
    }

    Polynomial add(Polynomial other) {
        Map<SortedMap<String, Integer>, Rational> out = new LinkedHashMap<>(terms);
        other.terms.forEach((monomial, coefficient) -> out.merge(monomial, coefficient, Rational::add));
        out.values().removeIf(Rational::isZero);
        return new Polynomial(out, mergedGenerators(other));
    }

    /** Product, or empty when it would exceed {@link #MAX_TERMS}. */
    Optional<Polynomial> multiplyBounded(Polynomial other) {
        if ((long) terms.size() * other.terms.size() > MAX_TERMS * 4L) {
            return Optional.empty();
        }
        Map<SortedMap<String, Integer>, Rational> out = new LinkedHashMap<>();
        for (Map.Entry<SortedMap<String, Integer>, Rational> left : terms.entrySet()) {
            for (Map.Entry<SortedMap<String, Integer>, Rational> right : other.terms.entrySet()) {
                out.merge(multiplyMonomials(left.getKey(), right.getKey()),
                        left.getValue().multiply(right.getValue()), Rational::add);
            }
        }
        out.values().removeIf(Rational::isZero);
        if (out.size() > MAX_TERMS) {
            return Optional.empty();
        }
        return Optional.of(new Polynomial(out, mergedGenerators(other)));
    }

    private static SortedMap<String, Integer> multiplyMonomials(SortedMap<String, Integer> a, SortedMap<String, Integer> b) {
        SortedMap<String, Integer> out = new TreeMap<>(a);
        b.forEach((key, exponent) -> out.merge(key, exponent, Integer::sum));
        out.values().removeIf(exponent -> exponent == 0);
        return Collections.unmodifiableSortedMap(out);
    }

    private Map<String, SymbolicExpression> mergedGenerators(Polynomial other) {
        Map<String, SymbolicExpression> out = new HashMap<>(generators);
        out.putAll(other.generators);
        return out;
    }

    boolean isZero() {
        return terms.isEmpty();
    }

    /** Rebuilds a canonical expression from the expanded terms. */
    SymbolicExpression toExpression() {
        List<SymbolicExpression> out = new ArrayList<>();
        for (Map.Entry<SortedMap<String, Integer>, Rational> term : terms.entrySet()) {
            out.add(monomialExpression(term.getKey(), term.getValue()));
        }
        return Expressions.add(out);
    }

    private SymbolicExpression monomialExpression(Map<String, Integer> monomial, Rational coefficient) {
        List<SymbolicExpression> factors = new ArrayList<>();
        factors.add(Expressions.num(coefficient));
        monomial.forEach((key, exponent) ->
                factors.add(Expressions.pow(generators.get(key), Expressions.num(exponent))));
        return Expressions.mul(factors);
    }

    /**
     * Coefficients of this polynomial in one symbol, lowest degree first.
     *
     * @return empty when the symbol occurs with a negative exponent or inside another generator
     */
    Optional<List<SymbolicExpression>> coefficientsIn(Sym variable) {
        String key = ExpressionPrinter.print(variable);
        for (Map.Entry<String, SymbolicExpression> generator : generators.entrySet()) {
            if (!generator.getKey().equals(key) && generator.getValue().freeSymbols().contains(variable.name())) {
                return Optional.empty();
            }
        }
        TreeMap<Integer, List<SymbolicExpression>> byDegree = new TreeMap<>();
        for (Map.Entry<SortedMap<String, Integer>, Rational> term : terms.entrySet()) {
            int degree = term.getKey().getOrDefault(key, 0);
            if (degree < 0) {
                return Optional.empty();
            }
            SortedMap<String, Integer> rest = new TreeMap<>(term.getKey());
            rest.remove(key);
            byDegree.computeIfAbsent(degree, d -> new ArrayList<>()).add(monomialExpression(rest, term.getValue()));
        }
        if (byDegree.isEmpty()) {
            return Optional.of(List.of(Expressions.ZERO));
        }
        List<SymbolicExpression> coefficients = new ArrayList<>();
        for (int d = 0; d <= byDegree.lastKey(); d++) {
            coefficients.add(Expressions.add(byDegree.getOrDefault(d, List.of())));
        }
        return Optional.of(coefficients);
    }
}
