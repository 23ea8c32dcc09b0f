package com.phillippitts.mathscrap.service.symbolic;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable expression tree produced by the symbolic translator.
 *
 * <p>Arithmetic nodes are built through {@link Expressions}, which keeps them in canonical
 * form (flattened, numerically folded, like terms combined). The records' constructors only
 * copy; they do not canonicalize.
 *
 * <p>{@link UnparseableMarker} is a regular value, not an error: translation that fails
 * yields a marker carrying a placeholder name.
 */
public sealed interface SymbolicExpression {

    /** Free symbol names, sorted. */
    default Set<String> freeSymbols() {
        Set<String> out = new TreeSet<>();
        collectSymbols(this, out);
        return out;
    }

    /** True when no free symbols occur (numbers, named constants and functions of them). */
    default boolean isNumber() {
        return freeSymbols().isEmpty() && !(this instanceof Equation) && !(this instanceof UnparseableMarker);
    }

    /** True when any node satisfies the predicate. */
    default boolean contains(Predicate<SymbolicExpression> predicate) {
        if (predicate.test(this)) {
            return true;
        }
        for (SymbolicExpression child : children()) {
            if (child.contains(predicate)) {
                return true;
            }
        }
        return false;
    }

    default List<SymbolicExpression> children() {
        if (this instanceof Add add) {
            return add.terms();
        }
        if (this instanceof Mul mul) {
            return mul.factors();
        }
        if (this instanceof Pow pow) {
            return List.of(pow.base(), pow.exponent());
        }
        if (this instanceof Func func) {
            return List.of(func.argument());
        }
        if (this instanceof Equation eq) {
            return List.of(eq.lhs(), eq.rhs());
        }
        return List.of();
    }

    private static void collectSymbols(SymbolicExpression e, Set<String> out) {
        if (e instanceof Sym sym) {
            out.add(sym.name());
            return;
        }
        for (SymbolicExpression child : e.children()) {
            collectSymbols(child, out);
        }
    }

    /** Exact rational literal. */
    record Num(Rational value) implements SymbolicExpression {
        public Num {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Free symbol such as {@code x}, {@code theta} or {@code x_1}. */
    record Sym(String name) implements SymbolicExpression {
        public Sym {
            Objects.requireNonNull(name, "name");
        }
    }

    /** Named mathematical constant. */
    record Constant(String name, double value) implements SymbolicExpression {
        public static final Constant PI = new Constant("pi", Math.PI);
    }

    /** Sum of two or more canonical terms. */
    record Add(List<SymbolicExpression> terms) implements SymbolicExpression {
        public Add {
            terms = List.copyOf(terms);
        }
    }

    /** Product of two or more canonical factors; a numeric coefficient, if any, comes first. */
    record Mul(List<SymbolicExpression> factors) implements SymbolicExpression {
        public Mul {
            factors = List.copyOf(factors);
        }

        /** Leading numeric coefficient, or one. */
        public Rational coefficient() {
            return factors.get(0) instanceof Num num ? num.value() : Rational.ONE;
        }
    }

    /** Power; square roots are powers with exponent one half. */
    record Pow(SymbolicExpression base, SymbolicExpression exponent) implements SymbolicExpression {
        public Pow {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }

        /** Exponent as a rational, when it is numeric. */
        public Optional<Rational> rationalExponent() {
            return exponent instanceof Num num ? Optional.of(num.value()) : Optional.empty();
        }
    }

    /** Application of a named unary function. */
    record Func(FunctionName function, SymbolicExpression argument) implements SymbolicExpression {
        public Func {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }
    }

    /** Equation {@code lhs = rhs}; only ever the root of a tree. */
    record Equation(SymbolicExpression lhs, SymbolicExpression rhs) implements SymbolicExpression {
        public Equation {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }
    }

    /**
     * Placeholder for markup that could not be translated. Prints as its placeholder name and
     * parses back from it.
     */
    record UnparseableMarker(Reason reason) implements SymbolicExpression {

        public UnparseableMarker {
            Objects.requireNonNull(reason, "reason");
        }

        public String placeholder() {
            return reason.placeholder();
        }

        public static Optional<UnparseableMarker> fromPlaceholder(String text) {
            return Arrays.stream(Reason.values())
                    .filter(r -> r.placeholder().equals(text))
                    .findFirst()
                    .map(UnparseableMarker::new);
        }

        /** Why translation gave up. */
        public enum Reason {
            /** Rewritten text fell outside the accepted length window. */
            COMPLEX("complex_expression"),
            /** The rewritten text did not parse. */
            UNPARSEABLE("unparseable_expression"),
            /** Tabular markup had no cell that parsed. */
            COMPLEX_ARRAY("complex_array_expression"),
            /** Tabular markup whose body could not be located. */
            ARRAY("array_expression");

            private final String placeholder;

            Reason(String placeholder) {
                this.placeholder = placeholder;
            }

            public String placeholder() {
                return placeholder;
            }
        }
    }
}
