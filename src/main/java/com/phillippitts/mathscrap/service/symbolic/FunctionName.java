package com.phillippitts.mathscrap.service.symbolic;

import java.util.Locale;
import java.util.Optional;

/**
 * Named unary functions understood by the parser. {@code ln} is an alias of {@code log}
 * (natural logarithm); {@code sqrt} is not a function here, it parses to a power of one half.
 */
public enum FunctionName {
    SIN(true),
    COS(true),
    TAN(true),
    LOG(false),
    EXP(false);

    private final boolean trigonometric;

    FunctionName(boolean trigonometric) {
        this.trigonometric = trigonometric;
    }

    public boolean isTrigonometric() {
        return trigonometric;
    }

    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FunctionName> lookup(String identifier) {
        return switch (identifier) {
            case "sin" -> Optional.of(SIN);
            case "cos" -> Optional.of(COS);
            case "tan" -> Optional.of(TAN);
            case "log", "ln" -> Optional.of(LOG);
            case "exp" -> Optional.of(EXP);
            default -> Optional.empty();
        };
    }
}
