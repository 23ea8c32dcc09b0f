package com.phillippitts.mathscrap.domain;

import java.util.Objects;

/**
 * Markup that has passed through the normalizer: every paired delimiter is balanced,
 * operator spacing is canonical and every exponent/subscript is explicitly grouped.
 *
 * @param value canonical markup text (may be empty)
 */
public record CanonicalMarkup(String value) {

    public CanonicalMarkup {
        Objects.requireNonNull(value, "value");
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return value;
    }
}
