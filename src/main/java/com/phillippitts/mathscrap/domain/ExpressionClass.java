package com.phillippitts.mathscrap.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primary classification of a symbolic expression, listed in decision order.
 */
public enum ExpressionClass {
    CONSTANT("constant"),
    VARIABLE("variable"),
    SUM("sum"),
    PRODUCT("product"),
    POWER("power"),
    TRIGONOMETRIC("trigonometric"),
    EXPONENTIAL("exponential"),
    POLYNOMIAL("polynomial"),
    RATIONAL("rational"),
    GENERAL("general");

    private final String label;

    ExpressionClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
