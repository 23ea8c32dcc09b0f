package com.phillippitts.mathscrap.exception;

/**
 * Thrown by the expression parser on malformed input.
 * The translator converts it into an unparseable marker; it never reaches callers.
 */
public class ExpressionParseException extends MathScrapException {

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
