package com.phillippitts.mathscrap.exception;

/**
 * Base exception for all mathScrap application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MathScrapException extends RuntimeException {

    public MathScrapException(String message) {
        super(message);
    }

    public MathScrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
