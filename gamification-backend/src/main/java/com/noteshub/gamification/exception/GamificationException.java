package com.noteshub.gamification.exception;

/**
 * Base type of the errors raised by the gamification engine.
 * Translation into HTTP responses happens in {@code GlobalExceptionHandler}.
 */
public abstract class GamificationException extends RuntimeException {

    protected GamificationException(String message) {
        super(message);
    }

    protected GamificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
