package com.noteshub.gamification.exception;

/**
 * The request is well-formed but breaks a business rule:
 * a second or self referral, an invalid milestone claim, a missing leaderboard filter.
 */
public class ValidationException extends GamificationException {

    public ValidationException(String message) {
        super(message);
    }
}
