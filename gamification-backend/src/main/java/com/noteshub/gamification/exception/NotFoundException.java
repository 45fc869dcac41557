package com.noteshub.gamification.exception;

/**
 * An unknown referral code or user.
 */
public class NotFoundException extends GamificationException {

    public NotFoundException(String message) {
        super(message);
    }
}
