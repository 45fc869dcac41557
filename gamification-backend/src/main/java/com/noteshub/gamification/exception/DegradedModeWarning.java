package com.noteshub.gamification.exception;

/**
 * Non-fatal condition: gamification rows could not be initialised for a user.
 * Never thrown to callers, only logged; the rows are created lazily on the next qualifying action.
 */
public class DegradedModeWarning extends GamificationException {

    public DegradedModeWarning(String userId, Throwable cause) {
        super("Gamification init failed for user " + userId + ", continuing in degraded mode", cause);
    }
}
