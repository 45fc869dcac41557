package com.noteshub.gamification.service;

import com.noteshub.gamification.exception.ValidationException;

import java.util.Locale;

/**
 * Population a ranking is computed over.
 */
public enum LeaderboardScope {
    ALL_INDIA("all_india"),
    COLLEGE("college"),
    DEPARTMENT("department");

    private final String code;

    LeaderboardScope(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts the code ({@code all_india}) as well as the URL form ({@code all-india}).
     */
    public static LeaderboardScope fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (LeaderboardScope scope : values()) {
                if (scope.code.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new ValidationException("Unknown leaderboard scope: " + code);
    }
}
