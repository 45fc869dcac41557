package com.noteshub.gamification.service;

import java.util.Map;

/**
 * Action names recorded in points_history and the points each one is worth by default.
 */
public final class PointsActions {

    public static final String UPLOAD_NOTE = "upload_note";
    public static final String NOTE_DOWNLOADED = "note_downloaded";
    public static final String NOTE_RATED_5_STAR = "note_rated_5_star";
    public static final String DAILY_STREAK = "daily_streak";
    public static final String REFERRAL_SIGNUP = "referral_signup";
    public static final String REFERRAL_UPLOAD = "referral_upload";
    public static final String SHARE_NOTE = "share_note";
    public static final String HELP_USER = "help_user";
    public static final String VERIFY_NOTE = "verify_note";

    public static final String ACHIEVEMENT_PREFIX = "achievement_";
    public static final String MILESTONE_PREFIX = "milestone_";

    private static final Map<String, Integer> DEFAULT_POINTS = Map.of(
            UPLOAD_NOTE, 100,
            NOTE_DOWNLOADED, 5,
            NOTE_RATED_5_STAR, 20,
            DAILY_STREAK, 5,
            REFERRAL_SIGNUP, 50,
            REFERRAL_UPLOAD, 25,
            SHARE_NOTE, 10,
            HELP_USER, 10,
            VERIFY_NOTE, 15
    );

    private PointsActions() {
    }

    /**
     * @return default points of the action, 0 for an action without a default
     */
    public static int defaultPoints(String action) {
        return action == null ? 0 : DEFAULT_POINTS.getOrDefault(action, 0);
    }
}
