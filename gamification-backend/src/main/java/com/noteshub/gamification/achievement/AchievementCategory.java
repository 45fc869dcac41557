package com.noteshub.gamification.achievement;

public enum AchievementCategory {
    UPLOAD("upload"),
    DOWNLOAD("download"),
    SOCIAL("social"),
    STREAK("streak"),
    ACTIVITY("activity"),
    REFERRAL("referral"),
    SHARING("sharing"),
    FOLLOWERS("followers"),
    FOLLOWING("following"),
    GROUPS("groups"),
    LEVEL("level"),
    SPECIAL("special");

    private final String code;

    AchievementCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
