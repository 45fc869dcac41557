package com.noteshub.gamification.achievement;

/**
 * Statistics an achievement criterion can refer to.
 */
public enum StatKey {
    UPLOADS("uploads", Kind.COUNT),
    DOWNLOADS("downloads", Kind.COUNT),
    NOTE_DOWNLOADS("note_downloads", Kind.COUNT),
    STREAK("streak", Kind.COUNT),
    TOTAL_ACTIVITIES("total_activities", Kind.COUNT),
    REFERRALS("referrals", Kind.COUNT),
    SHARES("shares", Kind.COUNT),
    FOLLOWERS("followers", Kind.COUNT),
    FOLLOWING("following", Kind.COUNT),
    GROUPS_CREATED("groups_created", Kind.COUNT),
    GROUPS_JOINED("groups_joined", Kind.COUNT),
    LEVEL("level", Kind.COUNT),
    REFERRED("referred", Kind.FLAG);

    public enum Kind { COUNT, FLAG }

    private final String statName;
    private final Kind kind;

    StatKey(String statName, Kind kind) {
        this.statName = statName;
        this.kind = kind;
    }

    public String getStatName() {
        return statName;
    }

    public Kind getKind() {
        return kind;
    }
}
