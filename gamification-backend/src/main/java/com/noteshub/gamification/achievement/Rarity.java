package com.noteshub.gamification.achievement;

public enum Rarity {
    COMMON("common"),
    UNCOMMON("uncommon"),
    RARE("rare"),
    EPIC("epic"),
    LEGENDARY("legendary");

    private final String code;

    Rarity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
