package com.noteshub.gamification.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;

/**
 * Referral code = last 4 characters of the handle + 3 random [A-Z0-9], upper-cased.
 * Uniqueness is enforced by the store; callers re-mint on collision.
 */
@Component
public class ReferralCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int PREFIX_LENGTH = 4;
    private static final int SUFFIX_LENGTH = 3;

    private final Random random;

    @Autowired
    public ReferralCodeGenerator() {
        this(new SecureRandom());
    }

    ReferralCodeGenerator(Random random) {
        this.random = random;
    }

    public String generate(String handle) {
        String base = (handle == null || handle.isBlank()) ? "USER" : handle.trim();
        String prefix = base.length() > PREFIX_LENGTH ? base.substring(base.length() - PREFIX_LENGTH) : base;

        StringBuilder code = new StringBuilder(prefix);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString().toUpperCase(Locale.ROOT);
    }
}
