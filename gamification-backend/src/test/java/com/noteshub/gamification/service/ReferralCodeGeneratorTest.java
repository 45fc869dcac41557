package com.noteshub.gamification.service;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class ReferralCodeGeneratorTest {

    @Test
    void usesLastFourCharactersOfHandle() {
        String code = new ReferralCodeGenerator(new Random(42)).generate("1rv21cs001");

        assertThat(code).hasSize(7).startsWith("S001").matches("[A-Z0-9]{7}");
    }

    @Test
    void shortOrMissingHandle() {
        ReferralCodeGenerator generator = new ReferralCodeGenerator(new Random(7));

        assertThat(generator.generate("ab")).hasSize(5).startsWith("AB");
        assertThat(generator.generate(null)).hasSize(7).startsWith("USER");
        assertThat(generator.generate("   ")).startsWith("USER");
    }

    @Test
    void sameSeedSameCode() {
        assertThat(new ReferralCodeGenerator(new Random(1)).generate("1RV21CS001"))
                .isEqualTo(new ReferralCodeGenerator(new Random(1)).generate("1RV21CS001"));
    }
}
