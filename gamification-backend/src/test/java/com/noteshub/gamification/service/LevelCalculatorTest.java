package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.LevelInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class LevelCalculatorTest {

    private final LevelCalculator calculator = new LevelCalculator();

    @ParameterizedTest
    @CsvSource({
            "0,       1,  Newbie,   2500,  0.0",
            "1250,    1,  Newbie,   1250,  50.0",
            "2500,    5,  Helper,   7500,  0.0",
            "9999,    5,  Helper,   1,     99.99",
            "10000,   10, Expert,   40000, 0.0",
            "75000,   20, Master,   25000, 50.0",
            "199999,  30, Champion, 1,     100.0",
            "350000,  40, Elite,    150000, 50.0"
    })
    void testCalculateLevel(long points, int level, String name, long toNext, double progress) {
        LevelInfo info = calculator.calculateLevel(points);

        assertEquals(level, info.getLevel());
        assertEquals(name, info.getLevelName());
        assertEquals(toNext, info.getPointsToNextLevel());
        assertEquals(progress, info.getProgressPercentage());
    }

    @Test
    void testMaxLevel() {
        LevelInfo info = calculator.calculateLevel(750_000);

        assertEquals(50, info.getLevel());
        assertEquals("Legend", info.getLevelName());
        assertEquals(0, info.getPointsToNextLevel());
        assertEquals(100.0, info.getProgressPercentage());
        assertEquals(50, calculator.maxLevel());
    }

    @Test
    void testNegativePointsTreatedAsZero() {
        assertEquals(calculator.calculateLevel(0), calculator.calculateLevel(-40));
    }

    @Test
    void testLevelNeverDecreasesAsPointsGrow() {
        int previous = 0;
        for (long points = 0; points <= 600_000; points += 1_250) {
            int level = calculator.calculateLevel(points).getLevel();
            assertTrue(level >= previous, "level dropped at " + points);
            previous = level;
        }
    }
}
