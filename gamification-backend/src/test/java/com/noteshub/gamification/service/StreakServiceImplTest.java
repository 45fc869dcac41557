package com.noteshub.gamification.service;

import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.StreakDTO;
import com.noteshub.gamification.entity.UserStreak;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.UserStreakRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class StreakServiceImplTest {

    private static final String USER = "u-1";
    private static final Instant NOW = Instant.parse("2024-03-07T23:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 7);
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private UserStreakRepository streakRepository;

    @Mock
    private GamificationJdbcRepository jdbcRepository;

    @Mock
    private PointsService pointsService;

    private StreakServiceImpl streakService;

    @BeforeEach
    void setUp() {
        streakService = new StreakServiceImpl(streakRepository, jdbcRepository, pointsService,
                new GamificationProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static UserStreak streak(int current, int longest, LocalDate last) {
        return new UserStreak(USER, current, longest, last, last == null ? null : last.atStartOfDay(), 3, NOW_UTC);
    }

    @Test
    void testFirstActivityStartsStreak() {
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.empty());
        when(jdbcRepository.insertStartedStreakIfAbsent(USER, TODAY, NOW_UTC)).thenReturn(true);

        assertEquals(1, streakService.recordActivity(USER));

        verify(pointsService).awardPoints(USER, PointsActions.DAILY_STREAK);
    }

    @Test
    void testConcurrentFirstActivityRereads() {
        when(streakRepository.findAndLockByUserId(USER))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(streak(1, 1, TODAY)));
        when(jdbcRepository.insertStartedStreakIfAbsent(USER, TODAY, NOW_UTC)).thenReturn(false);
        when(streakRepository.touch(USER, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(1, 1, TODAY)));

        assertEquals(1, streakService.recordActivity(USER, NOW));

        verifyNoInteractions(pointsService);
    }

    @Test
    void testRegistrationRowBegins() {
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(0, 0, null)));
        when(streakRepository.begin(USER, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(1, 1, TODAY)));

        assertEquals(1, streakService.recordActivity(USER, NOW));

        verify(pointsService).awardPoints(USER, PointsActions.DAILY_STREAK);
    }

    @Test
    void testSameDayOnlyCountsActivity() {
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(4, 9, TODAY)));
        when(streakRepository.touch(USER, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(4, 9, TODAY)));

        assertEquals(4, streakService.recordActivity(USER, NOW));

        verify(streakRepository, never()).extend(anyString(), any(), any(), any());
        verifyNoInteractions(pointsService);
    }

    @Test
    void testNextDayExtends() {
        LocalDate yesterday = TODAY.minusDays(1);
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(6, 6, yesterday)));
        when(streakRepository.extend(USER, yesterday, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(7, 7, TODAY)));

        assertEquals(7, streakService.recordActivity(USER, NOW));

        verify(pointsService).awardPoints(USER, PointsActions.DAILY_STREAK);
    }

    @Test
    void testGapRestartsWithoutPenalty() {
        LocalDate lastWeek = TODAY.minusDays(3);
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(10, 10, lastWeek)));
        when(streakRepository.restart(USER, lastWeek, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(1, 10, TODAY)));

        assertEquals(1, streakService.recordActivity(USER, NOW));

        verifyNoInteractions(pointsService);
    }

    @Test
    void testClockBehindLastActivityCountsAsSameDay() {
        LocalDate tomorrow = TODAY.plusDays(1);
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(3, 3, tomorrow)));
        when(streakRepository.touch(USER, tomorrow, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(3, 3, tomorrow)));

        assertEquals(3, streakService.recordActivity(USER, NOW));
    }

    @Test
    void testLostRacesGiveUpAfterConfiguredAttempts() {
        LocalDate yesterday = TODAY.minusDays(1);
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(6, 6, yesterday)));
        when(streakRepository.extend(USER, yesterday, TODAY, NOW_UTC)).thenReturn(0);

        assertThrows(IllegalStateException.class, () -> streakService.recordActivity(USER, NOW));

        verify(streakRepository, times(3)).findAndLockByUserId(USER);
        verifyNoInteractions(pointsService);
    }

    @Test
    void testBrokenInvariantIsReported() {
        LocalDate yesterday = TODAY.minusDays(1);
        when(streakRepository.findAndLockByUserId(USER)).thenReturn(Optional.of(streak(6, 6, yesterday)));
        when(streakRepository.extend(USER, yesterday, TODAY, NOW_UTC)).thenReturn(1);
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(7, 6, TODAY)));

        assertThrows(IllegalStateException.class, () -> streakService.recordActivity(USER, NOW));
    }

    @Test
    void testGetStreak_UnknownUser() {
        when(streakRepository.findById(USER)).thenReturn(Optional.empty());

        StreakDTO dto = streakService.getStreak(USER);

        assertEquals(0, dto.getCurrentStreak());
        assertEquals(0, dto.getLongestStreak());
        assertNull(dto.getLastActivityDate());
        assertEquals(7, dto.getNextMilestone());
        assertEquals(7, dto.getDaysUntilNextMilestone());
    }

    @Test
    void testGetStreak_PastLastMilestone() {
        when(streakRepository.findById(USER)).thenReturn(Optional.of(streak(400, 400, TODAY)));

        StreakDTO dto = streakService.getStreak(USER);

        assertEquals(365, dto.getNextMilestone());
        assertEquals(0, dto.getDaysUntilNextMilestone());
    }

    @Test
    void testNextMilestone() {
        assertEquals(7, StreakServiceImpl.nextMilestone(0));
        assertEquals(30, StreakServiceImpl.nextMilestone(7));
        assertEquals(100, StreakServiceImpl.nextMilestone(99));
        assertEquals(365, StreakServiceImpl.nextMilestone(364));
        assertEquals(365, StreakServiceImpl.nextMilestone(365));
    }
}
