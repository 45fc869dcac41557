package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.AchievementCatalog;
import com.noteshub.gamification.achievement.StatKey;
import com.noteshub.gamification.achievement.StatsSnapshot;
import com.noteshub.gamification.dto.AchievementCheckDTO;
import com.noteshub.gamification.dto.AchievementDTO;
import com.noteshub.gamification.dto.AchievementProgressDTO;
import com.noteshub.gamification.dto.AchievementStatsDTO;
import com.noteshub.gamification.dto.UserAchievementDTO;
import com.noteshub.gamification.entity.UserAchievement;
import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.repository.UserAchievementRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AchievementServiceImplTest {

    private static final String USER = "u-1";

    @Spy
    private AchievementCatalog catalog = new AchievementCatalog();

    @Mock
    private UserAchievementRepository achievementRepository;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private StatsCollector statsCollector;

    @Mock
    private AchievementEvaluator evaluator;

    @InjectMocks
    private AchievementServiceImpl achievementService;

    private List<Object[]> unlockCounts;

    @BeforeEach
    void setUp() {
        unlockCounts = new ArrayList<>();
        unlockCounts.add(new Object[]{"first_note", 100L});
        unlockCounts.add(new Object[]{"week_warrior", 50L});
    }

    @Test
    void testGetAchievementList() {
        when(userDirectory.countAll()).thenReturn(1000L);
        when(achievementRepository.countUsersPerAchievement()).thenReturn(unlockCounts);

        List<AchievementDTO> result = achievementService.getAchievementList();

        assertEquals(catalog.size(), result.size());
        AchievementDTO firstNote = result.get(0);
        assertEquals("first_note", firstNote.getAchievementKey());
        assertEquals("First Note", firstNote.getName());
        assertEquals("upload", firstNote.getCategory());
        assertEquals("common", firstNote.getRarity());
        assertEquals(50, firstNote.getPoints());
        assertEquals(100, firstNote.getAchievedCount());
        assertEquals(0.1, firstNote.getCompletionRate()); // 100/1000
        assertNull(firstNote.getRank());

        verify(userDirectory).countAll();
        verify(achievementRepository).countUsersPerAchievement();
    }

    @Test
    void testGetAchievementRanking_Desc() {
        when(userDirectory.countAll()).thenReturn(1000L);
        when(achievementRepository.countUsersPerAchievement()).thenReturn(unlockCounts);

        List<AchievementDTO> result = achievementService.getAchievementRanking(2, "desc");

        assertEquals(2, result.size());
        assertEquals("first_note", result.get(0).getAchievementKey());
        assertEquals(1, result.get(0).getRank());
        assertEquals("week_warrior", result.get(1).getAchievementKey());
        assertEquals(2, result.get(1).getRank());
    }

    @Test
    void testGetAchievementRanking_Asc() {
        when(userDirectory.countAll()).thenReturn(1000L);
        when(achievementRepository.countUsersPerAchievement()).thenReturn(unlockCounts);

        List<AchievementDTO> result = achievementService.getAchievementRanking(3, "asc");

        assertEquals(3, result.size());
        // never-unlocked entries come first, in catalog order
        assertEquals("getting_started", result.get(0).getAchievementKey());
        assertEquals(0, result.get(0).getAchievedCount());
        assertEquals(1, result.get(0).getRank());
        assertEquals(3, result.get(2).getRank());
    }

    @Test
    void testGetAchievementList_ZeroUsers() {
        when(userDirectory.countAll()).thenReturn(0L);
        when(achievementRepository.countUsersPerAchievement()).thenReturn(unlockCounts);

        List<AchievementDTO> result = achievementService.getAchievementList();

        assertEquals(100.0, result.get(0).getCompletionRate()); // divisor falls back to 1
    }

    @Test
    void testGetAllWithStatus() {
        LocalDateTime at = LocalDateTime.of(2024, 3, 1, 10, 0);
        when(achievementRepository.findByUserIdOrderByUnlockedAtDesc(USER))
                .thenReturn(List.of(new UserAchievement(1L, USER, "first_note", at)));

        List<UserAchievementDTO> result = achievementService.getAllWithStatus(USER);

        assertEquals(catalog.size(), result.size());
        assertTrue(result.get(0).isUnlocked());
        assertEquals(at, result.get(0).getUnlockedAt());
        assertFalse(result.get(1).isUnlocked());
        assertNull(result.get(1).getUnlockedAt());
    }

    @Test
    void testGetUnlocked_SkipsIdsMissingFromCatalog() {
        LocalDateTime later = LocalDateTime.of(2024, 3, 2, 10, 0);
        LocalDateTime earlier = LocalDateTime.of(2024, 3, 1, 10, 0);
        when(achievementRepository.findByUserIdOrderByUnlockedAtDesc(USER)).thenReturn(List.of(
                new UserAchievement(2L, USER, "week_warrior", later),
                new UserAchievement(3L, USER, "retired_badge", later),
                new UserAchievement(1L, USER, "first_note", earlier)));

        List<UserAchievementDTO> result = achievementService.getUnlocked(USER);

        assertEquals(List.of("week_warrior", "first_note"),
                result.stream().map(UserAchievementDTO::getId).collect(Collectors.toList()));
    }

    @Test
    void testGetProgress() {
        when(statsCollector.collect(USER)).thenReturn(StatsSnapshot.builder().count(StatKey.UPLOADS, 3).build());
        when(achievementRepository.findByUserIdOrderByUnlockedAtDesc(USER))
                .thenReturn(List.of(new UserAchievement(1L, USER, "first_note", LocalDateTime.now())));

        List<AchievementProgressDTO> result = achievementService.getProgress(USER);

        assertTrue(result.stream().noneMatch(p -> p.getAchievementId().equals("first_note")));
        AchievementProgressDTO gettingStarted = result.stream()
                .filter(p -> p.getAchievementId().equals("getting_started")).findFirst().orElseThrow();
        assertEquals("uploads", gettingStarted.getStat());
        assertEquals(3L, gettingStarted.getCurrent());
        assertEquals(5L, gettingStarted.getRequired());
        assertEquals(60.0, gettingStarted.getPercentage());
        // only upload-based entries have their statistic collected here
        assertTrue(result.stream().noneMatch(p -> p.getAchievementId().equals("first_download")));
        assertTrue(result.stream().noneMatch(p -> p.getAchievementId().equals("welcome_aboard")));
    }

    @Test
    void testGetStats() {
        LocalDateTime at = LocalDateTime.of(2024, 3, 1, 10, 0);
        when(achievementRepository.findByUserIdOrderByUnlockedAtDesc(USER)).thenReturn(List.of(
                new UserAchievement(1L, USER, "first_note", at),
                new UserAchievement(2L, USER, "week_warrior", at),
                new UserAchievement(3L, USER, "scholar", at)));

        AchievementStatsDTO stats = achievementService.getStats(USER);

        assertEquals(catalog.size(), stats.getTotalAchievements());
        assertEquals(3, stats.getUnlocked());
        assertEquals(catalog.size() - 3, stats.getLocked());
        assertEquals(650L, stats.getPointsFromAchievements());
        assertEquals(2, stats.getRarityBreakdown().get("common"));
        assertEquals(1, stats.getRarityBreakdown().get("rare"));
        assertEquals(0, stats.getRarityBreakdown().get("legendary"));
        assertEquals(5.5, stats.getCompletionPercentage()); // 3 of 55
    }

    @Test
    void testCheck_ReturnsNewlyUnlockedWithTimestamp() {
        LocalDateTime at = LocalDateTime.of(2024, 3, 7, 9, 30);
        var weekWarrior = catalog.findById("week_warrior").orElseThrow();
        when(evaluator.checkAndUnlock(USER)).thenReturn(List.of(weekWarrior));
        when(achievementRepository.findByUserIdOrderByUnlockedAtDesc(USER))
                .thenReturn(List.of(new UserAchievement(7L, USER, "week_warrior", at)));

        AchievementCheckDTO result = achievementService.check(USER);

        assertEquals(1, result.getCount());
        UserAchievementDTO unlocked = result.getNewlyUnlocked().get(0);
        assertEquals("week_warrior", unlocked.getId());
        assertTrue(unlocked.isUnlocked());
        assertEquals(at, unlocked.getUnlockedAt());
    }

    @Test
    void testPercentage() {
        assertEquals(33.3, AchievementServiceImpl.percentage(1, 3));
        assertEquals(100.0, AchievementServiceImpl.percentage(12, 5));
        assertEquals(100.0, AchievementServiceImpl.percentage(0, 0));
    }
}
