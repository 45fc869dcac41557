package com.noteshub.gamification.service;

import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.PointsAward;
import com.noteshub.gamification.dto.ReferralDTO;
import com.noteshub.gamification.dto.ReferralRewardDTO;
import com.noteshub.gamification.dto.ReferralStatsDTO;
import com.noteshub.gamification.dto.TopReferrerDTO;
import com.noteshub.gamification.entity.ReferredUser;
import com.noteshub.gamification.entity.UserReferral;
import com.noteshub.gamification.exception.NotFoundException;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.external.NoteStore;
import com.noteshub.gamification.external.NotificationSink;
import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.external.UserProfile;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.ReferredUserRepository;
import com.noteshub.gamification.repository.UserReferralRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ReferralServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private static final String REFERRER = "ref";
    private static final String APPLICANT = "new";

    @Mock
    private UserReferralRepository referralRepository;

    @Mock
    private ReferredUserRepository referredUserRepository;

    @Mock
    private GamificationJdbcRepository jdbcRepository;

    @Mock
    private ReferralCodeGenerator codeGenerator;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private NoteStore noteStore;

    @Mock
    private PointsService pointsService;

    @Mock
    private NotificationSink notificationSink;

    private ReferralServiceImpl referralService;

    @BeforeEach
    void setUp() {
        referralService = new ReferralServiceImpl(referralRepository, referredUserRepository, jdbcRepository,
                codeGenerator, userDirectory, noteStore, pointsService, notificationSink,
                new GamificationProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static UserReferral referral(String userId, String code, String referredBy, int total) {
        return new UserReferral(userId, code, referredBy, total, 0, 0, 0, false, NOW_UTC);
    }

    private static UserProfile profile(String userId, String handle) {
        return new UserProfile(userId, handle, "CSE", "RVCE", 2, null);
    }

    @Test
    void testGetOrCreateReferral_Existing() {
        when(referralRepository.findById(REFERRER)).thenReturn(Optional.of(referral(REFERRER, "ABCD12X", null, 2)));

        ReferralDTO dto = referralService.getOrCreateReferral(REFERRER);

        assertEquals("ABCD12X", dto.getReferralCode());
        assertEquals(2, dto.getTotalReferrals());
        assertEquals("https://noteshub.app?ref=ABCD12X", dto.getReferralLink());
        assertNull(dto.getReferredBy());
        verifyNoInteractions(codeGenerator, jdbcRepository);
    }

    @Test
    void testGetOrCreateReferral_RemintsOnCollision() {
        when(referralRepository.findById(APPLICANT))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(referral(APPLICANT, "S002QQQ", null, 0)));
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV21CS002")));
        when(codeGenerator.generate("1RV21CS002")).thenReturn("S002AAA", "S002BBB", "S002QQQ");
        when(referralRepository.existsByReferralCode("S002AAA")).thenReturn(true);
        when(referralRepository.existsByReferralCode("S002BBB")).thenReturn(false);
        when(referralRepository.existsByReferralCode("S002QQQ")).thenReturn(false);
        doThrow(new DuplicateKeyException("uk_referral_code"))
                .when(jdbcRepository).insertReferral(APPLICANT, "S002BBB", NOW_UTC);
        when(referralRepository.existsById(APPLICANT)).thenReturn(false);

        ReferralDTO dto = referralService.getOrCreateReferral(APPLICANT);

        assertEquals("S002QQQ", dto.getReferralCode());
        verify(jdbcRepository).insertReferral(APPLICANT, "S002QQQ", NOW_UTC);
    }

    @Test
    void testGetOrCreateReferral_UnknownUser() {
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.empty());
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> referralService.getOrCreateReferral(APPLICANT));
    }

    @Test
    void testApplyReferralCode() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV22CS050")));
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", null, 0)));
        when(referralRepository.findByReferralCode("ABCD12X")).thenReturn(Optional.of(referral(REFERRER, "ABCD12X", null, 0)));
        when(referralRepository.markReferred(APPLICANT, "ABCD12X", 20)).thenReturn(1);
        when(pointsService.awardPoints(REFERRER, PointsActions.REFERRAL_SIGNUP)).thenReturn(new PointsAward(50, 1, "Newbie", 50));

        ReferralRewardDTO reward = referralService.applyReferralCode(APPLICANT, " abcd12x ");

        assertEquals("signup", reward.getType());
        assertEquals(REFERRER, reward.getReferrerId());
        assertEquals(20, reward.getApplicantBonusDownloads());
        assertEquals(10, reward.getReferrerBonusDownloads());
        assertEquals(50, reward.getReferrerPoints());

        verify(referralRepository).creditReferral(REFERRER, 10);
        ArgumentCaptor<ReferredUser> referred = ArgumentCaptor.forClass(ReferredUser.class);
        verify(referredUserRepository).save(referred.capture());
        assertEquals(REFERRER, referred.getValue().getReferrerId());
        assertEquals(APPLICANT, referred.getValue().getUserId());
        assertEquals("1RV22CS050", referred.getValue().getHandle());
        verify(notificationSink).enqueue(eq(REFERRER), eq("referral_signup"), anyMap());
    }

    @Test
    void testApplyReferralCode_AlreadyReferred() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV22CS050")));
        when(referralRepository.findById(APPLICANT))
                .thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", "ZZZZ99A", 0)));

        assertThrows(ValidationException.class, () -> referralService.applyReferralCode(APPLICANT, "ABCD12X"));

        verify(referralRepository, never()).markReferred(anyString(), anyString(), anyInt());
    }

    @Test
    void testApplyReferralCode_UnknownCode() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV22CS050")));
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", null, 0)));
        when(referralRepository.findByReferralCode("NOPE000")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> referralService.applyReferralCode(APPLICANT, "NOPE000"));
    }

    @Test
    void testApplyReferralCode_OwnCode() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV22CS050")));
        UserReferral own = referral(APPLICANT, "S050XYZ", null, 0);
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(own));
        when(referralRepository.findByReferralCode("S050XYZ")).thenReturn(Optional.of(own));

        assertThrows(ValidationException.class, () -> referralService.applyReferralCode(APPLICANT, "S050XYZ"));
    }

    @Test
    void testApplyReferralCode_LostRaceGrantsNothing() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.of(profile(APPLICANT, "1RV22CS050")));
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", null, 0)));
        when(referralRepository.findByReferralCode("ABCD12X")).thenReturn(Optional.of(referral(REFERRER, "ABCD12X", null, 0)));
        when(referralRepository.markReferred(APPLICANT, "ABCD12X", 20)).thenReturn(0);

        assertThrows(ValidationException.class, () -> referralService.applyReferralCode(APPLICANT, "ABCD12X"));

        verify(referralRepository, never()).creditReferral(anyString(), anyInt());
        verifyNoInteractions(pointsService, notificationSink, referredUserRepository);
    }

    @Test
    void testApplyReferralCode_UnknownUser() {
        when(userDirectory.getUser(APPLICANT)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> referralService.applyReferralCode(APPLICANT, "ABCD12X"));
    }

    @Test
    void testRewardForFirstUpload() {
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", "ABCD12X", 0)));
        when(noteStore.countUploads(APPLICANT, false)).thenReturn(1L);
        when(referralRepository.claimFirstUploadReward(APPLICANT)).thenReturn(1);
        when(referralRepository.findByReferralCode("ABCD12X")).thenReturn(Optional.of(referral(REFERRER, "ABCD12X", null, 1)));
        when(pointsService.awardPoints(REFERRER, PointsActions.REFERRAL_UPLOAD)).thenReturn(new PointsAward(75, 1, "Newbie", 25));

        Optional<ReferralRewardDTO> reward = referralService.rewardForFirstUpload(APPLICANT);

        assertTrue(reward.isPresent());
        assertEquals("first_upload", reward.get().getType());
        assertEquals(5, reward.get().getReferrerBonusDownloads());
        assertEquals(25, reward.get().getReferrerPoints());
        verify(referralRepository).addBonusDownloads(REFERRER, 5);
        verify(notificationSink).enqueue(eq(REFERRER), eq("referral_upload"), anyMap());
    }

    @Test
    void testRewardForFirstUpload_NotReferred() {
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", null, 0)));

        assertFalse(referralService.rewardForFirstUpload(APPLICANT).isPresent());

        verifyNoInteractions(noteStore, pointsService);
    }

    @Test
    void testRewardForFirstUpload_AlreadyClaimedConcurrently() {
        when(referralRepository.findById(APPLICANT)).thenReturn(Optional.of(referral(APPLICANT, "S050XYZ", "ABCD12X", 0)));
        when(noteStore.countUploads(APPLICANT, false)).thenReturn(2L);
        when(referralRepository.claimFirstUploadReward(APPLICANT)).thenReturn(0);

        assertFalse(referralService.rewardForFirstUpload(APPLICANT).isPresent());

        verify(referralRepository, never()).addBonusDownloads(anyString(), anyInt());
        verifyNoInteractions(pointsService);
    }

    @Test
    void testGetStats() {
        when(referralRepository.findById(REFERRER)).thenReturn(Optional.of(referral(REFERRER, "ABCD12X", null, 4)));

        ReferralStatsDTO stats = referralService.getStats(REFERRER);

        assertEquals(4, stats.getTotalReferrals());
        assertEquals(3, stats.getMilestones().size());
        assertTrue(stats.getMilestones().get(0).isAchieved());
        assertFalse(stats.getMilestones().get(1).isAchieved());
        assertEquals(10, stats.getNextMilestone().getReferrals());
        assertEquals(40.0, stats.getProgressToNext());
    }

    @Test
    void testGetTopReferrers() {
        when(referralRepository.findByTotalReferralsGreaterThanOrderByTotalReferralsDescUserIdAsc(0, PageRequest.of(0, 2)))
                .thenReturn(List.of(referral("a", "AAAA111", null, 9), referral("b", "BBBB222", null, 4)));
        when(userDirectory.getUser("a")).thenReturn(Optional.of(profile("a", "1RV21CS001")));
        when(userDirectory.getUser("b")).thenReturn(Optional.empty());

        List<TopReferrerDTO> top = referralService.getTopReferrers(2);

        assertEquals(2, top.size());
        assertEquals(1, top.get(0).getRank());
        assertEquals("1RV21CS001", top.get(0).getHandle());
        assertEquals(2, top.get(1).getRank());
        assertNull(top.get(1).getHandle());
    }

    @Test
    void testGetTopReferrers_InvalidLimit() {
        assertThrows(ValidationException.class, () -> referralService.getTopReferrers(0));
        assertThrows(ValidationException.class, () -> referralService.getTopReferrers(101));
    }
}
