package com.noteshub.gamification.service;

import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.ReferralDTO;
import com.noteshub.gamification.dto.ReferralMilestoneDTO;
import com.noteshub.gamification.dto.ReferralRewardDTO;
import com.noteshub.gamification.dto.ReferralStatsDTO;
import com.noteshub.gamification.dto.ReferredUserDTO;
import com.noteshub.gamification.dto.RewardsEarnedDTO;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class ReferralServiceImpl implements ReferralService {

    private static final Logger log = LoggerFactory.getLogger(ReferralServiceImpl.class);

    static final int APPLICANT_BONUS_DOWNLOADS = 20;
    static final int REFERRER_BONUS_DOWNLOADS = 10;
    static final int FIRST_UPLOAD_BONUS_DOWNLOADS = 5;
    static final int MAX_TOP_REFERRERS = 100;

    private static final List<Milestone> MILESTONES = List.of(
            new Milestone(3, "Unlock AI assistant (1 month)", 15),
            new Milestone(10, "Lifetime premium access", 50),
            new Milestone(50, "Cash payout ₹500", 100)
    );

    private final UserReferralRepository referralRepository;
    private final ReferredUserRepository referredUserRepository;
    private final GamificationJdbcRepository jdbcRepository;
    private final ReferralCodeGenerator codeGenerator;
    private final UserDirectory userDirectory;
    private final NoteStore noteStore;
    private final PointsService pointsService;
    private final NotificationSink notificationSink;
    private final GamificationProperties properties;
    private final Clock clock;

    public ReferralServiceImpl(UserReferralRepository referralRepository,
                               ReferredUserRepository referredUserRepository,
                               GamificationJdbcRepository jdbcRepository,
                               ReferralCodeGenerator codeGenerator,
                               UserDirectory userDirectory,
                               NoteStore noteStore,
                               PointsService pointsService,
                               NotificationSink notificationSink,
                               GamificationProperties properties,
                               Clock clock) {
        this.referralRepository = referralRepository;
        this.referredUserRepository = referredUserRepository;
        this.jdbcRepository = jdbcRepository;
        this.codeGenerator = codeGenerator;
        this.userDirectory = userDirectory;
        this.noteStore = noteStore;
        this.pointsService = pointsService;
        this.notificationSink = notificationSink;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public ReferralDTO getOrCreateReferral(String userId) {
        return toDTO(findOrMint(userId));
    }

    @Override
    @Transactional
    public ReferralRewardDTO applyReferralCode(String userId, String code) {
        UserProfile applicant = userDirectory.getUser(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        UserReferral own = findOrMint(userId);

        if (own.getReferredBy() != null) {
            throw new ValidationException("You have already used a referral code");
        }
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        UserReferral referrer = referralRepository.findByReferralCode(normalized)
                .orElseThrow(() -> new NotFoundException("Invalid referral code"));
        if (referrer.getUserId().equals(userId)) {
            throw new ValidationException("You cannot use your own referral code");
        }

        if (referralRepository.markReferred(userId, normalized, APPLICANT_BONUS_DOWNLOADS) == 0) {
            // another request set referred_by first
            throw new ValidationException("You have already used a referral code");
        }
        referralRepository.creditReferral(referrer.getUserId(), REFERRER_BONUS_DOWNLOADS);
        referredUserRepository.save(new ReferredUser(null, referrer.getUserId(), userId,
                applicant.getHandle(), LocalDateTime.now(clock)));
        int points = pointsService.awardPoints(referrer.getUserId(), PointsActions.REFERRAL_SIGNUP).getAwarded();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("referred_user_id", userId);
        payload.put("handle", applicant.getHandle());
        payload.put("bonus_downloads", REFERRER_BONUS_DOWNLOADS);
        payload.put("points", points);
        notificationSink.enqueue(referrer.getUserId(), "referral_signup", payload);

        log.info("User {} applied referral code {} of user {}", userId, normalized, referrer.getUserId());
        return new ReferralRewardDTO("signup", referrer.getUserId(), APPLICANT_BONUS_DOWNLOADS,
                REFERRER_BONUS_DOWNLOADS, points);
    }

    @Override
    @Transactional
    public Optional<ReferralRewardDTO> rewardForFirstUpload(String userId) {
        Optional<UserReferral> row = referralRepository.findById(userId);
        if (row.isEmpty() || row.get().getReferredBy() == null || row.get().isFirstUploadRewardClaimed()) {
            return Optional.empty();
        }
        if (noteStore.countUploads(userId, false) < 1) {
            return Optional.empty();
        }
        if (referralRepository.claimFirstUploadReward(userId) == 0) {
            return Optional.empty();
        }

        String code = row.get().getReferredBy();
        UserReferral referrer = referralRepository.findByReferralCode(code)
                .orElseThrow(() -> new IllegalStateException("Referral code " + code + " of user " + userId + " has no owner"));
        referralRepository.addBonusDownloads(referrer.getUserId(), FIRST_UPLOAD_BONUS_DOWNLOADS);
        int points = pointsService.awardPoints(referrer.getUserId(), PointsActions.REFERRAL_UPLOAD).getAwarded();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("referred_user_id", userId);
        payload.put("bonus_downloads", FIRST_UPLOAD_BONUS_DOWNLOADS);
        payload.put("points", points);
        notificationSink.enqueue(referrer.getUserId(), "referral_upload", payload);

        log.info("Referrer {} rewarded for first upload of user {}", referrer.getUserId(), userId);
        return Optional.of(new ReferralRewardDTO("first_upload", referrer.getUserId(), 0,
                FIRST_UPLOAD_BONUS_DOWNLOADS, points));
    }

    @Override
    public List<ReferralMilestoneDTO> getMilestones(int totalReferrals) {
        List<ReferralMilestoneDTO> result = new ArrayList<>(MILESTONES.size());
        for (Milestone milestone : MILESTONES) {
            result.add(new ReferralMilestoneDTO(milestone.referrals, milestone.reward, milestone.bonusDownloads,
                    totalReferrals >= milestone.referrals));
        }
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public ReferralStatsDTO getStats(String userId) {
        Optional<UserReferral> row = referralRepository.findById(userId);
        int total = row.map(UserReferral::getTotalReferrals).orElse(0);

        ReferralStatsDTO dto = new ReferralStatsDTO();
        dto.setReferralCode(row.map(UserReferral::getReferralCode).orElse(null));
        dto.setTotalReferrals(total);
        dto.setRewardsEarned(row.map(ReferralServiceImpl::rewards).orElse(new RewardsEarnedDTO(0, 0, 0)));

        List<ReferralMilestoneDTO> milestones = getMilestones(total);
        dto.setMilestones(milestones);
        ReferralMilestoneDTO next = milestones.stream().filter(m -> !m.isAchieved()).findFirst().orElse(null);
        dto.setNextMilestone(next);
        dto.setProgressToNext(next == null ? null : BigDecimal.valueOf(total)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(next.getReferrals()), 1, RoundingMode.HALF_UP)
                .doubleValue());
        return dto;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferredUserDTO> getReferredUsers(String userId) {
        List<ReferredUserDTO> result = new ArrayList<>();
        for (ReferredUser referred : referredUserRepository.findByReferrerIdOrderByJoinedAtAscReferredIdAsc(userId)) {
            result.add(new ReferredUserDTO(referred.getUserId(), referred.getHandle(), referred.getJoinedAt()));
        }
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TopReferrerDTO> getTopReferrers(int limit) {
        if (limit < 1 || limit > MAX_TOP_REFERRERS) {
            throw new ValidationException("limit must be between 1 and " + MAX_TOP_REFERRERS);
        }
        List<UserReferral> top = referralRepository
                .findByTotalReferralsGreaterThanOrderByTotalReferralsDescUserIdAsc(0, PageRequest.of(0, limit));

        List<TopReferrerDTO> result = new ArrayList<>(top.size());
        int rank = 1;
        for (UserReferral referral : top) {
            String handle = userDirectory.getUser(referral.getUserId()).map(UserProfile::getHandle).orElse(null);
            result.add(new TopReferrerDTO(rank++, referral.getUserId(), handle, referral.getTotalReferrals()));
        }
        return result;
    }

    /**
     * Reads the user's row or creates it with a fresh code, re-minting on code collisions.
     */
    private UserReferral findOrMint(String userId) {
        Optional<UserReferral> existing = referralRepository.findById(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        String handle = userDirectory.getUser(userId)
                .map(UserProfile::getHandle)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));

        int attempts = properties.getReferral().getMaxCodeAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String code = codeGenerator.generate(handle);
            if (referralRepository.existsByReferralCode(code)) {
                continue;
            }
            try {
                jdbcRepository.insertReferral(userId, code, LocalDateTime.now(clock));
                log.debug("Minted referral code {} for user {}", code, userId);
                break;
            } catch (DuplicateKeyException e) {
                if (referralRepository.existsById(userId)) {
                    // created by a concurrent request
                    break;
                }
                log.debug("Referral code {} taken, minting another", code);
            }
        }
        return referralRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException(
                        "Could not mint a unique referral code for user " + userId + " in " + attempts + " attempts"));
    }

    private ReferralDTO toDTO(UserReferral referral) {
        String link = properties.getReferral().getBaseUrl() + "?ref=" + referral.getReferralCode();
        return new ReferralDTO(referral.getReferralCode(), referral.getTotalReferrals(), rewards(referral),
                link, referral.getReferredBy());
    }

    private static RewardsEarnedDTO rewards(UserReferral referral) {
        return new RewardsEarnedDTO(referral.getBonusDownloads(), referral.getAiAccessDays(), referral.getPremiumDays());
    }

    private static final class Milestone {
        private final int referrals;
        private final String reward;
        private final int bonusDownloads;

        private Milestone(int referrals, String reward, int bonusDownloads) {
            this.referrals = referrals;
            this.reward = reward;
            this.bonusDownloads = bonusDownloads;
        }
    }
}
