package com.noteshub.gamification.controller;

import com.noteshub.gamification.dto.CommonResponse;
import com.noteshub.gamification.dto.ReferralDTO;
import com.noteshub.gamification.dto.ReferralMilestoneDTO;
import com.noteshub.gamification.dto.ReferralRewardDTO;
import com.noteshub.gamification.dto.ReferralStatsDTO;
import com.noteshub.gamification.dto.ReferredUserDTO;
import com.noteshub.gamification.dto.TopReferrerDTO;
import com.noteshub.gamification.service.ReferralService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/referrals")
public class ReferralController {

    private final ReferralService referralService;

    public ReferralController(ReferralService referralService) {
        this.referralService = referralService;
    }

    @GetMapping("/my-referral")
    public ResponseEntity<CommonResponse<ReferralDTO>> getMyReferral(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(referralService.getOrCreateReferral(userId)));
    }

    @PostMapping("/apply-code/{code}")
    public ResponseEntity<CommonResponse<ReferralRewardDTO>> applyCode(
            @PathVariable("code") String code,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(referralService.applyReferralCode(userId, code)));
    }

    /**
     * data is null when nothing was paid out.
     */
    @PostMapping("/reward-for-upload")
    public ResponseEntity<CommonResponse<ReferralRewardDTO>> rewardForUpload(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(referralService.rewardForFirstUpload(userId).orElse(null)));
    }

    @GetMapping("/referred-users")
    public ResponseEntity<CommonResponse<List<ReferredUserDTO>>> getReferredUsers(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(referralService.getReferredUsers(userId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<CommonResponse<ReferralStatsDTO>> getStats(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(referralService.getStats(userId)));
    }

    @GetMapping("/milestones")
    public ResponseEntity<CommonResponse<List<ReferralMilestoneDTO>>> getMilestones(
            @RequestParam(value = "referrals", defaultValue = "0") int referrals) {
        return ResponseEntity.ok(CommonResponse.success(referralService.getMilestones(referrals)));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<CommonResponse<List<TopReferrerDTO>>> getTopReferrers(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(CommonResponse.success(referralService.getTopReferrers(limit)));
    }
}
