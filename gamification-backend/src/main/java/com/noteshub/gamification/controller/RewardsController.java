package com.noteshub.gamification.controller;

import com.noteshub.gamification.dto.CommonResponse;
import com.noteshub.gamification.dto.MilestoneDTO;
import com.noteshub.gamification.service.MilestoneRewardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rewards")
public class RewardsController {

    private final MilestoneRewardService milestoneRewardService;

    public RewardsController(MilestoneRewardService milestoneRewardService) {
        this.milestoneRewardService = milestoneRewardService;
    }

    @GetMapping("/milestones")
    public ResponseEntity<CommonResponse<List<MilestoneDTO>>> getMilestones(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(milestoneRewardService.getMilestones(userId)));
    }

    /**
     * Reached milestones the caller has not claimed yet.
     */
    @GetMapping("/milestone-rewards")
    public ResponseEntity<CommonResponse<List<MilestoneDTO>>> getUnclaimed(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(milestoneRewardService.getUnclaimed(userId)));
    }

    @PostMapping("/milestone-rewards/claim")
    public ResponseEntity<CommonResponse<MilestoneDTO>> claim(
            @RequestParam("milestone_type") String milestoneType,
            @RequestParam("threshold") int threshold,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(milestoneRewardService.claim(userId, milestoneType, threshold)));
    }
}
