package com.noteshub.gamification.controller;

import com.noteshub.gamification.dto.AchievementCategoryDTO;
import com.noteshub.gamification.dto.AchievementCheckDTO;
import com.noteshub.gamification.dto.AchievementDTO;
import com.noteshub.gamification.dto.AchievementProgressDTO;
import com.noteshub.gamification.dto.AchievementStatsDTO;
import com.noteshub.gamification.dto.CommonResponse;
import com.noteshub.gamification.dto.UserAchievementDTO;
import com.noteshub.gamification.service.AchievementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/achievements")
public class AchievementController {

    private final AchievementService achievementService;

    public AchievementController(AchievementService achievementService) {
        this.achievementService = achievementService;
    }

    /**
     * GET /api/achievements/getAchievementList
     * Catalog with platform-wide unlock counts.
     */
    @GetMapping("/getAchievementList")
    public ResponseEntity<CommonResponse<List<AchievementDTO>>> getAchievementList() {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getAchievementList()));
    }

    /**
     * GET /api/achievements/getAchievementRanking?count=5&sort_order=desc
     * @param count     entries to return (default 1)
     * @param sortOrder "asc" or "desc" by unlock count (default "desc")
     */
    @GetMapping("/getAchievementRanking")
    public ResponseEntity<CommonResponse<List<AchievementDTO>>> getAchievementRanking(
            @RequestParam(value = "count", required = false) Integer count,
            @RequestParam(value = "sort_order", required = false) String sortOrder) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getAchievementRanking(count, sortOrder)));
    }

    @GetMapping("/all")
    public ResponseEntity<CommonResponse<List<UserAchievementDTO>>> getAll(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getAllWithStatus(userId)));
    }

    @GetMapping("/unlocked")
    public ResponseEntity<CommonResponse<List<UserAchievementDTO>>> getUnlocked(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getUnlocked(userId)));
    }

    @GetMapping("/progress")
    public ResponseEntity<CommonResponse<List<AchievementProgressDTO>>> getProgress(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getProgress(userId)));
    }

    @GetMapping("/categories")
    public ResponseEntity<CommonResponse<List<AchievementCategoryDTO>>> getCategories(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getCategories(userId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<CommonResponse<AchievementStatsDTO>> getStats(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.getStats(userId)));
    }

    /**
     * POST /api/achievements/check
     * Runs the unlock check for the caller now.
     */
    @PostMapping("/check")
    public ResponseEntity<CommonResponse<AchievementCheckDTO>> check(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(achievementService.check(userId)));
    }
}
