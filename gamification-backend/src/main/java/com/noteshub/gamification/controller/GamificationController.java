package com.noteshub.gamification.controller;

import com.noteshub.gamification.dto.ActivityResultDTO;
import com.noteshub.gamification.dto.CommonResponse;
import com.noteshub.gamification.dto.LevelInfo;
import com.noteshub.gamification.dto.PointsAward;
import com.noteshub.gamification.dto.PointsHistoryItemDTO;
import com.noteshub.gamification.dto.PointsSummaryDTO;
import com.noteshub.gamification.dto.ShareRequest;
import com.noteshub.gamification.dto.ShareStatsDTO;
import com.noteshub.gamification.dto.StreakDTO;
import com.noteshub.gamification.service.ActivityService;
import com.noteshub.gamification.service.GamificationInitializer;
import com.noteshub.gamification.service.LevelCalculator;
import com.noteshub.gamification.service.PointsService;
import com.noteshub.gamification.service.StreakService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Points, streaks and the user-action hooks the rest of the platform calls.
 */
@RestController
@RequestMapping("/api/gamification")
public class GamificationController {

    private final PointsService pointsService;
    private final StreakService streakService;
    private final LevelCalculator levelCalculator;
    private final ActivityService activityService;
    private final GamificationInitializer initializer;

    public GamificationController(PointsService pointsService,
                                  StreakService streakService,
                                  LevelCalculator levelCalculator,
                                  ActivityService activityService,
                                  GamificationInitializer initializer) {
        this.pointsService = pointsService;
        this.streakService = streakService;
        this.levelCalculator = levelCalculator;
        this.activityService = activityService;
        this.initializer = initializer;
    }

    @GetMapping("/points")
    public ResponseEntity<CommonResponse<PointsSummaryDTO>> getPoints(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(pointsService.getPoints(userId)));
    }

    @GetMapping("/points/history")
    public ResponseEntity<CommonResponse<List<PointsHistoryItemDTO>>> getHistory(
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(pointsService.getHistory(userId, limit)));
    }

    /**
     * @param points omitted: the action's default value
     */
    @PostMapping("/points/award")
    public ResponseEntity<CommonResponse<PointsAward>> award(
            @RequestParam("action") String action,
            @RequestParam(value = "points", required = false) Integer points,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(pointsService.awardPoints(userId, action, points)));
    }

    @GetMapping("/level")
    public ResponseEntity<CommonResponse<LevelInfo>> level(@RequestParam("points") long points) {
        return ResponseEntity.ok(CommonResponse.success(levelCalculator.calculateLevel(points)));
    }

    @GetMapping("/streak")
    public ResponseEntity<CommonResponse<StreakDTO>> getStreak(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(streakService.getStreak(userId)));
    }

    @PostMapping("/streak/activity")
    public ResponseEntity<CommonResponse<StreakDTO>> recordActivity(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        streakService.recordActivity(userId);
        return ResponseEntity.ok(CommonResponse.success(streakService.getStreak(userId)));
    }

    @PostMapping("/share")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> share(
            @Valid @RequestBody ShareRequest request,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(
                activityService.onNoteShared(userId, request.getNoteId(), request.getPlatform())));
    }

    @GetMapping("/share/stats")
    public ResponseEntity<CommonResponse<ShareStatsDTO>> shareStats(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.getShareStats(userId)));
    }

    // --- hooks called by the notes, auth, social and group services ---

    @PostMapping("/events/note-uploaded")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> noteUploaded(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onNoteUploaded(userId)));
    }

    @PostMapping("/events/note-downloaded")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> noteDownloaded(
            @RequestParam("ownerId") String ownerId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onNoteDownloaded(userId, ownerId)));
    }

    @PostMapping("/events/login")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> login(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onLogin(userId)));
    }

    @PostMapping("/events/follow")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> follow(
            @RequestParam("targetId") String targetId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onFollow(userId, targetId)));
    }

    @PostMapping("/events/group-joined")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> groupJoined(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onGroupJoined(userId)));
    }

    @PostMapping("/events/group-created")
    public ResponseEntity<CommonResponse<ActivityResultDTO>> groupCreated(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(activityService.onGroupCreated(userId)));
    }

    /**
     * Called after registration; never fails the registration.
     */
    @PostMapping("/init")
    public ResponseEntity<CommonResponse<Boolean>> init(
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(initializer.initializeUser(userId)));
    }

    /**
     * @return number of users that could not be initialised
     */
    @PostMapping("/backfill")
    public ResponseEntity<CommonResponse<Integer>> backfill() {
        return ResponseEntity.ok(CommonResponse.success(initializer.backfillAll()));
    }
}
