package com.noteshub.gamification.controller;

import com.noteshub.gamification.dto.CommonResponse;
import com.noteshub.gamification.dto.LeaderboardDTO;
import com.noteshub.gamification.service.LeaderboardScope;
import com.noteshub.gamification.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/leaderboards")
public class LeaderboardController {

    private final LeaderboardService leaderboardService;

    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/all-india")
    public ResponseEntity<CommonResponse<LeaderboardDTO>> getAllIndia(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(
                leaderboardService.getLeaderboard(LeaderboardScope.ALL_INDIA, null, limit, userId)));
    }

    /**
     * @param college defaults to the caller's college
     */
    @GetMapping("/college")
    public ResponseEntity<CommonResponse<LeaderboardDTO>> getCollege(
            @RequestParam(value = "college", required = false) String college,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(
                leaderboardService.getLeaderboard(LeaderboardScope.COLLEGE, college, limit, userId)));
    }

    /**
     * @param department defaults to the caller's department
     */
    @GetMapping("/department")
    public ResponseEntity<CommonResponse<LeaderboardDTO>> getDepartment(
            @RequestParam(value = "department", required = false) String department,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CommonResponse.success(
                leaderboardService.getLeaderboard(LeaderboardScope.DEPARTMENT, department, limit, userId)));
    }

    @PostMapping("/refresh")
    public ResponseEntity<CommonResponse<Void>> refresh() {
        leaderboardService.refresh();
        return ResponseEntity.ok(CommonResponse.success());
    }
}
