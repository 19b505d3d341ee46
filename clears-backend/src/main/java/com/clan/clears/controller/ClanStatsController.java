package com.clan.clears.controller;

import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.CommonResponse;
import com.clan.clears.dto.CoordinatorState;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.MembersView;
import com.clan.clears.dto.ReadMode;
import com.clan.clears.dto.RunUpdateRequest;
import com.clan.clears.dto.RunUpdateResult;
import com.clan.clears.dto.StatsView;
import com.clan.clears.service.ClanStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ClanStatsController {

    private final ClanStatsService clanStatsService;

    /**
     * GET /stats?mode=cached|fresh|sync
     * 规范快照，没有时返回由成员结果重建的部分快照。
     */
    @GetMapping("/stats")
    public ResponseEntity<CommonResponse<StatsView>> getStats(
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Long waitMs,
            @RequestParam(required = false) Integer userLimit) {

        StatsView view = clanStatsService.getStats(ReadMode.parse(mode), waitMs, userLimit);
        if (view.getSnapshot() == null) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(CommonResponse.accepted(view, "Refresh started, no data yet"));
        }
        return ResponseEntity.ok(CommonResponse.success(view));
    }

    /**
     * GET /members?mode=cached|fresh|sync
     */
    @GetMapping("/members")
    public ResponseEntity<CommonResponse<MembersView>> getMembers(@RequestParam(required = false) String mode) {
        MembersView view = clanStatsService.getMembers(ReadMode.parse(mode));
        if (view.getRoster() == null) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(CommonResponse.accepted(view, "Roster loading"));
        }
        return ResponseEntity.ok(CommonResponse.success(view));
    }

    @GetMapping("/clears-snapshot")
    public ResponseEntity<CommonResponse<ClearsSnapshot>> getClearsSnapshot() {
        return ResponseEntity.ok(CommonResponse.success(clanStatsService.getCanonicalSnapshot()));
    }

    /**
     * POST /run-update，受管理员令牌过滤器保护。
     */
    @PostMapping("/run-update")
    public ResponseEntity<CommonResponse<RunUpdateResult>> runUpdate(
            @RequestBody(required = false) RunUpdateRequest request) {

        RunUpdateResult result = clanStatsService.runUpdate(request == null ? new RunUpdateRequest() : request);
        if (!result.isFinished()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(CommonResponse.accepted(result, "Refresh accepted"));
        }
        return ResponseEntity.ok(CommonResponse.success(result));
    }

    @GetMapping("/jobs/{membershipId}")
    public ResponseEntity<CommonResponse<List<JobRecord>>> getJobs(@PathVariable String membershipId) {
        return ResponseEntity.ok(CommonResponse.success(clanStatsService.getJobStatus(membershipId)));
    }

    @GetMapping("/debug")
    public ResponseEntity<CommonResponse<CoordinatorState>> getDebug() {
        return ResponseEntity.ok(CommonResponse.success(clanStatsService.getDebugState()));
    }
}
