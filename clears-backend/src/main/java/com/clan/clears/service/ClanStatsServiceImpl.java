package com.clan.clears.service;

import com.clan.clears.actor.ClanSnapshotActor;
import com.clan.clears.actor.MemberJobRegistry;
import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.CoordinatorState;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.MemberRoster;
import com.clan.clears.dto.MembersRefreshResult;
import com.clan.clears.dto.MembersView;
import com.clan.clears.dto.PerMemberResult;
import com.clan.clears.dto.ReadMode;
import com.clan.clears.dto.RefreshOptions;
import com.clan.clears.dto.RefreshResult;
import com.clan.clears.dto.RunUpdateRequest;
import com.clan.clears.dto.RunUpdateResult;
import com.clan.clears.dto.StatsView;
import com.clan.clears.exception.ResourceNotFoundException;
import com.clan.clears.util.RefreshStatusManager;
import com.clan.clears.util.StoreKeys;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
public class ClanStatsServiceImpl implements ClanStatsService {

    private static final Logger log = LoggerFactory.getLogger(ClanStatsServiceImpl.class);

    private final ClanSnapshotActor coordinator;
    private final MemberJobRegistry registry;
    private final DurableStore store;
    private final SnapshotAggregator aggregator;
    private final ClearsProperties properties;
    private final RefreshStatusManager statusManager;
    private final Clock clock;

    @Override
    public StatsView getStats(ReadMode mode, Long waitMs, Integer userLimit) {
        switch (mode) {
            case FRESH: {
                coordinator.requestStatsRefresh(new RefreshOptions());
                return statsView(bestSnapshot().orElse(null), true, null);
            }
            case SYNC:
                return syncStats(waitMs, userLimit);
            case CACHED:
            default: {
                ClearsSnapshot snapshot = bestSnapshot()
                        .orElseThrow(() -> new ResourceNotFoundException("No clears data yet"));
                return statsView(snapshot, coordinator.isRefreshing() || statusManager.isStatsRefreshInProgress(), null);
            }
        }
    }

    @Override
    public MembersView getMembers(ReadMode mode) {
        Optional<MemberRoster> roster = coordinator.cachedRoster();
        switch (mode) {
            case FRESH: {
                coordinator.refreshMembers(false);
                return new MembersView(roster.orElse(null), roster.isEmpty(), true);
            }
            case SYNC: {
                Duration wait = properties.getGateway().getSyncWaitTimeout();
                MembersRefreshResult result = await(coordinator.refreshMembers(false), wait);
                Optional<MemberRoster> refreshed = coordinator.cachedRoster();
                return new MembersView(refreshed.orElse(null), refreshed.isEmpty(), result == null);
            }
            case CACHED:
            default: {
                if (roster.isPresent()) {
                    return new MembersView(roster.get(), false, statusManager.isMembersRefreshInProgress());
                }
                // 首次访问：启动首次拉取并返回加载中
                coordinator.refreshMembers(false);
                return new MembersView(null, true, true);
            }
        }
    }

    @Override
    public ClearsSnapshot getCanonicalSnapshot() {
        return coordinator.currentSnapshot()
                .orElseThrow(() -> new ResourceNotFoundException("No snapshot stored"));
    }

    @Override
    public Optional<ClearsSnapshot> buildPartialSnapshot() {
        List<PerMemberResult> results = store.list(StoreKeys.RESULT_PREFIX, PerMemberResult.class).stream()
                .filter(result -> result.getCharacterId() == null)
                .toList();
        if (results.isEmpty()) {
            return Optional.empty();
        }
        long members = results.stream().map(PerMemberResult::getMembershipId).distinct().count();
        return Optional.of(aggregator.aggregate(results, (int) members, ClearsSnapshot.SOURCE_PARTIAL, clock.instant()));
    }

    @Override
    public RunUpdateResult runUpdate(RunUpdateRequest request) {
        String action = request.getAction() == null ? RunUpdateRequest.ACTION_ALL : request.getAction();
        RefreshOptions options = request.getOpts() == null
                ? new RefreshOptions().withForce(true)
                : request.getOpts();

        CompletableFuture<MembersRefreshResult> members = null;
        CompletableFuture<RefreshResult> stats = null;
        switch (action) {
            case RunUpdateRequest.ACTION_MEMBERS:
                members = coordinator.refreshMembers(true);
                break;
            case RunUpdateRequest.ACTION_STATS:
                stats = coordinator.requestStatsRefresh(options);
                break;
            case RunUpdateRequest.ACTION_ALL:
                members = coordinator.refreshMembers(true);
                stats = coordinator.requestStatsRefresh(options);
                break;
            default:
                throw new IllegalArgumentException("Unknown action: " + action);
        }
        log.info("管理员刷新 '{}' 已受理（wait={}）", action, request.isWait());

        if (!request.isWait()) {
            return new RunUpdateResult(action, true, false, null, null);
        }
        Duration wait = boundedWait(request.getWaitMs());
        MembersRefreshResult membersResult = members == null ? null : await(members, wait);
        RefreshResult statsResult = stats == null ? null : await(stats, wait);
        boolean finished = (members == null || membersResult != null) && (stats == null || statsResult != null);
        return new RunUpdateResult(action, true, finished, membersResult, statsResult);
    }

    @Override
    public List<JobRecord> getJobStatus(String membershipId) {
        return registry.forMember(membershipId).status();
    }

    @Override
    public CoordinatorState getDebugState() {
        return coordinator.debug();
    }

    private StatsView syncStats(Long waitMs, Integer userLimit) {
        int cap = properties.getGateway().getSyncMemberCap();
        int limit = userLimit == null || userLimit <= 0 ? cap : Math.min(userLimit, cap);
        RefreshResult result = await(coordinator.requestStatsRefresh(new RefreshOptions().withUserLimit(limit)),
                boundedWait(waitMs));

        if (result == null) {
            return statsView(bestSnapshot().orElse(null), true, null);
        }
        if (!result.isOk()) {
            ClearsSnapshot current = result.getCurrent() != null ? result.getCurrent() : bestSnapshot().orElse(null);
            return statsView(current, statusManager.isStatsRefreshInProgress(), result.getReason());
        }
        return statsView(result.getSnapshot(), false, null);
    }

    // 刷新进行中时附带开始时间，便于前端显示“更新中”
    private StatsView statsView(ClearsSnapshot snapshot, boolean refreshing, String rejectedReason) {
        StatsView view = new StatsView(snapshot, refreshing, rejectedReason);
        if (refreshing && statusManager.isStatsRefreshInProgress()) {
            view.setRefreshStartedAt(statusManager.getStatsRefreshStartedAt());
        }
        return view;
    }

    private Optional<ClearsSnapshot> bestSnapshot() {
        Optional<ClearsSnapshot> canonical = coordinator.currentSnapshot();
        return canonical.isPresent() ? canonical : buildPartialSnapshot();
    }

    private Duration boundedWait(Long waitMs) {
        Duration max = properties.getGateway().getSyncWaitTimeout();
        if (waitMs == null || waitMs <= 0) {
            return max;
        }
        Duration requested = Duration.ofMillis(waitMs);
        return requested.compareTo(max) < 0 ? requested : max;
    }

    /**
     * 最多等待 {@code wait}，超时返回 null。
     */
    private <T> T await(CompletableFuture<T> future, Duration wait) {
        try {
            return future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("刷新在 {}ms 后仍未完成，返回当前数据", wait.toMillis());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Refresh failed", cause);
        }
    }
}
