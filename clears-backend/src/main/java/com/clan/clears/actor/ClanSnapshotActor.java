package com.clan.clears.actor;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.ClanMember;
import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.CoordinatorState;
import com.clan.clears.dto.CounterOptions;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.MemberRoster;
import com.clan.clears.dto.MembersRefreshResult;
import com.clan.clears.dto.PerMemberResult;
import com.clan.clears.dto.RefreshOptions;
import com.clan.clears.dto.RefreshResult;
import com.clan.clears.service.DurableStore;
import com.clan.clears.service.RosterService;
import com.clan.clears.service.SnapshotAggregator;
import com.clan.clears.util.FanOutProgress;
import com.clan.clears.util.RefreshStatusManager;
import com.clan.clears.util.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 战队全局状态的唯一协调者。规范快照、成员列表缓存及自身记录都归它所有，
 * 所有变更都经由同一个邮箱执行。
 *
 * <p>统计刷新按 {@code clears.refresh.concurrency} 分批派发给 {@link MemberJobActor}，
 * 对每个成员有限等待，再汇总已完成成员的持久化结果。快照与记录一起写入。
 */
@Component
public class ClanSnapshotActor {

    private static final Logger log = LoggerFactory.getLogger(ClanSnapshotActor.class);

    private final ActorMailbox mailbox;
    private final DurableStore store;
    private final MemberJobRegistry registry;
    private final RosterService rosterService;
    private final SnapshotAggregator aggregator;
    private final RefreshStatusManager statusManager;
    private final Clock clock;
    private final ClearsProperties properties;

    private CompletableFuture<RefreshResult> inFlight;

    public ClanSnapshotActor(@Qualifier("coordinatorExecutor") Executor coordinatorExecutor,
                             DurableStore store,
                             MemberJobRegistry registry,
                             RosterService rosterService,
                             SnapshotAggregator aggregator,
                             RefreshStatusManager statusManager,
                             Clock clock,
                             ClearsProperties properties) {
        this.mailbox = new ActorMailbox("coordinator", coordinatorExecutor);
        this.store = store;
        this.registry = registry;
        this.rosterService = rosterService;
        this.aggregator = aggregator;
        this.statusManager = statusManager;
        this.clock = clock;
        this.properties = properties;
    }

    public CompletableFuture<MembersRefreshResult> refreshMembers(boolean force) {
        return mailbox.submit(() -> doRefreshMembers(force));
    }

    /**
     * 排队一次统计刷新，已有刷新进行中时返回该刷新。
     */
    public synchronized CompletableFuture<RefreshResult> requestStatsRefresh(RefreshOptions options) {
        if (inFlight != null && !inFlight.isDone()) {
            log.debug("统计刷新已在进行中，复用该刷新");
            return inFlight;
        }
        inFlight = mailbox.submit(() -> doRefreshStats(options));
        return inFlight;
    }

    /**
     * 执行统计刷新并等待完成。
     */
    public RefreshResult refreshStats(RefreshOptions options) {
        return mailbox.call(() -> doRefreshStats(options));
    }

    public Optional<ClearsSnapshot> currentSnapshot() {
        return store.get(StoreKeys.SNAPSHOT, ClearsSnapshot.class);
    }

    public Optional<MemberRoster> cachedRoster() {
        return store.get(StoreKeys.ROSTER, MemberRoster.class);
    }

    public CoordinatorState debug() {
        return loadState();
    }

    public synchronized boolean isRefreshing() {
        return inFlight != null && !inFlight.isDone();
    }

    // ---- 以下只在邮箱中执行 ----

    private MembersRefreshResult doRefreshMembers(boolean force) {
        statusManager.setMembersRefreshInProgress(true);
        try {
            List<ClanMember> fresh = rosterService.fetchRoster();
            Instant now = clock.instant();
            MemberRoster cached = cachedRoster().orElse(null);
            boolean changed = RosterService.materiallyChanged(cached, fresh);

            CoordinatorState state = loadState();
            state.setLastMembersFetchedAt(now);
            if (changed || force) {
                Map<String, Object> writes = new LinkedHashMap<>();
                writes.put(StoreKeys.ROSTER, new MemberRoster(fresh, fresh.size(), now));
                writes.put(StoreKeys.COORDINATOR_STATE, state);
                store.putAll(writes);
                log.info("成员列表已保存: {} 名成员（{}）", fresh.size(), changed ? "有变化" : "强制");
            } else {
                store.put(StoreKeys.COORDINATOR_STATE, state);
                log.debug("成员列表无变化，共 {} 名成员", fresh.size());
            }
            return new MembersRefreshResult(true, fresh.size(), changed);
        } finally {
            statusManager.setMembersRefreshInProgress(false);
        }
    }

    private RefreshResult doRefreshStats(RefreshOptions requested) {
        RefreshOptions options = requested == null ? new RefreshOptions() : requested;
        Instant now = clock.instant();
        CoordinatorState state = loadState();

        Duration minInterval = properties.getRefresh().getMinInterval();
        if (!options.isForce() && state.getLastStatsRefreshAt() != null
                && now.isBefore(state.getLastStatsRefreshAt().plus(minInterval))) {
            log.info("统计刷新被拒绝，上次刷新完成于 {}", state.getLastStatsRefreshAt());
            return RefreshResult.rateLimited(currentSnapshot().orElse(null));
        }

        MemberRoster roster = cachedRoster().orElse(null);
        if (roster == null) {
            doRefreshMembers(true);
            roster = cachedRoster().orElseThrow(() -> new IllegalStateException("Roster unavailable"));
            state = loadState();
        }
        List<ClanMember> members = roster.getMembers();
        int limit = members.size();
        if (options.getUserLimit() != null && options.getUserLimit() > 0) {
            limit = Math.min(limit, options.getUserLimit());
        }
        List<ClanMember> selected = members.subList(0, limit);

        statusManager.setStatsRefreshInProgress(true, now);
        try {
            state.setLastStatsDispatchedAt(now);
            store.put(StoreKeys.COORDINATOR_STATE, state);

            List<String> finished = fanOut(selected, options.toCounterOptions());
            List<PerMemberResult> results = new ArrayList<>();
            for (String membershipId : finished) {
                store.get(StoreKeys.result(membershipId, null), PerMemberResult.class).ifPresent(results::add);
            }

            Instant fetchedAt = clock.instant();
            ClearsSnapshot snapshot = aggregator.aggregate(results, members.size(),
                    ClearsSnapshot.SOURCE_COORDINATOR, fetchedAt);
            state.setLastStatsRefreshAt(fetchedAt);

            Map<String, Object> writes = new LinkedHashMap<>();
            writes.put(StoreKeys.SNAPSHOT, snapshot);
            writes.put(StoreKeys.COORDINATOR_STATE, state);
            store.putAll(writes);

            log.info("快照已写入: {} 次通关（特殊 {} 次），来自 {}/{} 名成员",
                    snapshot.getClears(), snapshot.getSpecialClears(), results.size(), selected.size());
            return RefreshResult.completed(snapshot, selected.size(), results.size());
        } finally {
            statusManager.setStatsRefreshInProgress(false, clock.instant());
        }
    }

    private List<String> fanOut(List<ClanMember> members, CounterOptions counterOptions) {
        int batchSize = Math.max(1, properties.getRefresh().getConcurrency());
        Duration memberTimeout = properties.getRefresh().getMemberTimeout();
        FanOutProgress progress = new FanOutProgress("stats refresh", members.size(), clock);
        List<String> finished = new ArrayList<>();

        for (int start = 0; start < members.size(); start += batchSize) {
            if (start > 0 && !pause(properties.getRefresh().getBatchPause())) {
                break;
            }
            Map<String, CompletableFuture<JobRecord>> batch = new LinkedHashMap<>();
            for (ClanMember member : members.subList(start, Math.min(start + batchSize, members.size()))) {
                try {
                    JobSubmission submission = registry.forMember(member.getMembershipId())
                            .process(JobRequest.forMember(member.getMembershipId(), member.getMembershipType(),
                                    counterOptions));
                    batch.put(member.getMembershipId(), submission.completion());
                } catch (RuntimeException e) {
                    log.warn("无法派发成员 {}: {}", member.getMembershipId(), e.getMessage());
                    progress.step(false);
                }
            }

            long deadline = System.nanoTime() + memberTimeout.toNanos();
            for (Map.Entry<String, CompletableFuture<JobRecord>> entry : batch.entrySet()) {
                boolean done = await(entry.getKey(), entry.getValue(), deadline);
                progress.step(done);
                if (done) {
                    finished.add(entry.getKey());
                }
            }
        }
        progress.complete();
        return finished;
    }

    private boolean await(String membershipId, CompletableFuture<JobRecord> completion, long deadlineNanos) {
        try {
            completion.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("成员 {} 未在刷新窗口内完成", membershipId);
        } catch (ExecutionException e) {
            log.warn("成员 {} 已放弃: {}", membershipId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待成员 {} 时被中断", membershipId);
        }
        return false;
    }

    private boolean pause(Duration pause) {
        if (pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("统计刷新在批次之间被中断");
            return false;
        }
    }

    private CoordinatorState loadState() {
        return store.get(StoreKeys.COORDINATOR_STATE, CoordinatorState.class).orElseGet(CoordinatorState::new);
    }
}
