package com.clan.clears.actor;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.ClanMember;
import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.CoordinatorState;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.JobState;
import com.clan.clears.dto.MemberRoster;
import com.clan.clears.dto.MembersRefreshResult;
import com.clan.clears.dto.PerMemberResult;
import com.clan.clears.dto.RefreshOptions;
import com.clan.clears.dto.RefreshResult;
import com.clan.clears.service.InMemoryDurableStore;
import com.clan.clears.service.RosterService;
import com.clan.clears.service.SnapshotAggregator;
import com.clan.clears.util.RefreshStatusManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ClanSnapshotActorTest {

    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @Mock
    private MemberJobRegistry registry;

    @Mock
    private RosterService rosterService;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ClearsProperties properties = new ClearsProperties();
    private final RefreshStatusManager statusManager = new RefreshStatusManager();
    private InMemoryDurableStore store;
    private ClanSnapshotActor coordinator;

    @BeforeEach
    void setUp() {
        properties.getRefresh().setBatchPause(Duration.ZERO);
        properties.getRefresh().setMemberTimeout(Duration.ofMillis(50));
        store = new InMemoryDurableStore(clock);
        coordinator = new ClanSnapshotActor(Runnable::run, store, registry, rosterService, new SnapshotAggregator(),
                statusManager, clock, properties);
    }

    private static ClanMember member(String id, boolean online) {
        return ClanMember.builder().membershipId(id).membershipType(3).displayName("Guardian " + id)
                .online(online).build();
    }

    private void seedRoster(String... ids) {
        List<ClanMember> members = new ArrayList<>();
        for (String id : ids) {
            members.add(member(id, false));
        }
        store.put("members", new MemberRoster(members, members.size(), NOW.minusSeconds(600)));
    }

    /** 注册一个任务立即完成、结果已写入存储的成员 actor。 */
    private MemberJobActor finishing(String id, int clears, int special) {
        store.put("member_clears:" + id, PerMemberResult.builder()
                .membershipId(id).membershipType(3).clears(clears).specialClears(special).fetchedAt(NOW).build());
        JobRecord done = JobRecord.builder().key("job:" + id).membershipId(id).state(JobState.DONE).build();
        return actorReturning(id, CompletableFuture.completedFuture(done));
    }

    private MemberJobActor actorReturning(String id, CompletableFuture<JobRecord> completion) {
        MemberJobActor actor = mock(MemberJobActor.class);
        when(actor.process(any())).thenReturn(new JobSubmission("job:" + id, JobState.PENDING, completion));
        when(registry.forMember(id)).thenReturn(actor);
        return actor;
    }

    @Test
    void refreshAggregatesFinishedMembersAndSkipsSlowOnes() {
        seedRoster("m1", "m2", "m3");
        finishing("m1", 4, 1);
        finishing("m2", 7, 0);
        actorReturning("m3", new CompletableFuture<>());

        RefreshResult result = coordinator.refreshStats(new RefreshOptions());

        assertThat(result.isOk()).isTrue();
        assertThat(result.getDispatched()).isEqualTo(3);
        assertThat(result.getCompleted()).isEqualTo(2);
        ClearsSnapshot snapshot = coordinator.currentSnapshot().orElseThrow();
        assertThat(snapshot.getClears()).isEqualTo(11);
        assertThat(snapshot.getSpecialClears()).isEqualTo(1);
        assertThat(snapshot.getMemberCount()).isEqualTo(3);
        assertThat(snapshot.getProcessedCount()).isEqualTo(2);
        assertThat(snapshot.getSource()).isEqualTo(ClearsSnapshot.SOURCE_COORDINATOR);
        assertThat(snapshot.getPerMember()).extracting(PerMemberResult::getMembershipId).containsExactly("m1", "m2");
        assertThat(coordinator.debug().getLastStatsRefreshAt()).isEqualTo(NOW);
        assertThat(statusManager.isStatsRefreshInProgress()).isFalse();
    }

    @Test
    @DisplayName("放弃的成员被排除，其余成员照常计入")
    void failedMemberIsExcluded() {
        seedRoster("m1", "m2");
        finishing("m1", 2, 0);
        actorReturning("m2", CompletableFuture.failedFuture(new IllegalStateException("gave up")));

        RefreshResult result = coordinator.refreshStats(new RefreshOptions());

        assertThat(result.getSnapshot().getClears()).isEqualTo(2);
        assertThat(result.getSnapshot().getProcessedCount()).isEqualTo(1);
    }

    @Test
    void refreshWithinMinimumIntervalIsRejected() {
        seedRoster("m1");
        ClearsSnapshot previous = ClearsSnapshot.builder().clears(40).fetchedAt(NOW.minusSeconds(60)).build();
        store.put("clears_snapshot", previous);
        store.put("coordinator_state", new CoordinatorState(null, NOW.minusSeconds(60), NOW.minusSeconds(90)));

        RefreshResult result = coordinator.refreshStats(new RefreshOptions());

        assertThat(result.isOk()).isFalse();
        assertThat(result.isRateLimited()).isTrue();
        assertThat(result.getCurrent().getClears()).isEqualTo(40);
        verifyNoInteractions(registry);
    }

    @Test
    void forcedRefreshIgnoresMinimumInterval() {
        seedRoster("m1");
        finishing("m1", 9, 0);
        store.put("coordinator_state", new CoordinatorState(null, NOW.minusSeconds(60), NOW.minusSeconds(90)));

        RefreshResult result = coordinator.refreshStats(RefreshOptions.builder().force(true).build());

        assertThat(result.isOk()).isTrue();
        assertThat(result.getSnapshot().getClears()).isEqualTo(9);
    }

    @Test
    void userLimitCapsTheFanOut() {
        seedRoster("m1", "m2", "m3");
        finishing("m1", 1, 0);
        finishing("m2", 1, 0);

        RefreshResult result = coordinator.refreshStats(RefreshOptions.builder().userLimit(2).build());

        assertThat(result.getDispatched()).isEqualTo(2);
        assertThat(result.getSnapshot().getMemberCount()).isEqualTo(3);
        verify(registry, never()).forMember("m3");
    }

    @Test
    void missingRosterIsFetchedFirst() {
        when(rosterService.fetchRoster()).thenReturn(List.of(member("m1", true)));
        finishing("m1", 5, 0);

        RefreshResult result = coordinator.refreshStats(new RefreshOptions());

        assertThat(result.getSnapshot().getClears()).isEqualTo(5);
        assertThat(coordinator.cachedRoster()).isPresent();
    }

    @Test
    void unchangedRosterIsNotRewritten() {
        seedRoster("m1", "m2");
        when(rosterService.fetchRoster()).thenReturn(List.of(member("m1", false), member("m2", false)));

        MembersRefreshResult result = coordinator.refreshMembers(false).join();

        assertThat(result.isChanged()).isFalse();
        assertThat(result.getMemberCount()).isEqualTo(2);
        assertThat(coordinator.cachedRoster().orElseThrow().getFetchedAt()).isEqualTo(NOW.minusSeconds(600));
        assertThat(coordinator.debug().getLastMembersFetchedAt()).isEqualTo(NOW);
    }

    @Test
    void onlineStatusChangeRewritesRoster() {
        seedRoster("m1", "m2");
        when(rosterService.fetchRoster()).thenReturn(List.of(member("m1", true), member("m2", false)));

        MembersRefreshResult result = coordinator.refreshMembers(false).join();

        assertThat(result.isChanged()).isTrue();
        MemberRoster roster = coordinator.cachedRoster().orElseThrow();
        assertThat(roster.getFetchedAt()).isEqualTo(NOW);
        assertThat(roster.onlineCount()).isEqualTo(1);
    }

    @Test
    void requestedRefreshCompletesAndClearsInFlightFlag() {
        seedRoster("m1");
        finishing("m1", 3, 0);

        RefreshResult result = coordinator.requestStatsRefresh(new RefreshOptions()).join();

        assertThat(result.getSnapshot().getClears()).isEqualTo(3);
        assertThat(coordinator.isRefreshing()).isFalse();
        verify(registry).forMember(anyString());
    }
}
