package com.clan.clears.actor;

import com.clan.clears.activity.ActivityCounter;
import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.CounterOptions;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.JobState;
import com.clan.clears.service.InMemoryDurableStore;
import com.clan.clears.upstream.StatsApiClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MemberJobRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @Mock
    private ActivityCounter counter;

    @Mock
    private StatsApiClient statsApiClient;

    @Mock
    private TaskScheduler scheduler;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ClearsProperties properties = new ClearsProperties();
    private InMemoryDurableStore store;
    private MemberJobRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryDurableStore(clock);
        registry = new MemberJobRegistry(store, counter, statsApiClient, scheduler, Runnable::run, Runnable::run,
                clock, properties);
    }

    private void seed(String member, JobState state, Instant lockedAt) {
        String key = "job:" + member;
        store.put(key, JobRecord.builder()
                .key(key)
                .membershipId(member)
                .membershipType(3)
                .options(CounterOptions.defaults())
                .state(state)
                .lockedAt(lockedAt)
                .createdAt(NOW.minusSeconds(7200))
                .build());
    }

    @Test
    @DisplayName("巡检为租约过期的运行中任务设置闹钟，已完成任务不受影响")
    void sweepArmsMembersWithUnfinishedJobs() {
        seed("m1", JobState.RUNNING, NOW.minus(properties.getJobs().getLeaseTtl()).minusSeconds(5));
        seed("m2", JobState.DONE, null);
        seed("m3", JobState.PENDING, null);

        registry.sweepUnfinishedJobs();

        verify(scheduler, times(2)).schedule(any(Runnable.class), eq(NOW));
        verifyNoInteractions(counter);
    }

    @Test
    void sweepWithoutUnfinishedJobsSchedulesNothing() {
        seed("m2", JobState.DONE, null);

        registry.sweepUnfinishedJobs();

        verifyNoInteractions(scheduler);
    }

    @Test
    void startupRecoveryHonoursTheSwitch() {
        seed("m1", JobState.PENDING, null);
        properties.getJobs().setRecoverOnStartup(false);

        registry.recoverUnfinishedJobs();

        verifyNoInteractions(scheduler);

        properties.getJobs().setRecoverOnStartup(true);
        registry.recoverUnfinishedJobs();

        verify(scheduler).schedule(any(Runnable.class), eq(NOW));
        assertThat(registry.forMember("m1")).isSameAs(registry.forMember("m1"));
    }
}
