package com.clan.clears.actor;

import com.clan.clears.activity.ActivityCounter;
import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.CounterOptions;
import com.clan.clears.dto.CounterResult;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.JobState;
import com.clan.clears.dto.PerMemberResult;
import com.clan.clears.service.DurableStore;
import com.clan.clears.upstream.StatsApiClient;
import com.clan.clears.util.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * 单个成员的持久化任务执行者。任务记录保存在存储中，每次状态迁移后都会重写
 * （{@code pending -> running -> done}，失败时 {@code running -> pending}），
 * 因此崩溃的任务在租约过期后会从角色检查点继续。
 *
 * <p>记录变更和租约的检查与获取都在本 actor 的邮箱中执行，计数本身在共享的执行线程池中运行。
 */
public class MemberJobActor {

    private static final Logger log = LoggerFactory.getLogger(MemberJobActor.class);

    private final String membershipId;
    private final ActorMailbox mailbox;
    private final DurableStore store;
    private final ActivityCounter counter;
    private final StatsApiClient statsApiClient;
    private final TaskScheduler scheduler;
    private final Executor runner;
    private final Clock clock;
    private final ClearsProperties.Jobs settings;

    private final Map<String, CompletableFuture<JobRecord>> waiters = new ConcurrentHashMap<>();
    private ScheduledFuture<?> pendingAlarm;

    public MemberJobActor(String membershipId, Executor mailboxExecutor, Executor runner, DurableStore store,
                          ActivityCounter counter, StatsApiClient statsApiClient, TaskScheduler scheduler,
                          Clock clock, ClearsProperties.Jobs settings) {
        this.membershipId = membershipId;
        this.mailbox = new ActorMailbox("member-" + membershipId, mailboxExecutor);
        this.runner = runner;
        this.store = store;
        this.counter = counter;
        this.statsApiClient = statsApiClient;
        this.scheduler = scheduler;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * 创建或加载任务，更新选项并在后台启动执行。立即返回，不等待执行结束。
     */
    public JobSubmission process(JobRequest request) {
        String key = StoreKeys.job(membershipId, request.characterId());
        JobRecord job = mailbox.call(() -> upsert(key, request));
        CompletableFuture<JobRecord> completion = waiters.computeIfAbsent(key, k -> new CompletableFuture<>());
        run(key);
        return new JobSubmission(key, job.getState(), completion);
    }

    /**
     * 该成员已持久化的全部任务。
     */
    public List<JobRecord> status() {
        return mailbox.call(this::loadJobs);
    }

    /**
     * 重新触发所有未完成且未被有效租约占用的任务。
     */
    public void alarm() {
        synchronized (this) {
            pendingAlarm = null;
        }
        Instant now = clock.instant();
        for (JobRecord job : mailbox.call(this::loadJobs)) {
            if (job.getState() == JobState.DONE || job.holdsLiveLease(now, settings.getLeaseTtl())) {
                continue;
            }
            if (job.getAttempts() >= settings.getMaxAttempts()) {
                log.debug("任务 {} 已尝试 {} 次，保持搁置", job.getKey(), job.getAttempts());
                continue;
            }
            run(job.getKey());
        }
    }

    public synchronized void scheduleAlarm(Duration delay) {
        if (pendingAlarm != null && !pendingAlarm.isDone()) {
            pendingAlarm.cancel(false);
        }
        pendingAlarm = scheduler.schedule(this::fireAlarm, clock.instant().plus(delay));
    }

    void run(String key) {
        try {
            runner.execute(() -> runOnce(key));
        } catch (TaskRejectedException e) {
            log.warn("执行线程池拒绝任务 {}，稍后重试", key);
            scheduleAlarm(settings.getRetryDelay());
        }
    }

    private void runOnce(String key) {
        Lease lease = mailbox.call(() -> acquire(key));
        if (!lease.acquired()) {
            if (lease.job() != null && lease.job().getState() == JobState.DONE) {
                completeWaiter(key, lease.job());
            }
            return;
        }

        JobRecord job = lease.job();
        try {
            List<String> characters = resolveCharacters(key, job);
            CounterResult counted = counter.count(membershipId, job.getMembershipType(), characters, job.getOptions());
            PerMemberResult result = PerMemberResult.builder()
                    .membershipId(membershipId)
                    .membershipType(job.getMembershipType())
                    .characterId(job.getCharacterId())
                    .clears(counted.getClears())
                    .specialClears(counted.getSpecialClears())
                    .lastActivityAt(counted.getLastActivityAt())
                    .mostRecentActivity(counted.getMostRecentActivity())
                    .fetchedAt(clock.instant())
                    .build();
            JobRecord done = mailbox.call(() -> complete(key, result));
            log.info("任务 {} 完成: {} 次通关，共 {} 个角色", key, result.getClears(), characters.size());
            completeWaiter(key, done);
        } catch (RuntimeException e) {
            handleFailure(key, e);
        } catch (Error e) {
            // 记录仍是 running，租约过期后由闹钟接管
            log.error("任务 {} 因 {} 中止，租约过期后继续", key, e.toString());
            scheduleAlarm(settings.getLeaseTtl());
            throw e;
        }
    }

    private List<String> resolveCharacters(String key, JobRecord job) {
        List<String> checkpoint = job.getProgress().getCharacters();
        if (checkpoint != null && !checkpoint.isEmpty()) {
            return checkpoint;
        }
        CounterOptions options = job.getOptions() == null ? CounterOptions.defaults() : job.getOptions();
        List<String> characters = job.getCharacterId() != null
                ? List.of(job.getCharacterId())
                : statsApiClient.fetchCharacterIds(job.getMembershipType(), membershipId,
                options.isIncludeDeletedCharacters());
        mailbox.call(() -> checkpoint(key, characters));
        return characters;
    }

    private void handleFailure(String key, RuntimeException cause) {
        log.warn("任务 {} 失败: {}", key, cause.getMessage());
        JobRecord failed;
        try {
            failed = mailbox.call(() -> markFailed(key, cause));
        } catch (RuntimeException persistError) {
            log.error("无法保存任务 {} 的失败状态", key, persistError);
            scheduleAlarm(settings.getRetryDelay());
            return;
        }
        if (failed.getAttempts() >= settings.getMaxAttempts()) {
            log.error("任务 {} 在 {} 次尝试后放弃", key, failed.getAttempts());
            CompletableFuture<JobRecord> waiter = waiters.remove(key);
            if (waiter != null) {
                waiter.completeExceptionally(cause);
            }
            return;
        }
        scheduleAlarm(settings.getRetryDelay());
    }

    private void fireAlarm() {
        try {
            alarm();
        } catch (RuntimeException e) {
            log.error("成员 {} 的闹钟执行失败，重新设置", membershipId, e);
            scheduleAlarm(settings.getRetryDelay());
        }
    }

    private void completeWaiter(String key, JobRecord job) {
        CompletableFuture<JobRecord> waiter = waiters.remove(key);
        if (waiter != null) {
            waiter.complete(job);
        }
    }

    // ---- 以下状态迁移只在邮箱中执行 ----

    private JobRecord upsert(String key, JobRequest request) {
        Instant now = clock.instant();
        JobRecord job = store.get(key, JobRecord.class).orElseGet(() -> JobRecord.builder()
                .key(key)
                .membershipId(membershipId)
                .characterId(request.characterId())
                .createdAt(now)
                .build());
        boolean busy = job.holdsLiveLease(now, settings.getLeaseTtl());

        job.setMembershipType(request.membershipType());
        job.setOptions(request.options());
        if (job.getState() == JobState.DONE) {
            job.setState(JobState.PENDING);
            job.setCompletedAt(null);
            job.getProgress().setCharacters(new ArrayList<>());
        }
        if (request.characters() != null && !request.characters().isEmpty() && !busy) {
            job.getProgress().setCharacters(new ArrayList<>(request.characters()));
        }
        if (!busy) {
            job.setAttempts(0);
        }
        job.setLastUpdatedAt(now);
        store.put(key, job);
        return job;
    }

    private Lease acquire(String key) {
        Instant now = clock.instant();
        JobRecord job = store.get(key, JobRecord.class).orElse(null);
        if (job == null || job.getState() == JobState.DONE) {
            return new Lease(job, false);
        }
        if (job.holdsLiveLease(now, settings.getLeaseTtl())) {
            log.debug("任务 {} 自 {} 起已在执行", key, job.getLockedAt());
            return new Lease(job, false);
        }
        job.setLockedAt(now);
        job.setState(JobState.RUNNING);
        job.setLastUpdatedAt(now);
        store.put(key, job);
        return new Lease(job, true);
    }

    private JobRecord checkpoint(String key, List<String> characters) {
        JobRecord job = load(key);
        job.getProgress().setCharacters(new ArrayList<>(characters));
        job.setLastUpdatedAt(clock.instant());
        store.put(key, job);
        return job;
    }

    private JobRecord complete(String key, PerMemberResult result) {
        Instant now = clock.instant();
        JobRecord job = load(key);
        job.setState(JobState.DONE);
        job.setResult(result);
        job.setError(null);
        job.setLockedAt(null);
        job.setCompletedAt(now);
        job.setLastUpdatedAt(now);

        Map<String, Object> writes = new LinkedHashMap<>();
        writes.put(StoreKeys.result(membershipId, job.getCharacterId()), result);
        writes.put(key, job);
        store.putAll(writes);
        return job;
    }

    private JobRecord markFailed(String key, RuntimeException cause) {
        JobRecord job = load(key);
        job.setState(JobState.PENDING);
        job.setError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        job.setAttempts(job.getAttempts() + 1);
        job.setLockedAt(null);
        job.setLastUpdatedAt(clock.instant());
        store.put(key, job);
        return job;
    }

    private List<JobRecord> loadJobs() {
        return store.list(StoreKeys.JOB_PREFIX + membershipId, JobRecord.class).stream()
                .filter(job -> membershipId.equals(job.getMembershipId()))
                .toList();
    }

    private JobRecord load(String key) {
        return store.get(key, JobRecord.class)
                .orElseThrow(() -> new IllegalStateException("No job record under " + key));
    }

    private record Lease(JobRecord job, boolean acquired) {
    }
}
