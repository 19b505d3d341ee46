package com.clan.clears.actor;

import com.clan.clears.activity.ActivityCounter;
import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.JobState;
import com.clan.clears.service.DurableStore;
import com.clan.clears.upstream.StatsApiClient;
import com.clan.clears.util.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 按成员编号索引的 {@link MemberJobActor} 目录，每个成员一个实例，首次使用时创建。
 */
@Component
public class MemberJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(MemberJobRegistry.class);

    private final Map<String, MemberJobActor> actors = new ConcurrentHashMap<>();

    private final DurableStore store;
    private final ActivityCounter counter;
    private final StatsApiClient statsApiClient;
    private final TaskScheduler scheduler;
    private final Executor mailboxExecutor;
    private final Executor runnerExecutor;
    private final Clock clock;
    private final ClearsProperties properties;

    public MemberJobRegistry(DurableStore store,
                             ActivityCounter counter,
                             StatsApiClient statsApiClient,
                             TaskScheduler scheduler,
                             @Qualifier("mailboxExecutor") Executor mailboxExecutor,
                             @Qualifier("jobRunnerExecutor") Executor runnerExecutor,
                             Clock clock,
                             ClearsProperties properties) {
        this.store = store;
        this.counter = counter;
        this.statsApiClient = statsApiClient;
        this.scheduler = scheduler;
        this.mailboxExecutor = mailboxExecutor;
        this.runnerExecutor = runnerExecutor;
        this.clock = clock;
        this.properties = properties;
    }

    public MemberJobActor forMember(String membershipId) {
        return actors.computeIfAbsent(membershipId, id -> new MemberJobActor(id, mailboxExecutor, runnerExecutor,
                store, counter, statsApiClient, scheduler, clock, properties.getJobs()));
    }

    /**
     * 启动后为所有仍有未完成任务的成员设置闹钟，被重启中断的任务从检查点继续。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverUnfinishedJobs() {
        if (!properties.getJobs().isRecoverOnStartup()) {
            return;
        }
        Set<String> members = armUnfinished();
        if (!members.isEmpty()) {
            log.info("恢复 {} 名成员的未完成任务", members.size());
        }
    }

    /**
     * 定期巡检：租约已过期却没有闹钟的任务（例如执行线程因 Error 中止）在这里被重新触发。
     */
    @Scheduled(fixedDelayString = "${clears.jobs.sweep-interval:PT5M}",
            initialDelayString = "${clears.jobs.sweep-interval:PT5M}")
    public void sweepUnfinishedJobs() {
        Set<String> members = armUnfinished();
        log.debug("任务巡检为 {} 名成员设置闹钟", members.size());
    }

    private Set<String> armUnfinished() {
        Set<String> members = new LinkedHashSet<>();
        for (JobRecord job : store.list(StoreKeys.JOB_PREFIX, JobRecord.class)) {
            if (job.getState() != JobState.DONE) {
                members.add(job.getMembershipId());
            }
        }
        members.forEach(id -> forMember(id).scheduleAlarm(Duration.ZERO));
        return members;
    }
}
