package com.clan.clears.service;

import com.clan.clears.actor.ClanSnapshotActor;
import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.RefreshOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 定时触发：先后台刷新统计，稍后刷新成员列表。
 * 两者都不等待完成。
 */
@Component
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ClanSnapshotActor coordinator;
    private final TaskScheduler taskScheduler;
    private final ClearsProperties properties;
    private final Clock clock;

    public RefreshScheduler(ClanSnapshotActor coordinator, TaskScheduler taskScheduler,
                            ClearsProperties properties, Clock clock) {
        this.coordinator = coordinator;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${clears.schedule.cron}")
    public void trigger() {
        log.info("定时刷新已触发");
        coordinator.requestStatsRefresh(new RefreshOptions())
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("定时统计刷新失败", error);
                    } else if (!result.isOk()) {
                        log.info("定时统计刷新已跳过: {}", result.getReason());
                    }
                });
        taskScheduler.schedule(this::refreshMembers,
                clock.instant().plus(properties.getSchedule().getMembersStagger()));
    }

    private void refreshMembers() {
        coordinator.refreshMembers(false).whenComplete((result, error) -> {
            if (error != null) {
                log.error("定时成员刷新失败", error);
            }
        });
    }
}
