package com.clan.clears.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 成员批量刷新的进度日志，每推进 {@code updateInterval} 个百分点输出一次，并附带剩余时间估计。
 */
public class FanOutProgress {

    private static final Logger log = LoggerFactory.getLogger(FanOutProgress.class);

    private final String taskName;
    private final int totalSteps;
    private final int updateInterval;
    private final Clock clock;
    private final Instant startTime;
    private int currentStep;
    private int succeeded;
    private int lastReportedPercentage = -1;

    public FanOutProgress(String taskName, int totalSteps, Clock clock) {
        this(taskName, totalSteps, 10, clock);
    }

    public FanOutProgress(String taskName, int totalSteps, int updateInterval, Clock clock) {
        this.taskName = taskName;
        this.totalSteps = totalSteps > 0 ? totalSteps : 1;
        this.updateInterval = updateInterval;
        this.clock = clock;
        this.startTime = clock.instant();
        log.info("[{}] 开始，共 {} 名成员", taskName, totalSteps);
    }

    public void step(boolean success) {
        currentStep++;
        if (success) {
            succeeded++;
        }
        int percentage = percentage();
        if (percentage != lastReportedPercentage && (percentage % updateInterval == 0 || percentage == 100)) {
            log.info("[{}] {}/{} ({}%) | 预计剩余 ~{}", taskName, currentStep, totalSteps, percentage,
                    estimateRemaining(percentage));
            lastReportedPercentage = percentage;
        }
    }

    public void complete() {
        long duration = Duration.between(startTime, clock.instant()).toMillis();
        log.info("[{}] 完成：{}/{} 成功，耗时 {}ms", taskName, succeeded, totalSteps, duration);
    }

    private int percentage() {
        return Math.min(100, (int) ((currentStep * 100.0) / totalSteps));
    }

    private String estimateRemaining(int percentage) {
        if (percentage == 0) {
            return "?";
        }
        long elapsedMs = Duration.between(startTime, clock.instant()).toMillis();
        long remainingMs = (elapsedMs * 100) / percentage - elapsedMs;
        if (remainingMs < 1000) {
            return "<1s";
        } else if (remainingMs < 60000) {
            return (remainingMs / 1000) + "s";
        }
        return (remainingMs / 60000) + "m " + ((remainingMs % 60000) / 1000) + "s";
    }
}
