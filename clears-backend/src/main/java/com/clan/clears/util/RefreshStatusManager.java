package com.clan.clears.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 刷新状态管理器：记录统计刷新与成员刷新是否正在进行。
 * 由 ClanSnapshotActor 写入，ClanStatsServiceImpl 读取后标注在接口返回中。
 */
@Component
public class RefreshStatusManager {

    private static final Logger log = LoggerFactory.getLogger(RefreshStatusManager.class);

    // 使用volatile确保多线程可见性
    private volatile boolean statsRefreshInProgress = false;
    private volatile boolean membersRefreshInProgress = false;
    private volatile Instant statsRefreshStartedAt;

    public void setStatsRefreshInProgress(boolean inProgress, Instant at) {
        this.statsRefreshInProgress = inProgress;
        if (inProgress) {
            this.statsRefreshStartedAt = at;
        }
        log.info("统计刷新状态已更新为: {}", inProgress ? "进行中" : "已完成");
    }

    public void setMembersRefreshInProgress(boolean inProgress) {
        this.membersRefreshInProgress = inProgress;
        log.debug("成员刷新状态已更新为: {}", inProgress ? "进行中" : "已完成");
    }

    public boolean isStatsRefreshInProgress() {
        return statsRefreshInProgress;
    }

    public boolean isMembersRefreshInProgress() {
        return membersRefreshInProgress;
    }

    public Instant getStatsRefreshStartedAt() {
        return statsRefreshStartedAt;
    }
}
