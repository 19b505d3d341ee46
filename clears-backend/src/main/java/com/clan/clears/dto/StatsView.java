package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 统计接口的返回体：当前可用的最佳快照及刷新状态。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatsView {

    private ClearsSnapshot snapshot;

    private boolean refreshing;

    // 刷新请求被拒绝时的原因
    private String refreshRejectedReason;

    // 正在进行的刷新的开始时间
    private Instant refreshStartedAt;

    public StatsView(ClearsSnapshot snapshot, boolean refreshing, String refreshRejectedReason) {
        this.snapshot = snapshot;
        this.refreshing = refreshing;
        this.refreshRejectedReason = refreshRejectedReason;
    }
}
