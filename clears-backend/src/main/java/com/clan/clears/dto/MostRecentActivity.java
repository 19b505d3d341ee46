package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个成员最近一次完成的受追踪活动实例。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MostRecentActivity {

    private String instanceId;

    private Instant period;

    private long activityGroupId;

    // 上游返回的原始变体编号
    private long activityHash;

    private String characterId;
}
