package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 战队整体汇总。规范快照由快照协调者在一次事务中写入；
 * 部分快照在读取时由成员结果重建，从不持久化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClearsSnapshot {

    public static final String SOURCE_COORDINATOR = "coordinator";
    public static final String SOURCE_PARTIAL = "partial";

    private Instant fetchedAt;

    private String source;

    private int clears;

    private int specialClears;

    @Builder.Default
    private List<PerMemberResult> perMember = new ArrayList<>();

    private ClanActivity mostRecentClanActivity;

    private int memberCount;

    private int processedCount;
}
