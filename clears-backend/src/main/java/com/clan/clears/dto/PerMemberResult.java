package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 成员任务一次成功执行的结果，每次执行整体覆盖。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerMemberResult {

    private String membershipId;

    private int membershipType;

    // 整个成员的任务为 null
    private String characterId;

    private int clears;

    private int specialClears;

    private Instant lastActivityAt;

    private MostRecentActivity mostRecentActivity;

    private Instant fetchedAt;
}
