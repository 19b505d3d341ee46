package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个活动实例的精简战后报告。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostGameReport {

    private String instanceId;

    private Instant period;

    private Long activityHash;

    private long activityDurationSeconds;

    private List<PgcrPlayer> players = new ArrayList<>();
}
