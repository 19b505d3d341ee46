package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CounterResult {

    private int clears;

    private int specialClears;

    private Instant lastActivityAt;

    private MostRecentActivity mostRecentActivity;

    // 按规范分组合并后的计数
    private Map<Long, Integer> groupCounts = new TreeMap<>();
}
