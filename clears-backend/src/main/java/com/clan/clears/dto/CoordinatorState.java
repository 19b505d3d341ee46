package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorState {

    private Instant lastMembersFetchedAt;

    // 上次成功的统计刷新时间，用于限流
    private Instant lastStatsRefreshAt;

    private Instant lastStatsDispatchedAt;
}
