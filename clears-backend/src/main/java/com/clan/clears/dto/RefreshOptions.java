package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshOptions {

    // 本次刷新覆盖的成员上限，null 表示全部成员
    private Integer userLimit;

    // 跳过最小刷新间隔
    private boolean force;

    private Integer pageSize;

    private Integer maxPages;

    private boolean includeDeletedCharacters;

    private boolean fetchAllActivities;

    public CounterOptions toCounterOptions() {
        return CounterOptions.builder()
                .pageSize(pageSize)
                .maxPages(maxPages)
                .includeDeletedCharacters(includeDeletedCharacters)
                .fetchAllActivities(fetchAllActivities)
                .build();
    }

    public RefreshOptions withUserLimit(Integer limit) {
        return new RefreshOptions(limit, force, pageSize, maxPages, includeDeletedCharacters, fetchAllActivities);
    }

    public RefreshOptions withForce(boolean forced) {
        return new RefreshOptions(userLimit, forced, pageSize, maxPages, includeDeletedCharacters, fetchAllActivities);
    }
}
