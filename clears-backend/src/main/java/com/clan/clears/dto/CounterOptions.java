package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次计数的参数。数值为 null 时使用配置的默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounterOptions {

    private Integer pageSize;

    private Integer maxPages;

    private boolean includeDeletedCharacters;

    // 在按模式过滤之后再追加一次不过滤的历史拉取
    private boolean fetchAllActivities;

    public static CounterOptions defaults() {
        return new CounterOptions();
    }
}
