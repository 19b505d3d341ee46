package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 管理员刷新接口的请求体。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunUpdateRequest {

    public static final String ACTION_MEMBERS = "members";
    public static final String ACTION_STATS = "stats";
    public static final String ACTION_ALL = "all";

    private String action = ACTION_ALL;

    private boolean wait;

    private Long waitMs;

    private RefreshOptions opts;
}
