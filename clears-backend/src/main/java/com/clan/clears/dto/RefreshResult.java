package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统计刷新的结果。被拒绝时携带当前快照。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshResult {

    public static final String REASON_RATE_LIMITED = "rate_limited";

    private boolean ok;

    private String reason;

    private ClearsSnapshot snapshot;

    private ClearsSnapshot current;

    private Integer dispatched;

    private Integer completed;

    public static RefreshResult completed(ClearsSnapshot snapshot, int dispatched, int completed) {
        return new RefreshResult(true, null, snapshot, null, dispatched, completed);
    }

    public static RefreshResult rateLimited(ClearsSnapshot current) {
        return new RefreshResult(false, REASON_RATE_LIMITED, null, current, null, null);
    }

    @JsonIgnore
    public boolean isRateLimited() {
        return REASON_RATE_LIMITED.equals(reason);
    }
}
