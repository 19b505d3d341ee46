package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunUpdateResult {

    private String action;

    private boolean accepted;

    // 要求等待但刷新超出等待时间时为 false
    private boolean finished;

    private MembersRefreshResult members;

    private RefreshResult stats;
}
