package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembersRefreshResult {

    private boolean ok;

    private int memberCount;

    // 拉取的成员列表与缓存一致、未写入时为 false
    private boolean changed;
}
