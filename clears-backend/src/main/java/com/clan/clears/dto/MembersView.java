package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MembersView {

    private MemberRoster roster;

    // 首次拉取成员列表尚未完成
    private boolean loading;

    // 后台成员刷新进行中
    private boolean refreshing;
}
