package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 成员列表中的一项，在一个刷新周期内不变。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClanMember {

    private String membershipId;

    private int membershipType;

    private String displayName;

    private String supplementalDisplayName;

    private boolean online;

    private String joinDate;

    private Integer memberType;

    // 最近游玩角色的展示信息
    private String emblemPath;

    private String emblemBackgroundPath;

    private Long emblemHash;
}
