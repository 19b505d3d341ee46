package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberRoster {

    private List<ClanMember> members = new ArrayList<>();

    private int memberCount;

    private Instant fetchedAt;

    public long onlineCount() {
        return members.stream().filter(ClanMember::isOnline).count();
    }
}
