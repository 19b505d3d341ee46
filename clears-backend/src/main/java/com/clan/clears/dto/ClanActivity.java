package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 至少两名成员共同完成的活动实例。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClanActivity {

    private String instanceId;

    private Instant period;

    private long activityGroupId;

    private long activityHash;

    private List<String> membershipIds = new ArrayList<>();
}
