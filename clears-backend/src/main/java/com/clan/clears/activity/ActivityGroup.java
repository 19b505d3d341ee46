package com.clan.clears.activity;

import java.util.Set;

/**
 * 规范活动及计入它的所有上游变体编号。
 */
public record ActivityGroup(long canonicalId, String displayName, Set<Long> variantIds, boolean specialCategory) {

    public ActivityGroup {
        variantIds = Set.copyOf(variantIds);
    }
}
