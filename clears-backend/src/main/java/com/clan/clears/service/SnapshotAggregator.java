package com.clan.clears.service;

import com.clan.clears.dto.ClanActivity;
import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.MostRecentActivity;
import com.clan.clears.dto.PerMemberResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把各成员结果汇总为战队快照。无副作用，规范快照和网关读取时重建的部分快照都使用它。
 */
@Component
public class SnapshotAggregator {

    public ClearsSnapshot aggregate(List<PerMemberResult> results, int memberCount, String source, Instant fetchedAt) {
        int clears = 0;
        int specialClears = 0;
        for (PerMemberResult result : results) {
            clears += result.getClears();
            specialClears += result.getSpecialClears();
        }
        return ClearsSnapshot.builder()
                .fetchedAt(fetchedAt)
                .source(source)
                .clears(clears)
                .specialClears(specialClears)
                .perMember(new ArrayList<>(results))
                .mostRecentClanActivity(mostRecentClanActivity(results))
                .memberCount(memberCount)
                .processedCount(results.size())
                .build();
    }

    /**
     * 至少两名不同成员共同完成的最新实例，没有时为 null。
     * 时间相同时取字典序最小的实例编号。
     */
    public ClanActivity mostRecentClanActivity(List<PerMemberResult> results) {
        Map<String, ClanActivity> byInstance = new LinkedHashMap<>();
        Map<String, Set<String>> membersByInstance = new LinkedHashMap<>();
        for (PerMemberResult result : results) {
            MostRecentActivity recent = result.getMostRecentActivity();
            if (recent == null || recent.getInstanceId() == null || recent.getPeriod() == null) {
                continue;
            }
            ClanActivity activity = byInstance.computeIfAbsent(recent.getInstanceId(), id ->
                    new ClanActivity(id, recent.getPeriod(), recent.getActivityGroupId(), recent.getActivityHash(),
                            new ArrayList<>()));
            if (recent.getPeriod().isAfter(activity.getPeriod())) {
                activity.setPeriod(recent.getPeriod());
            }
            membersByInstance.computeIfAbsent(recent.getInstanceId(), id -> new LinkedHashSet<>())
                    .add(result.getMembershipId());
        }

        byInstance.forEach((id, activity) -> activity.setMembershipIds(new ArrayList<>(membersByInstance.get(id))));
        return byInstance.values().stream()
                .filter(activity -> activity.getMembershipIds().size() >= 2)
                .min(Comparator.comparing(ClanActivity::getPeriod).reversed()
                        .thenComparing(ClanActivity::getInstanceId))
                .orElse(null);
    }
}
