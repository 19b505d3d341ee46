package com.clan.clears.activity;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.CounterOptions;
import com.clan.clears.dto.CounterResult;
import com.clan.clears.dto.MostRecentActivity;
import com.clan.clears.exception.UpstreamException;
import com.clan.clears.upstream.StatsApiClient;
import com.clan.clears.util.JsonPaths;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 统计单个成员对受追踪活动的通关次数。
 *
 * <ol>
 *   <li>按模式过滤（先 {@code dungeon}，再 {@code story}，可选不过滤）逐页拉取每个角色的历史，
 *   按规范分组累计已完成记录。</li>
 *   <li>按规范分组汇总所有角色的聚合活动统计。</li>
 *   <li>逐组合并：{@code merged = max(paged, aggregate)}，聚合数据只会补足分页漏计。</li>
 *   <li>{@code clears = Σ merged}，{@code specialClears} 为特殊分组的 {@code Σ merged}。</li>
 * </ol>
 *
 * 无状态，相同的上游数据总是得到相同结果。
 */
@Component
public class ActivityCounter {

    private static final Logger log = LoggerFactory.getLogger(ActivityCounter.class);

    static final String[] AGGREGATE_REFERENCE_ID = {"activityHash", "referenceId"};
    static final String[] AGGREGATE_COMPLETIONS = {"values.activityCompletions.basic.value", "values.activityCompletions.value"};

    private final StatsApiClient statsApiClient;
    private final ActivityReferenceMap referenceMap;
    private final ClearsProperties properties;

    public ActivityCounter(StatsApiClient statsApiClient, ActivityReferenceMap referenceMap, ClearsProperties properties) {
        this.statsApiClient = statsApiClient;
        this.referenceMap = referenceMap;
        this.properties = properties;
    }

    public CounterResult count(String membershipId, int membershipType, List<String> characters, CounterOptions options) {
        CounterOptions opts = options == null ? CounterOptions.defaults() : options;
        int pageSize = positiveOr(opts.getPageSize(), properties.getUpstream().getPageSize());
        int maxPages = positiveOr(opts.getMaxPages(), properties.getUpstream().getMaxPages());

        Tally tally = new Tally();
        for (String characterId : characters) {
            for (ModeFilter mode : modes(opts)) {
                streamHistory(membershipId, membershipType, characterId, mode, pageSize, maxPages, tally);
            }
        }

        Map<Long, Integer> aggregate = new HashMap<>();
        for (String characterId : characters) {
            addAggregate(membershipId, membershipType, characterId, aggregate);
        }

        Map<Long, Integer> merged = merge(tally.paged, aggregate);
        int clears = 0;
        int specialClears = 0;
        for (Map.Entry<Long, Integer> entry : merged.entrySet()) {
            clears += entry.getValue();
            if (referenceMap.isSpecial(entry.getKey())) {
                specialClears += entry.getValue();
            }
        }

        log.debug("成员 {}: {} 次通关（特殊 {} 次），共 {} 个角色",
                membershipId, clears, specialClears, characters.size());
        return new CounterResult(clears, specialClears, tally.lastActivityAt, tally.mostRecent, merged);
    }

    /**
     * 两个来源逐组取最大值，只出现在一个来源中的分组保留该计数。
     */
    static Map<Long, Integer> merge(Map<Long, Integer> paged, Map<Long, Integer> aggregate) {
        Map<Long, Integer> merged = new TreeMap<>(paged);
        aggregate.forEach((group, count) -> merged.merge(group, count, Math::max));
        return merged;
    }

    private List<ModeFilter> modes(CounterOptions opts) {
        List<ModeFilter> modes = new ArrayList<>(List.of(ModeFilter.DUNGEON, ModeFilter.STORY));
        if (opts.isFetchAllActivities()) {
            modes.add(ModeFilter.ALL);
        }
        return modes;
    }

    private void streamHistory(String membershipId, int membershipType, String characterId, ModeFilter mode,
                               int pageSize, int maxPages, Tally tally) {
        for (int page = 0; page < maxPages; page++) {
            List<JsonNode> records;
            try {
                records = statsApiClient.fetchActivityPage(membershipType, membershipId, characterId, mode, page, pageSize);
            } catch (UpstreamException e) {
                log.warn("停止拉取 {} 模式下角色 {} 的历史，第 {} 页: {}", mode, characterId, page, e.getMessage());
                return;
            }
            if (records.isEmpty()) {
                return;
            }
            for (JsonNode record : records) {
                tally.accept(ActivityRecord.from(record), characterId);
            }
            if (records.size() < pageSize) {
                return;
            }
        }
        log.warn("{} 模式下角色 {} 的历史达到 {} 页上限", mode, characterId, maxPages);
    }

    private void addAggregate(String membershipId, int membershipType, String characterId, Map<Long, Integer> aggregate) {
        List<JsonNode> activities;
        try {
            activities = statsApiClient.fetchAggregateActivityStats(membershipType, membershipId, characterId);
        } catch (UpstreamException e) {
            log.warn("跳过角色 {} 的聚合统计: {}", characterId, e.getMessage());
            return;
        }
        for (JsonNode activity : activities) {
            JsonPaths.firstLong(activity, AGGREGATE_REFERENCE_ID)
                    .flatMap(referenceMap::resolve)
                    .ifPresent(group -> {
                        long completions = JsonPaths.firstLong(activity, AGGREGATE_COMPLETIONS).orElse(0L);
                        if (completions > 0) {
                            aggregate.merge(group.canonicalId(), (int) completions, Integer::sum);
                        }
                    });
        }
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private class Tally {

        private final Map<Long, Integer> paged = new HashMap<>();
        private Instant lastActivityAt;
        private MostRecentActivity mostRecent;

        void accept(ActivityRecord record, String characterId) {
            if (record.referenceId() == null || !record.completed()) {
                return;
            }
            ActivityGroup group = referenceMap.resolve(record.referenceId()).orElse(null);
            if (group == null) {
                return;
            }
            paged.merge(group.canonicalId(), 1, Integer::sum);

            Instant period = record.period();
            if (period != null && (lastActivityAt == null || period.isAfter(lastActivityAt))) {
                lastActivityAt = period;
            }
            // 严格更新：时间相同时保留先出现的记录
            if (record.isTraceable() && (mostRecent == null || period.isAfter(mostRecent.getPeriod()))) {
                mostRecent = new MostRecentActivity(record.instanceId(), period, group.canonicalId(),
                        record.referenceId(), characterId);
            }
        }
    }
}
