package com.clan.clears.service;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.PgcrPlayer;
import com.clan.clears.dto.PostGameReport;
import com.clan.clears.upstream.StatsApiClient;
import com.clan.clears.util.JsonPaths;
import com.clan.clears.util.StoreKeys;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
public class PgcrServiceImpl implements PgcrService {

    private static final Logger log = LoggerFactory.getLogger(PgcrServiceImpl.class);

    private static final Pattern INSTANCE_ID = Pattern.compile("\\d{1,20}");

    private final StatsApiClient statsApiClient;
    private final DurableStore store;
    private final ClearsProperties properties;

    @Override
    public PostGameReport getReport(String instanceId) {
        if (instanceId == null || !INSTANCE_ID.matcher(instanceId).matches()) {
            throw new IllegalArgumentException("instanceId must be numeric");
        }
        String key = StoreKeys.pgcr(instanceId);
        Optional<PostGameReport> cached = store.get(key, PostGameReport.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        PostGameReport report = reduce(instanceId, statsApiClient.fetchPostGameReport(instanceId));
        store.put(key, report, properties.getPgcr().getCacheTtl());
        log.debug("已缓存战后报告 {}，共 {} 名玩家", instanceId, report.getPlayers().size());
        return report;
    }

    static PostGameReport reduce(String instanceId, JsonNode response) {
        List<PgcrPlayer> players = new ArrayList<>();
        for (JsonNode entry : response.path("entries")) {
            JsonNode user = entry.path("player").path("destinyUserInfo");
            players.add(new PgcrPlayer(
                    user.path("membershipId").asText(null),
                    user.path("membershipType").asInt(0),
                    JsonPaths.firstText(user, "bungieGlobalDisplayName", "displayName").orElse(null),
                    entry.path("characterId").asText(null),
                    JsonPaths.firstFlag(entry, "values.completed.basic.value").orElse(false),
                    basic(entry, "timePlayedSeconds"),
                    (int) basic(entry, "kills"),
                    (int) basic(entry, "deaths"),
                    (int) basic(entry, "assists")));
        }

        long duration = JsonPaths.firstLong(response, "activityDetails.activityDurationSeconds").orElse(0L);
        if (duration == 0 && response.path("entries").size() > 0) {
            duration = basic(response.path("entries").get(0), "activityDurationSeconds");
        }
        return new PostGameReport(
                instanceId,
                JsonPaths.firstInstant(response, "period").orElse(null),
                JsonPaths.firstLong(response, "activityDetails.referenceId", "activityDetails.directorActivityHash")
                        .orElse(null),
                duration,
                players);
    }

    private static long basic(JsonNode entry, String stat) {
        return (long) entry.path("values").path(stat).path("basic").path("value").asDouble(0);
    }
}
