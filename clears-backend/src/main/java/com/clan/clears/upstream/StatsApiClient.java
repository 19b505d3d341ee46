package com.clan.clears.upstream;

import com.clan.clears.activity.ModeFilter;
import com.clan.clears.exception.UpstreamException;
import com.clan.clears.util.JsonPaths;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 外部统计 API 的类型化访问。所有调用都经过 {@link RetryingFetcher}，
 * 终态失败以 {@link UpstreamException} 抛出。
 */
@Component
public class StatsApiClient {

    private static final Logger log = LoggerFactory.getLogger(StatsApiClient.class);

    private static final int SUCCESS_CODE = 1;

    private final RestClient restClient;
    private final RetryingFetcher fetcher;

    public StatsApiClient(@Qualifier("upstreamRestClient") RestClient restClient, RetryingFetcher fetcher) {
        this.restClient = restClient;
        this.fetcher = fetcher;
    }

    /**
     * 角色活动历史的一页。空列表表示没有更多记录。
     */
    public List<JsonNode> fetchActivityPage(int membershipType, String membershipId, String characterId,
                                            ModeFilter mode, int page, int pageSize) {
        String description = "activity page " + page + " (" + mode + ") of character " + characterId;
        JsonNode response;
        if (mode.getModeId() == null) {
            response = getResponse(description,
                    "/Destiny2/{type}/Account/{id}/Character/{characterId}/Stats/Activities/?count={count}&page={page}",
                    membershipType, membershipId, characterId, pageSize, page);
        } else {
            response = getResponse(description,
                    "/Destiny2/{type}/Account/{id}/Character/{characterId}/Stats/Activities/?count={count}&page={page}&mode={mode}",
                    membershipType, membershipId, characterId, pageSize, page, mode.getModeId());
        }
        return elements(JsonPaths.first(response, "activities", "data.activities").orElse(null));
    }

    /**
     * 单个角色每个活动变体的累计完成次数。
     */
    public List<JsonNode> fetchAggregateActivityStats(int membershipType, String membershipId, String characterId) {
        JsonNode response = getResponse("aggregate stats of character " + characterId,
                "/Destiny2/{type}/Account/{id}/Character/{characterId}/Stats/AggregateActivityStats/",
                membershipType, membershipId, characterId);
        return elements(response.get("activities"));
    }

    /**
     * 从账号统计接口读取角色编号，该接口失败或返回为空时改用档案接口。
     */
    public List<String> fetchCharacterIds(int membershipType, String membershipId, boolean includeDeleted) {
        try {
            JsonNode stats = getResponse("account stats of " + membershipId,
                    "/Destiny2/{type}/Account/{id}/Stats/", membershipType, membershipId);
            List<String> ids = new ArrayList<>();
            for (JsonNode character : elements(stats.get("characters"))) {
                boolean deleted = JsonPaths.firstFlag(character, "deleted").orElse(false);
                String id = character.path("characterId").asText("");
                if (!id.isEmpty() && (includeDeleted || !deleted)) {
                    ids.add(id);
                }
            }
            if (!ids.isEmpty()) {
                return ids;
            }
        } catch (UpstreamException e) {
            log.debug("成员 {} 的账号统计不可用，改用档案接口: {}", membershipId, e.getMessage());
        }
        return characterIdsFromProfile(fetchProfile(membershipType, membershipId), includeDeleted);
    }

    /**
     * 单个成员的档案与角色组件（100、200）。
     */
    public JsonNode fetchProfile(int membershipType, String membershipId) {
        return getResponse("profile of " + membershipId,
                "/Destiny2/{type}/Profile/{id}/?components=100,200", membershipType, membershipId);
    }

    public List<JsonNode> fetchClanRoster(String clanId) {
        JsonNode response = getResponse("roster of clan " + clanId, "/GroupV2/{clanId}/Members/", clanId);
        return elements(response.get("results"));
    }

    public JsonNode fetchPostGameReport(String instanceId) {
        return getResponse("post game report " + instanceId,
                "/Destiny2/Stats/PostGameCarnageReport/{instanceId}/", instanceId);
    }

    static List<String> characterIdsFromProfile(JsonNode profile, boolean includeDeleted) {
        JsonNode characters = profile.path("characters").path("data");
        List<String> candidates = new ArrayList<>();
        JsonNode listed = profile.path("profile").path("data").path("characterIds");
        if (listed.isArray() && listed.size() > 0) {
            listed.forEach(id -> candidates.add(id.asText()));
        } else if (characters.isObject()) {
            characters.fieldNames().forEachRemaining(candidates::add);
        }

        List<String> ids = new ArrayList<>();
        for (String id : candidates) {
            JsonNode character = characters.get(id);
            if (includeDeleted || character == null || !isRemoved(character)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static boolean isRemoved(JsonNode character) {
        return JsonPaths.firstFlag(character, "deleted").orElse(false)
                || JsonPaths.firstFlag(character, "removed").orElse(false)
                || JsonPaths.firstFlag(character, "deactivated").orElse(false);
    }

    private JsonNode getResponse(String description, String uriTemplate, Object... uriVariables) {
        JsonNode body = fetcher.execute(description, () -> restClient.get()
                .uri(uriTemplate, uriVariables)
                .retrieve()
                .body(JsonNode.class));
        if (body == null) {
            throw new UpstreamException(description + " returned no body", 200, false);
        }
        int errorCode = body.path("ErrorCode").asInt(SUCCESS_CODE);
        if (errorCode != SUCCESS_CODE) {
            throw new UpstreamException(description + " failed with " + body.path("ErrorStatus").asText("error "
                    + errorCode), 200, false);
        }
        JsonNode response = body.get("Response");
        if (response == null || response.isNull()) {
            throw new UpstreamException(description + " returned no Response", 200, false);
        }
        return response;
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            Iterator<JsonNode> it = array.elements();
            it.forEachRemaining(out::add);
        }
        return out;
    }
}
