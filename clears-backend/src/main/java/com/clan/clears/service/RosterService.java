package com.clan.clears.service;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.ClanMember;
import com.clan.clears.dto.MemberRoster;
import com.clan.clears.exception.UpstreamException;
import com.clan.clears.upstream.StatsApiClient;
import com.clan.clears.util.JsonPaths;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 拉取战队成员列表并补充展示信息。
 */
@Service
public class RosterService {

    private static final Logger log = LoggerFactory.getLogger(RosterService.class);

    private final StatsApiClient statsApiClient;
    private final ClearsProperties properties;

    public RosterService(StatsApiClient statsApiClient, ClearsProperties properties) {
        this.statsApiClient = statsApiClient;
        this.properties = properties;
    }

    /**
     * 配置战队的成员列表，能读取档案时附带徽标。
     */
    public List<ClanMember> fetchRoster() {
        String clanId = properties.getUpstream().getClanId();
        if (clanId == null || clanId.isBlank()) {
            throw new IllegalStateException("clears.upstream.clan-id is not configured");
        }
        List<ClanMember> members = new ArrayList<>();
        for (JsonNode result : statsApiClient.fetchClanRoster(clanId)) {
            ClanMember member = toMember(result);
            if (!member.getMembershipId().isEmpty()) {
                members.add(member);
            }
        }
        populateEmblems(members);
        log.info("已拉取战队 {} 的成员列表: {} 名成员", clanId, members.size());
        return members;
    }

    /**
     * 新列表与缓存在人数、在线人数、成员组成或任一成员在线状态上不同时为 true。
     */
    public static boolean materiallyChanged(MemberRoster cached, List<ClanMember> fresh) {
        if (cached == null || cached.getMembers() == null) {
            return true;
        }
        if (cached.getMembers().size() != fresh.size()) {
            return true;
        }
        long freshOnline = fresh.stream().filter(ClanMember::isOnline).count();
        if (cached.onlineCount() != freshOnline) {
            return true;
        }
        Map<String, ClanMember> previous = cached.getMembers().stream()
                .collect(Collectors.toMap(ClanMember::getMembershipId, Function.identity(), (a, b) -> a));
        for (ClanMember member : fresh) {
            ClanMember before = previous.get(member.getMembershipId());
            if (before == null || before.isOnline() != member.isOnline()) {
                return true;
            }
        }
        return false;
    }

    static ClanMember toMember(JsonNode result) {
        JsonNode destiny = result.path("destinyUserInfo");
        JsonNode bungie = result.path("bungieNetUserInfo");
        return ClanMember.builder()
                .membershipId(JsonPaths.firstText(result, "destinyUserInfo.membershipId",
                        "bungieNetUserInfo.membershipId").orElse(""))
                .membershipType(JsonPaths.firstLong(result, "destinyUserInfo.membershipType",
                        "bungieNetUserInfo.membershipType").orElse(0L).intValue())
                .displayName(JsonPaths.firstText(destiny, "bungieGlobalDisplayName", "displayName").orElse(null))
                .supplementalDisplayName(bungie.path("supplementalDisplayName").asText(""))
                .online(JsonPaths.firstFlag(result, "isOnline").orElse(false))
                .joinDate(JsonPaths.firstText(result, "joinDate").orElse(null))
                .memberType(JsonPaths.firstLong(result, "memberType").map(Long::intValue).orElse(null))
                .build();
    }

    private void populateEmblems(List<ClanMember> members) {
        int batchSize = Math.max(1, properties.getMembers().getEmblemBatchSize());
        long pauseMs = properties.getMembers().getEmblemBatchPause().toMillis();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0 && i % batchSize == 0 && pauseMs > 0) {
                try {
                    Thread.sleep(pauseMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("徽标补充在 {} 名成员后被中断", i);
                    return;
                }
            }
            ClanMember member = members.get(i);
            try {
                applyEmblem(member, statsApiClient.fetchProfile(member.getMembershipType(), member.getMembershipId()));
            } catch (UpstreamException e) {
                log.debug("成员 {} 没有徽标: {}", member.getMembershipId(), e.getMessage());
            }
        }
    }

    /**
     * 把最近游玩角色的徽标复制到成员上。
     */
    static void applyEmblem(ClanMember member, JsonNode profile) {
        JsonNode latest = null;
        String latestPlayed = "";
        Iterator<JsonNode> characters = profile.path("characters").path("data").elements();
        while (characters.hasNext()) {
            JsonNode character = characters.next();
            String played = character.path("dateLastPlayed").asText("");
            if (latest == null || played.compareTo(latestPlayed) > 0) {
                latest = character;
                latestPlayed = played;
            }
        }
        if (latest == null) {
            return;
        }
        member.setEmblemPath(JsonPaths.firstText(latest, "emblemPath").orElse(null));
        member.setEmblemBackgroundPath(JsonPaths.firstText(latest, "emblemBackgroundPath").orElse(null));
        member.setEmblemHash(JsonPaths.firstLong(latest, "emblemHash").orElse(null));
    }
}
