package com.clan.clears.util;

/**
 * 持久化存储的键格式。
 */
public final class StoreKeys {

    public static final String SNAPSHOT = "clears_snapshot";
    public static final String ROSTER = "members";
    public static final String COORDINATOR_STATE = "coordinator_state";
    public static final String JOB_PREFIX = "job:";
    public static final String RESULT_PREFIX = "member_clears:";
    public static final String PGCR_PREFIX = "pgcr:";

    private StoreKeys() {
    }

    public static String job(String membershipId, String characterId) {
        return scoped(JOB_PREFIX, membershipId, characterId);
    }

    public static String result(String membershipId, String characterId) {
        return scoped(RESULT_PREFIX, membershipId, characterId);
    }

    public static String pgcr(String instanceId) {
        return PGCR_PREFIX + instanceId;
    }

    /**
     * {@code key} 属于该成员时为 true，包括整个成员和单个角色的键。
     */
    public static boolean belongsTo(String key, String prefix, String membershipId) {
        String base = prefix + membershipId;
        return key.equals(base) || key.startsWith(base + ":");
    }

    private static String scoped(String prefix, String membershipId, String characterId) {
        return characterId == null ? prefix + membershipId : prefix + membershipId + ":" + characterId;
    }
}
