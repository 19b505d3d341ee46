package com.clan.clears.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StoreKeysTest {

    @Test
    void memberAndCharacterScopedKeys() {
        assertThat(StoreKeys.job("m1", null)).isEqualTo("job:m1");
        assertThat(StoreKeys.job("m1", "c2")).isEqualTo("job:m1:c2");
        assertThat(StoreKeys.result("m1", null)).isEqualTo("member_clears:m1");
        assertThat(StoreKeys.pgcr("99")).isEqualTo("pgcr:99");
    }

    @Test
    void ownershipDoesNotLeakAcrossIdPrefixes() {
        assertThat(StoreKeys.belongsTo("job:12", StoreKeys.JOB_PREFIX, "12")).isTrue();
        assertThat(StoreKeys.belongsTo("job:12:c1", StoreKeys.JOB_PREFIX, "12")).isTrue();
        assertThat(StoreKeys.belongsTo("job:123", StoreKeys.JOB_PREFIX, "12")).isFalse();
    }
}
