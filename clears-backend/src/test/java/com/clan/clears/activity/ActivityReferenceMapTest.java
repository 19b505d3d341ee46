package com.clan.clears.activity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityReferenceMapTest {

    private final ActivityReferenceMap referenceMap = new ActivityReferenceMap();

    @Test
    @DisplayName("每个变体都映射到其规范分组")
    void resolvesVariantsToCanonicalGroup() {
        assertThat(referenceMap.resolve(4148187374L)).get()
                .extracting(ActivityGroup::canonicalId)
                .isEqualTo(ActivityReferenceMap.PROPHECY);
        assertThat(referenceMap.resolve(2716998124L)).get()
                .extracting(ActivityGroup::displayName)
                .isEqualTo("Ghosts of the Deep");
        assertThat(referenceMap.resolve(2032534090L)).get()
                .extracting(ActivityGroup::canonicalId)
                .isEqualTo(2032534090L);
    }

    @Test
    void unknownIdsAreUnmapped() {
        assertThat(referenceMap.resolve(12345L)).isEmpty();
    }

    @Test
    @DisplayName("只有预言属于特殊子类")
    void onlyProphecyIsSpecial() {
        assertThat(referenceMap.groups()).hasSize(10);
        assertThat(referenceMap.groups())
                .filteredOn(ActivityGroup::specialCategory)
                .extracting(ActivityGroup::canonicalId)
                .containsExactly(ActivityReferenceMap.PROPHECY);
        assertThat(referenceMap.isSpecial(ActivityReferenceMap.PROPHECY)).isTrue();
        assertThat(referenceMap.isSpecial(2582501063L)).isFalse();
        assertThat(referenceMap.isSpecial(715153594L)).isFalse();
    }

    @Test
    void variantsDoNotOverlapAcrossGroups() {
        Set<Long> seen = new HashSet<>();
        referenceMap.groups().forEach(group -> group.variantIds()
                .forEach(variant -> assertThat(seen.add(variant)).as("variant %d", variant).isTrue()));
        assertThat(seen).hasSize(35);
    }
}
