package com.clan.clears.activity;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 追踪的地牢静态表。每个变体编号（普通、大师、剧情、旧版条目）都映射到唯一的规范分组，计数始终按分组进行。
 */
@Component
public class ActivityReferenceMap {

    /** 预言的规范编号，唯一属于特殊子类的分组。 */
    public static final long PROPHECY = 1077850348L;

    private static final List<ActivityGroup> GROUPS = List.of(
            group(3834447244L, "Sundered Doctrine", false, 247869137L, 3834447244L, 3521648250L),
            group(300092127L, "Vesper's Host", false, 1915770060L, 300092127L, 4293676253L),
            group(2004855007L, "Warlord's Ruin", false, 2004855007L, 2534833093L),
            group(313828469L, "Ghosts of the Deep", false,
                    313828469L, 124340010L, 4190119662L, 1094262727L, 2961030534L, 2716998124L),
            group(1262462921L, "Spire of the Watcher", false,
                    1262462921L, 3339002067L, 1225969316L, 943878085L, 4046934917L, 2296818662L),
            group(2823159265L, "Duality", false, 2823159265L, 3012587626L, 1668217731L),
            group(4078656646L, "Grasp of Avarice", false, 4078656646L, 1112917203L, 3774021532L),
            group(PROPHECY, "Prophecy", true,
                    715153594L, 3637651331L, 1077850348L, 3193125350L, 1788465402L, 4148187374L),
            group(2582501063L, "Pit of Heresy", false, 2582501063L, 1375089621L),
            group(2032534090L, "The Shattered Throne", false, 2032534090L)
    );

    private final Map<Long, ActivityGroup> byVariant;
    private final Map<Long, ActivityGroup> byCanonical;

    public ActivityReferenceMap() {
        Map<Long, ActivityGroup> variants = new HashMap<>();
        Map<Long, ActivityGroup> canonical = new LinkedHashMap<>();
        for (ActivityGroup group : GROUPS) {
            canonical.put(group.canonicalId(), group);
            for (Long variant : group.variantIds()) {
                ActivityGroup previous = variants.putIfAbsent(variant, group);
                if (previous != null) {
                    throw new IllegalStateException("Variant " + variant + " mapped to both "
                            + previous.displayName() + " and " + group.displayName());
                }
            }
        }
        this.byVariant = Collections.unmodifiableMap(variants);
        this.byCanonical = Collections.unmodifiableMap(canonical);
    }

    public Optional<ActivityGroup> resolve(long variantId) {
        return Optional.ofNullable(byVariant.get(variantId));
    }

    public boolean isSpecial(long canonicalId) {
        ActivityGroup group = byCanonical.get(canonicalId);
        return group != null && group.specialCategory();
    }

    public List<ActivityGroup> groups() {
        return GROUPS;
    }

    private static ActivityGroup group(long canonicalId, String name, boolean special, Long... variants) {
        return new ActivityGroup(canonicalId, name, Set.of(variants), special);
    }
}
