package com.dcruver.anchorwatch.domain;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Threshold policy bucket derived from a document's source category.
 * The category map is fixed at build time.
 */
public enum SourceTier {
    /**
     * Curated research sources: a fixed similarity threshold
     */
    TIER_1_FIXED(1),

    /**
     * Government sources: the anchor's historical mean
     */
    TIER_2_MEAN(2),

    /**
     * High-volume sources: historical mean plus one standard deviation
     */
    TIER_3_STRICT(3);

    private static final Set<String> TIER_1_CATEGORIES = Set.of(
        "Think Tank", "AI Research", "Research Institute", "Non-Profit",
        "Academic", "Advocacy", "Publication", "Business Council"
    );
    private static final Set<String> TIER_2_CATEGORIES = Set.of("Government");
    private static final Set<String> TIER_3_CATEGORIES = Set.of(
        "News Media", "News & Media", "Misc. Research"
    );

    private static final Map<String, SourceTier> BY_CATEGORY = Stream.of(
            TIER_1_CATEGORIES.stream().map(c -> Map.entry(c, TIER_1_FIXED)),
            TIER_2_CATEGORIES.stream().map(c -> Map.entry(c, TIER_2_MEAN)),
            TIER_3_CATEGORIES.stream().map(c -> Map.entry(c, TIER_3_STRICT)))
        .flatMap(s -> s)
        .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue));

    private final int level;

    SourceTier(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Unknown or missing categories get the strictest policy.
     */
    public static SourceTier forCategory(String category) {
        if (category == null) {
            return TIER_3_STRICT;
        }
        return BY_CATEGORY.getOrDefault(normalize(category), TIER_3_STRICT);
    }

    public static SourceTier fromLevel(int level) {
        for (SourceTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier level: " + level);
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase();
    }
}
