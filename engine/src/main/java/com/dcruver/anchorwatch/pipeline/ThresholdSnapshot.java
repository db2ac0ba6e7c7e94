package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.SourceTier;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of one statistics refresh, consumed by classifier runs until the
 * next refresh replaces it.
 */
@Data
@Builder
public class ThresholdSnapshot {
    private final Instant computedAt;
    private final Instant windowStart;
    private final Map<Key, ThresholdStatistics> statistics;
    private final double tier1FixedThreshold;
    private final double defaultThreshold;

    public Optional<ThresholdStatistics> statisticsFor(long anchorId, SourceTier tier) {
        return Optional.ofNullable(statistics.get(new Key(anchorId, tier)));
    }

    /**
     * Threshold a link score must reach (inclusive) to be an anchor highlight
     */
    public double thresholdFor(long anchorId, SourceTier tier) {
        if (tier == SourceTier.TIER_1_FIXED) {
            return tier1FixedThreshold;
        }

        Optional<ThresholdStatistics> stats = statisticsFor(anchorId, tier).filter(s -> !s.isFallback());
        if (stats.isEmpty()) {
            return defaultThreshold;
        }

        return switch (tier) {
            case TIER_2_MEAN -> stats.get().getMean();
            case TIER_3_STRICT -> stats.get().getMean() + stats.get().getStddev();
            default -> defaultThreshold;
        };
    }

    public int size() {
        return statistics.size();
    }

    public record Key(long anchorId, SourceTier tier) {}
}
