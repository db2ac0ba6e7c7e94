package com.dcruver.anchorwatch.domain;

import java.util.Arrays;

/**
 * How the similarity scores of a document's chunks collapse into one document score.
 */
public enum ChunkScoringPolicy {
    /**
     * Best matching chunk wins; a single on-topic passage is enough
     */
    MAX,

    /**
     * Average over all chunks; favors documents that are on-topic throughout
     */
    MEAN,

    /**
     * Average of the k best chunks
     */
    TOP_K_MEAN;

    public double reduce(double[] chunkScores, int k) {
        if (chunkScores == null || chunkScores.length == 0) {
            throw new IllegalArgumentException("At least one chunk score is required");
        }

        return switch (this) {
            case MAX -> Arrays.stream(chunkScores).max().getAsDouble();
            case MEAN -> Arrays.stream(chunkScores).average().getAsDouble();
            case TOP_K_MEAN -> {
                if (k < 1) {
                    throw new IllegalArgumentException("k must be positive: " + k);
                }
                double[] sorted = chunkScores.clone();
                Arrays.sort(sorted);
                int take = Math.min(k, sorted.length);
                double sum = 0.0;
                for (int i = sorted.length - take; i < sorted.length; i++) {
                    sum += sorted[i];
                }
                yield sum / take;
            }
        };
    }
}
