package com.dcruver.anchorwatch.config;

import com.dcruver.anchorwatch.domain.ChunkScoringPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for matching, statistics and classification.
 */
@ConfigurationProperties(prefix = "anchorwatch")
@Data
public class EngineProperties {

    /**
     * Output dimension of the embedding model; vectors of any other size are ignored
     */
    private int embeddingDimension = 768;

    private Matching matching = new Matching();
    private Statistics statistics = new Statistics();
    private Enrichment enrichment = new Enrichment();

    @Data
    public static class Matching {
        private int batchSize = 50;
        private ChunkScoringPolicy chunkPolicy = ChunkScoringPolicy.MAX;
        private int topK = 3;

        // Noisy categories must clear this score before a link is stored at all
        private double prefilterMinimum = 0.25;
        private List<String> noisyCategories = new ArrayList<>(List.of("News Media", "News & Media", "Misc. Research"));

        public boolean isNoisy(String category) {
            if (category == null) {
                return false;
            }
            return noisyCategories.stream().anyMatch(c -> c.equalsIgnoreCase(category.trim()));
        }
    }

    @Data
    public static class Statistics {
        private int windowDays = 30;
        private int minSamples = 5;
        private double defaultThreshold = 0.35;
    }

    @Data
    public static class Enrichment {
        private int batchSize = 50;
        private double tier1FixedThreshold = 0.20;
    }
}
