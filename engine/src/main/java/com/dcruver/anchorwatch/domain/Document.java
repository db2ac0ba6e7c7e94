package com.dcruver.anchorwatch.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * An ingested document and its position in the processing lifecycle.
 * Timestamps only ever move forward outside of an administrative reset.
 */
@Data
@Builder
@With
public class Document {
    private final long id;
    private final String sourceName;
    private final String category;
    private final String title;
    private final String link;

    // Lifecycle markers
    private final Instant ingestedAt;
    private final Instant indexedAt;
    private final Instant matchedAt;
    private final Instant enrichedAt;

    // Null until the classifier has looked at the document
    private final Boolean orgHighlight;

    public SourceTier getTier() {
        return SourceTier.forCategory(category);
    }

    public boolean hasReached(PipelineStage stage) {
        return switch (stage) {
            case INGESTED -> ingestedAt != null;
            case INDEXED -> indexedAt != null;
            case MATCHED -> matchedAt != null;
            case ENRICHED -> enrichedAt != null;
        };
    }

    /**
     * Each stage marker implies every earlier one
     */
    public boolean isLifecycleConsistent() {
        PipelineStage[] stages = PipelineStage.values();
        for (int i = stages.length - 1; i > 0; i--) {
            if (hasReached(stages[i]) && !hasReached(stages[i - 1])) {
                return false;
            }
        }
        return true;
    }
}
