package com.dcruver.anchorwatch.reporting;

import com.dcruver.anchorwatch.domain.SourceTier;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One classified link with the document and anchor context delivery needs.
 */
@Data
@Builder
public class HighlightRecord {
    private final long linkId;
    private final long documentId;
    private final long anchorId;
    private final String anchorName;

    private final String title;
    private final String link;
    private final String sourceName;
    private final String category;
    private final SourceTier tier;

    private final double score;
    private final Instant createdAt;
    private final boolean anchorHighlight;

    // Null until the document-level decision has been written to the link
    private final Boolean orgHighlight;
}
