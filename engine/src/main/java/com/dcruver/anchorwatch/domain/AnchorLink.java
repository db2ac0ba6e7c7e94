package com.dcruver.anchorwatch.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * Scored association between one document and one anchor.
 * Highlight flags stay null until the classifier resolves them.
 */
@Data
@Builder
@With
public class AnchorLink {
    private final long id;
    private final long documentId;
    private final long anchorId;
    private final double score;
    private final Instant createdAt;
    private final Boolean anchorHighlight;
    private final Boolean orgHighlight;

    public boolean isResolved() {
        return anchorHighlight != null;
    }
}
