package com.dcruver.anchorwatch.admin;

import lombok.Builder;
import lombok.Data;

/**
 * Row counts touched by an administrative reset.
 */
@Data
@Builder
public class ResetSummary {
    private final String scope;
    private final int linksDeleted;
    private final int linksCleared;
    private final int documentsReset;
    private final int anchorsDeactivated;

    @Override
    public String toString() {
        return String.format("%s: %d links deleted, %d links cleared, %d documents reset, %d anchors deactivated",
            scope, linksDeleted, linksCleared, documentsReset, anchorsDeactivated);
    }
}
