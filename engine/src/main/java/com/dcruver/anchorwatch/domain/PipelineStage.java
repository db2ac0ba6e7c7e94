package com.dcruver.anchorwatch.domain;

/**
 * Lifecycle stages of a document, in order. Each maps to one timestamp column.
 */
public enum PipelineStage {
    INGESTED("ingested_at", false),
    INDEXED("indexed_at", false),
    MATCHED("matched_at", false),

    /**
     * Records the latest classifier batch that touched the document, so it may move forward
     */
    ENRICHED("enriched_at", true);

    private final String column;
    private final boolean advancesOnRevisit;

    PipelineStage(String column, boolean advancesOnRevisit) {
        this.column = column;
        this.advancesOnRevisit = advancesOnRevisit;
    }

    public String getColumn() {
        return column;
    }

    public boolean isAdvancesOnRevisit() {
        return advancesOnRevisit;
    }

    public PipelineStage predecessor() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }
}
