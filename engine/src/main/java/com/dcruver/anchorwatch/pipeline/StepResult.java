package com.dcruver.anchorwatch.pipeline;

import lombok.Builder;
import lombok.Data;

/**
 * Counters reported by a pipeline step.
 */
@Data
@Builder(toBuilder = true)
public class StepResult {
    private final String stepName;
    private final boolean success;
    private final String message;

    private final int batches;
    private final int documentsProcessed;
    private final int documentsSkipped;

    // Matcher
    private final int linksWritten;
    private final int linksFiltered;

    // Classifier
    private final int linksClassified;
    private final int anchorHighlights;
    private final int orgHighlights;

    public static StepResult empty(String stepName, String message) {
        return StepResult.builder()
            .stepName(stepName)
            .success(true)
            .message(message)
            .build();
    }

    /**
     * Sum of the counters of this result and a later batch
     */
    public StepResult plus(StepResult other) {
        return toBuilder()
            .success(success && other.success)
            .batches(batches + other.batches)
            .documentsProcessed(documentsProcessed + other.documentsProcessed)
            .documentsSkipped(documentsSkipped + other.documentsSkipped)
            .linksWritten(linksWritten + other.linksWritten)
            .linksFiltered(linksFiltered + other.linksFiltered)
            .linksClassified(linksClassified + other.linksClassified)
            .anchorHighlights(anchorHighlights + other.anchorHighlights)
            .orgHighlights(orgHighlights + other.orgHighlights)
            .build();
    }
}
