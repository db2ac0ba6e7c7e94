package com.dcruver.anchorwatch.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One orchestrated pass over the matcher and classifier, as recorded in pipeline_runs.
 */
@Data
@Builder
public class PipelineRun {
    private final long id;
    private final Instant startedAt;
    private final Instant endedAt;
    private final RunStatus status;
    private final int documentsMatched;
    private final int linksWritten;
    private final int linksClassified;
    private final int highlightsFound;

    public enum RunStatus {
        RUNNING,
        SUCCESS,
        FAILURE
    }
}
