package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.PipelineRun.RunStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * What one orchestrated run did, step by step.
 */
@Data
@Builder
public class PipelineRunResult {
    private final long runId;
    private final RunStatus status;
    private final List<StepResult> steps;
    private final String message;

    // Another run held the lock, nothing was attempted
    private final boolean skipped;

    public int total(ToIntFunction<StepResult> counter) {
        return steps.stream().mapToInt(counter).sum();
    }
}
