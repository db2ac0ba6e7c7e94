package com.dcruver.anchorwatch.pipeline;

/**
 * One stage the orchestrator can run against the persisted frontier.
 */
public interface PipelineStep {
    String getName();
    String getDescription();

    /**
     * Whether there is any work waiting for this step
     */
    boolean canExecute();

    /**
     * Process the whole frontier in batches
     */
    StepResult execute();
}
