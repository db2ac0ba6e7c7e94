package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.PipelineRun.RunStatus;
import com.dcruver.anchorwatch.store.PipelineRunLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs statistics refresh, matching and enrichment in sequence and records the run.
 *
 * A failed batch rolls back on its own; the orchestrator just marks the run as failed
 * and stops, leaving the untouched frontier to the next scheduled run.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    private final ThresholdStatisticsService statisticsService;
    private final SimilarityMatcher matcher;
    private final List<PipelineStep> steps;
    private final PipelineRunLog runLog;
    private final ReentrantLock runLock = new ReentrantLock();

    public PipelineOrchestrator(ThresholdStatisticsService statisticsService,
                                SimilarityMatcher matcher,
                                TieredEnrichmentClassifier classifier,
                                PipelineRunLog runLog) {
        this.statisticsService = statisticsService;
        this.matcher = matcher;
        this.steps = List.of(matcher, classifier);
        this.runLog = runLog;
    }

    @Scheduled(cron = "${anchorwatch.pipeline.cron:-}")
    public void scheduledRun() {
        PipelineRunResult result = run();
        if (!result.isSkipped()) {
            log.info("Scheduled pipeline run {} finished: {}", result.getRunId(), result.getStatus());
        }
    }

    public PipelineRunResult run() {
        return exclusively("pipeline run", this::runSteps)
            .orElseGet(() -> PipelineRunResult.builder()
                .status(RunStatus.RUNNING)
                .steps(List.of())
                .message("Another run is in progress")
                .skipped(true)
                .build());
    }

    /**
     * Runs {@code work} under the pipeline lock, so manual steps and resets never
     * interleave with a scheduled run. Empty when the lock is already held.
     */
    public <T> Optional<T> exclusively(String operation, Supplier<T> work) {
        if (!runLock.tryLock()) {
            log.warn("Pipeline busy, skipping {}", operation);
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(work.get());
        } finally {
            runLock.unlock();
        }
    }

    private PipelineRunResult runSteps() {
        long runId = runLog.start();
        List<StepResult> results = new ArrayList<>();
        RunStatus status = RunStatus.FAILURE;
        String message;

        try {
            statisticsService.refresh();

            for (PipelineStep step : steps) {
                if (!step.canExecute()) {
                    log.info("Step {} has no pending work", step.getName());
                    results.add(StepResult.empty(step.getName(), "Nothing to do"));
                    continue;
                }
                log.info("Running step {}: {}", step.getName(), step.getDescription());
                StepResult result = step.execute();
                log.info("Step {}: {}", step.getName(), result.getMessage());
                results.add(result);
            }

            status = RunStatus.SUCCESS;
            message = "Pipeline completed";
        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed; unfinished batches will be retried next run", runId, e);
            message = "Pipeline failed: " + e.getMessage();
        }

        PipelineRunResult result = PipelineRunResult.builder()
            .runId(runId)
            .status(status)
            .steps(List.copyOf(results))
            .message(message)
            .build();

        runLog.finish(runId, status,
            matchedDocuments(results),
            result.total(StepResult::getLinksWritten),
            result.total(StepResult::getLinksClassified),
            result.total(StepResult::getOrgHighlights));

        return result;
    }

    private int matchedDocuments(List<StepResult> results) {
        return results.stream()
            .filter(r -> matcher.getName().equals(r.getStepName()))
            .mapToInt(StepResult::getDocumentsProcessed)
            .sum();
    }
}
