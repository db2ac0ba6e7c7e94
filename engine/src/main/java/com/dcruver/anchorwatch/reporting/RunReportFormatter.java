package com.dcruver.anchorwatch.reporting;

import com.dcruver.anchorwatch.domain.PipelineRun;
import com.dcruver.anchorwatch.pipeline.PipelineRunResult;
import com.dcruver.anchorwatch.pipeline.StepResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Renders pipeline runs as plain-text summaries for the shell and the log.
 */
@Component
public class RunReportFormatter {

    public String format(PipelineRunResult result) {
        if (result.isSkipped()) {
            return "Pipeline run skipped: " + result.getMessage() + "\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Pipeline run %d: %s\n\n", result.getRunId(), result.getStatus()));
        for (StepResult step : result.getSteps()) {
            sb.append(format(step));
        }

        sb.append("\nTotals:\n");
        sb.append(String.format("- Links written: %d\n", result.total(StepResult::getLinksWritten)));
        sb.append(String.format("- Links classified: %d\n", result.total(StepResult::getLinksClassified)));
        sb.append(String.format("- Anchor highlights: %d\n", result.total(StepResult::getAnchorHighlights)));
        sb.append(String.format("- Org highlights: %d\n", result.total(StepResult::getOrgHighlights)));

        if (result.getMessage() != null) {
            sb.append("\n").append(result.getMessage()).append("\n");
        }
        return sb.toString();
    }

    public String format(StepResult step) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s %s: %s\n", step.isSuccess() ? "✓" : "✗", step.getStepName(),
            step.getMessage() != null ? step.getMessage() : ""));

        if (step.getBatches() > 0) {
            sb.append(String.format("   %d batches, %d documents processed, %d skipped\n",
                step.getBatches(), step.getDocumentsProcessed(), step.getDocumentsSkipped()));
            if (step.getLinksWritten() > 0 || step.getLinksFiltered() > 0) {
                sb.append(String.format("   %d links written, %d filtered\n",
                    step.getLinksWritten(), step.getLinksFiltered()));
            }
            if (step.getLinksClassified() > 0) {
                sb.append(String.format("   %d links classified, %d anchor highlights, %d org highlights\n",
                    step.getLinksClassified(), step.getAnchorHighlights(), step.getOrgHighlights()));
            }
        }
        return sb.toString();
    }

    public String formatHistory(List<PipelineRun> runs) {
        if (runs.isEmpty()) {
            return "No pipeline runs recorded.\n";
        }

        StringBuilder sb = new StringBuilder();
        for (PipelineRun run : runs) {
            String duration = run.getEndedAt() == null ? "running"
                : Duration.between(run.getStartedAt(), run.getEndedAt()).toMillis() + " ms";
            sb.append(String.format("#%d %-8s %s (%s)  matched=%d links=%d classified=%d highlights=%d\n",
                run.getId(), run.getStatus(), run.getStartedAt(), duration,
                run.getDocumentsMatched(), run.getLinksWritten(),
                run.getLinksClassified(), run.getHighlightsFound()));
        }
        return sb.toString();
    }
}
