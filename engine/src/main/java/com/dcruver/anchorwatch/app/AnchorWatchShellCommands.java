package com.dcruver.anchorwatch.app;

import com.dcruver.anchorwatch.admin.AdministrativeResetService;
import com.dcruver.anchorwatch.admin.AnchorAdminService;
import com.dcruver.anchorwatch.admin.ResetSummary;
import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.pipeline.PipelineOrchestrator;
import com.dcruver.anchorwatch.pipeline.PipelineStateTracker;
import com.dcruver.anchorwatch.pipeline.SimilarityMatcher;
import com.dcruver.anchorwatch.pipeline.ThresholdSnapshot;
import com.dcruver.anchorwatch.pipeline.ThresholdStatistics;
import com.dcruver.anchorwatch.pipeline.ThresholdStatisticsService;
import com.dcruver.anchorwatch.pipeline.TieredEnrichmentClassifier;
import com.dcruver.anchorwatch.reporting.HighlightQueryService;
import com.dcruver.anchorwatch.reporting.HighlightRecord;
import com.dcruver.anchorwatch.reporting.RunReportFormatter;
import com.dcruver.anchorwatch.store.DocumentStore;
import com.dcruver.anchorwatch.store.LinkStore;
import com.dcruver.anchorwatch.store.PipelineRunLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Spring Shell commands for operating the anchor-watch engine.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class AnchorWatchShellCommands {

    private static final String PIPELINE_BUSY = "A pipeline run is in progress; try again when it finishes.";

    private final PipelineOrchestrator orchestrator;
    private final SimilarityMatcher matcher;
    private final TieredEnrichmentClassifier classifier;
    private final ThresholdStatisticsService statisticsService;
    private final PipelineStateTracker stateTracker;
    private final AnchorAdminService anchorAdminService;
    private final AdministrativeResetService resetService;
    private final HighlightQueryService highlightQueryService;
    private final DocumentStore documentStore;
    private final LinkStore linkStore;
    private final PipelineRunLog runLog;
    private final RunReportFormatter reportFormatter;

    @ShellMethod(key = {"pipeline run", "run"}, value = "Refresh statistics, match and enrich in one run")
    public String runPipeline() {
        log.info("Running pipeline from shell...");

        try {
            return reportFormatter.format(orchestrator.run());
        } catch (Exception e) {
            log.error("Pipeline run failed", e);
            return "Pipeline run failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "match run", value = "Match unmatched documents against active anchors")
    public String runMatcher(
            @ShellOption(defaultValue = "false", help = "Process only one batch") boolean once) {
        try {
            return orchestrator.exclusively("matching", () -> once ? matcher.runOnce() : matcher.runAll())
                .map(reportFormatter::format)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Matching failed", e);
            return "Matching failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "enrich run", value = "Classify unresolved links with the current thresholds")
    public String runClassifier() {
        try {
            return orchestrator.exclusively("enrichment", classifier::runAll)
                .map(reportFormatter::format)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Enrichment failed", e);
            return "Enrichment failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats refresh", value = "Recompute threshold statistics now")
    public String refreshStatistics() {
        try {
            ThresholdSnapshot snapshot = statisticsService.refresh();
            return String.format("Computed statistics for %d anchor/tier combinations since %s",
                snapshot.size(), snapshot.getWindowStart());
        } catch (Exception e) {
            log.error("Statistics refresh failed", e);
            return "Statistics refresh failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats show", value = "Show the thresholds currently in use")
    public String showStatistics() {
        try {
            ThresholdSnapshot snapshot = statisticsService.current();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Snapshot computed %s (window from %s)\n", snapshot.getComputedAt(), snapshot.getWindowStart()));
            sb.append(String.format("Tier 1 fixed threshold: %.3f, fallback threshold: %.3f\n\n",
                snapshot.getTier1FixedThreshold(), snapshot.getDefaultThreshold()));

            List<ThresholdStatistics> rows = new ArrayList<>(snapshot.getStatistics().values());
            rows.sort(Comparator.comparingLong(ThresholdStatistics::getAnchorId)
                .thenComparing(ThresholdStatistics::getTier));
            for (ThresholdStatistics stats : rows) {
                sb.append(String.format("anchor %d  tier %d  n=%d  mean=%.3f  stddev=%.3f  threshold=%.3f%s\n",
                    stats.getAnchorId(), stats.getTier().getLevel(), stats.getSampleCount(),
                    stats.getMean(), stats.getStddev(),
                    snapshot.thresholdFor(stats.getAnchorId(), stats.getTier()),
                    stats.isFallback() ? "  (fallback)" : ""));
            }
            if (rows.isEmpty()) {
                sb.append("No scores in the window yet; every dynamic tier uses the fallback.\n");
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to show statistics", e);
            return "Failed to show statistics: " + e.getMessage();
        }
    }

    @ShellMethod(key = "anchors list", value = "List semantic anchors and their components")
    public String listAnchors(@ShellOption(defaultValue = "false", help = "Include deactivated anchors") boolean all) {
        try {
            List<Anchor> anchors = anchorAdminService.listAnchors(all);
            if (anchors.isEmpty()) {
                return all ? "No anchors defined." : "No active anchors.";
            }

            StringBuilder sb = new StringBuilder();
            for (Anchor anchor : anchors) {
                sb.append(String.format("[%d] %s%s%s\n", anchor.getId(), anchor.getName(),
                    anchor.getAuthor() != null ? " (by " + anchor.getAuthor() + ")" : "",
                    anchor.isActive() ? "" : " [inactive]"));
                if (anchor.getDescription() != null) {
                    sb.append("    ").append(anchor.getDescription()).append("\n");
                }
                for (AnchorComponent component : anchor.getComponents()) {
                    sb.append("    - ").append(component).append("\n");
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to list anchors", e);
            return "Failed to list anchors: " + e.getMessage();
        }
    }

    @ShellMethod(key = "anchors create", value = "Create an anchor from comma-separated components")
    public String createAnchor(
            @ShellOption(help = "Unique anchor name") String name,
            @ShellOption(defaultValue = ShellOption.NULL) String description,
            @ShellOption(defaultValue = ShellOption.NULL) String author,
            @ShellOption(defaultValue = "", help = "Tag names") String tags,
            @ShellOption(defaultValue = "", help = "Knowledge-base source locations") String kbItems,
            @ShellOption(defaultValue = "", help = "Program tags whose charter anchors this") String programs) {
        try {
            List<AnchorComponent> components = new ArrayList<>();
            components.addAll(parseComponents(ComponentType.TAG, tags));
            components.addAll(parseComponents(ComponentType.KB_ITEM, kbItems));
            components.addAll(parseComponents(ComponentType.PROGRAM, programs));

            Anchor anchor = anchorAdminService.createAnchor(name, description, author, components);
            return String.format("Created anchor %d '%s' with %d components", anchor.getId(), anchor.getName(),
                anchor.getComponents().size());
        } catch (Exception e) {
            log.error("Failed to create anchor '{}'", name, e);
            return "Failed to create anchor: " + e.getMessage();
        }
    }

    @ShellMethod(key = "anchors add-hypothetical", value = "Embed text and attach it to an anchor")
    public String addHypothetical(String anchor, String key, String text) {
        try {
            Anchor updated = anchorAdminService.addHypotheticalDocument(anchor, key, text);
            return String.format("Anchor '%s' now has %d components", updated.getName(), updated.getComponents().size());
        } catch (Exception e) {
            log.error("Failed to add hypothetical document to '{}'", anchor, e);
            return "Failed to add hypothetical document: " + e.getMessage();
        }
    }

    @ShellMethod(key = "anchors deactivate-all", value = "Deactivate every active anchor")
    public String deactivateAnchors() {
        try {
            return orchestrator.exclusively("anchor deactivation", resetService::deactivateAllAnchors)
                .map(ResetSummary::toString)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Failed to deactivate anchors", e);
            return "Failed to deactivate anchors: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reset analysis", value = "Delete links and send documents back to matching")
    public String resetAnalysis(
            @ShellOption(defaultValue = ShellOption.NULL, help = "Only this anchor's links") Long anchorId) {
        try {
            return orchestrator.exclusively("analysis reset",
                    () -> anchorId == null ? resetService.resetAnalysis() : resetService.resetAnalysisForAnchor(anchorId))
                .map(ResetSummary::toString)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Analysis reset failed", e);
            return "Analysis reset failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reset enrichment", value = "Clear enrichment for enriched documents by ascending id")
    public String resetEnrichment(
            @ShellOption(defaultValue = ShellOption.NULL) Integer limit,
            @ShellOption(defaultValue = "0") int offset) {
        try {
            return orchestrator.exclusively("enrichment reset", () -> resetService.resetEnrichment(limit, offset))
                .map(ResetSummary::toString)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Enrichment reset failed", e);
            return "Enrichment reset failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reset document", value = "Clear one document from a pipeline stage onwards")
    public String resetDocument(
            long id,
            @ShellOption(defaultValue = "MATCHED", help = "INDEXED, MATCHED or ENRICHED") String stage) {
        try {
            PipelineStage fromStage = PipelineStage.valueOf(stage.toUpperCase());
            return orchestrator.exclusively("document reset", () -> resetService.resetDocument(id, fromStage))
                .map(ResetSummary::toString)
                .orElse(PIPELINE_BUSY);
        } catch (Exception e) {
            log.error("Document reset failed", e);
            return "Document reset failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "highlights", value = "List classified links created in a date range")
    public String highlights(
            @ShellOption(defaultValue = ShellOption.NULL, help = "ISO date, defaults to 7 days ago") String from,
            @ShellOption(defaultValue = ShellOption.NULL, help = "ISO date (exclusive), defaults to now") String to,
            @ShellOption(defaultValue = "false", help = "Include links below threshold") boolean all) {
        try {
            Instant end = to == null ? Instant.now() : LocalDate.parse(to).atStartOfDay().toInstant(ZoneOffset.UTC);
            Instant start = from == null ? end.minus(7, ChronoUnit.DAYS)
                : LocalDate.parse(from).atStartOfDay().toInstant(ZoneOffset.UTC);

            List<HighlightRecord> records = all
                ? highlightQueryService.highlights(start, end)
                : highlightQueryService.anchorHighlights(start, end);
            if (records.isEmpty()) {
                return "No highlights between " + start + " and " + end;
            }

            StringBuilder sb = new StringBuilder();
            for (HighlightRecord record : records) {
                sb.append(String.format("%s %.3f  %-30s  %s [%s, tier %d]%s\n",
                    record.isAnchorHighlight() ? "*" : " ",
                    record.getScore(), record.getAnchorName(), record.getTitle(),
                    record.getSourceName(), record.getTier().getLevel(),
                    Boolean.TRUE.equals(record.getOrgHighlight()) ? "  ORG" : ""));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Highlight query failed", e);
            return "Highlight query failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "runs list", value = "Show recent pipeline runs")
    public String listRuns(@ShellOption(defaultValue = "10") int limit) {
        try {
            return reportFormatter.formatHistory(runLog.recent(limit));
        } catch (Exception e) {
            log.error("Failed to list runs", e);
            return "Failed to list runs: " + e.getMessage();
        }
    }

    @ShellMethod(key = "status", value = "Show pipeline frontier sizes and totals")
    public String status() {
        try {
            StringBuilder sb = new StringBuilder();
            sb.append("Pipeline status:\n");
            sb.append(String.format("- Awaiting matching: %d\n", stateTracker.frontierSize(PipelineStage.MATCHED)));
            sb.append(String.format("- Awaiting enrichment: %d\n", stateTracker.enrichmentFrontierSize()));
            sb.append(String.format("- Links: %d\n", linkStore.count()));
            sb.append(String.format("- Org highlights: %d\n", documentStore.countOrgHighlights()));
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to read status", e);
            return "Failed to read status: " + e.getMessage();
        }
    }

    private List<AnchorComponent> parseComponents(ComponentType type, String csv) {
        List<AnchorComponent> components = new ArrayList<>();
        for (String value : csv.split(",")) {
            if (!value.isBlank()) {
                components.add(AnchorComponent.of(type, value.strip()));
            }
        }
        return components;
    }
}
