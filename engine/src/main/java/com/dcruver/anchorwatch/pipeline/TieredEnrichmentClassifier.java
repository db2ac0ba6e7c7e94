package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.config.EngineProperties;
import com.dcruver.anchorwatch.domain.AnchorLink;
import com.dcruver.anchorwatch.domain.Document;
import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.domain.SourceTier;
import com.dcruver.anchorwatch.store.DocumentStore;
import com.dcruver.anchorwatch.store.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves highlight flags on links using the threshold policy of each document's tier.
 *
 * Tier 1 sources use a fixed threshold, tier 2 the anchor's historical mean and tier 3
 * the mean plus one standard deviation. A score equal to the threshold is a highlight.
 * The document-level org highlight is true when any of the document's links is an
 * anchor highlight, and is recomputed over all of its links whenever one changes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TieredEnrichmentClassifier implements PipelineStep {

    private final LinkStore linkStore;
    private final DocumentStore documentStore;
    private final PipelineStateTracker stateTracker;
    private final ThresholdStatisticsService statisticsService;
    private final TransactionTemplate transactionTemplate;
    private final EngineProperties properties;

    @Override
    public String getName() {
        return "Enrich";
    }

    @Override
    public String getDescription() {
        return "Classify unresolved links as highlights using tiered thresholds";
    }

    @Override
    public boolean canExecute() {
        return stateTracker.enrichmentFrontierSize() > 0;
    }

    @Override
    public StepResult execute() {
        return runAll();
    }

    public StepResult runAll() {
        ThresholdSnapshot snapshot = statisticsService.current();
        int batchSize = properties.getEnrichment().getBatchSize();

        StepResult total = StepResult.empty(getName(), null);
        long cursor = 0L;

        while (true) {
            List<Document> batch = stateTracker.enrichmentFrontier(cursor, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            total = total.plus(classifyBatch(batch, snapshot));
            cursor = batch.get(batch.size() - 1).getId();
        }

        log.info("Enrichment finished: {} documents, {} links classified, {} anchor highlights, {} org highlights",
            total.getDocumentsProcessed(), total.getLinksClassified(),
            total.getAnchorHighlights(), total.getOrgHighlights());

        return total.toBuilder()
            .message(String.format("Classified %d links on %d documents: %d anchor highlights, %d org highlights",
                total.getLinksClassified(), total.getDocumentsProcessed(),
                total.getAnchorHighlights(), total.getOrgHighlights()))
            .build();
    }

    StepResult classifyBatch(List<Document> batch, ThresholdSnapshot snapshot) {
        Map<Long, Document> documents = batch.stream()
            .collect(Collectors.toMap(Document::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<AnchorLink> unresolved = linkStore.findUnresolvedForDocuments(documents.keySet());
        log.info("Classifying {} links across {} documents", unresolved.size(), documents.size());

        Map<Long, Boolean> decisions = new LinkedHashMap<>();
        for (AnchorLink link : unresolved) {
            Document document = documents.get(link.getDocumentId());
            SourceTier tier = document.getTier();
            double threshold = snapshot.thresholdFor(link.getAnchorId(), tier);
            boolean highlight = link.getScore() >= threshold;
            decisions.put(link.getId(), highlight);

            log.debug("Link {} (document {}, anchor {}, {}): score {} vs threshold {} -> {}",
                link.getId(), link.getDocumentId(), link.getAnchorId(), tier, link.getScore(), threshold, highlight);
        }

        Map<Long, Boolean> orgHighlights = aggregateOrgHighlights(documents.keySet(), decisions);

        Instant now = Instant.now();
        transactionTemplate.executeWithoutResult(status -> {
            linkStore.updateAnchorHighlights(decisions);
            documentStore.updateOrgHighlights(orgHighlights);
            linkStore.updateOrgHighlights(orgHighlights);
            stateTracker.advance(documents.keySet(), PipelineStage.ENRICHED, now);
        });

        int anchorHighlights = (int) decisions.values().stream().filter(Boolean::booleanValue).count();
        int orgCount = (int) orgHighlights.values().stream().filter(Boolean::booleanValue).count();

        return StepResult.builder()
            .stepName(getName())
            .success(true)
            .batches(1)
            .documentsProcessed(documents.size())
            .linksClassified(decisions.size())
            .anchorHighlights(anchorHighlights)
            .orgHighlights(orgCount)
            .build();
    }

    /**
     * Org highlight per document over all of its links, with this batch's decisions
     * taking precedence over what is stored
     */
    private Map<Long, Boolean> aggregateOrgHighlights(Iterable<Long> documentIds, Map<Long, Boolean> decisions) {
        Map<Long, Boolean> orgHighlights = new LinkedHashMap<>();
        documentIds.forEach(id -> orgHighlights.put(id, false));

        for (AnchorLink link : linkStore.findByDocuments(orgHighlights.keySet())) {
            Boolean flag = decisions.containsKey(link.getId()) ? decisions.get(link.getId()) : link.getAnchorHighlight();
            if (Boolean.TRUE.equals(flag)) {
                orgHighlights.put(link.getDocumentId(), true);
            }
        }
        return orgHighlights;
    }
}
