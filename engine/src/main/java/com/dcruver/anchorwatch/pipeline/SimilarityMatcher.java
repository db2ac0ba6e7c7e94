package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.config.EngineProperties;
import com.dcruver.anchorwatch.domain.AnchorLink;
import com.dcruver.anchorwatch.domain.Document;
import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.nlp.EmbeddingResolver;
import com.dcruver.anchorwatch.nlp.VectorMath;
import com.dcruver.anchorwatch.store.AnchorStore;
import com.dcruver.anchorwatch.store.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores unmatched documents against every active anchor and stores the surviving links.
 *
 * Scoring happens before any write. Each batch then commits its links and its
 * matched_at markers in a single transaction, so a failure anywhere leaves the batch's
 * documents in the frontier for the next run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimilarityMatcher implements PipelineStep {

    private final AnchorStore anchorStore;
    private final AnchorCompositor compositor;
    private final EmbeddingResolver resolver;
    private final LinkStore linkStore;
    private final PipelineStateTracker stateTracker;
    private final TransactionTemplate transactionTemplate;
    private final EngineProperties properties;

    @Override
    public String getName() {
        return "Match";
    }

    @Override
    public String getDescription() {
        return "Link indexed documents to semantic anchors by cosine similarity";
    }

    @Override
    public boolean canExecute() {
        return stateTracker.frontierSize(PipelineStage.MATCHED) > 0;
    }

    @Override
    public StepResult execute() {
        return runAll();
    }

    /**
     * Walk the whole frontier once. Documents skipped for missing vectors stay
     * unmatched and are retried by the next invocation.
     */
    public StepResult runAll() {
        List<AnchorComposite> anchors = compositor.compositeAll(anchorStore.findActive());
        if (anchors.isEmpty()) {
            log.warn("No active anchors with resolvable components; leaving documents unmatched");
            return StepResult.empty(getName(), "No composable anchors");
        }

        int batchSize = properties.getMatching().getBatchSize();
        StepResult total = StepResult.empty(getName(), null);
        long cursor = 0L;

        while (true) {
            List<Document> batch = stateTracker.frontierFor(PipelineStage.MATCHED, cursor, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            total = total.plus(matchBatch(batch, anchors));
            cursor = batch.get(batch.size() - 1).getId();
        }

        log.info("Matching finished: {} documents matched, {} skipped, {} links written, {} filtered",
            total.getDocumentsProcessed(), total.getDocumentsSkipped(),
            total.getLinksWritten(), total.getLinksFiltered());

        return total.toBuilder()
            .message(String.format("Matched %d documents (%d skipped), wrote %d links",
                total.getDocumentsProcessed(), total.getDocumentsSkipped(), total.getLinksWritten()))
            .build();
    }

    /**
     * Process only the first batch of the frontier
     */
    public StepResult runOnce() {
        List<AnchorComposite> anchors = compositor.compositeAll(anchorStore.findActive());
        if (anchors.isEmpty()) {
            log.warn("No active anchors with resolvable components; leaving documents unmatched");
            return StepResult.empty(getName(), "No composable anchors");
        }

        List<Document> batch = stateTracker.frontierFor(PipelineStage.MATCHED, properties.getMatching().getBatchSize());
        if (batch.isEmpty()) {
            return StepResult.empty(getName(), "No unmatched documents");
        }
        return matchBatch(batch, anchors);
    }

    StepResult matchBatch(List<Document> batch, List<AnchorComposite> anchors) {
        log.info("Matching batch of {} documents against {} anchors", batch.size(), anchors.size());

        EngineProperties.Matching matching = properties.getMatching();
        Instant now = Instant.now();
        List<AnchorLink> links = new ArrayList<>();
        List<AnchorLink> dropped = new ArrayList<>();
        List<Long> matchedIds = new ArrayList<>();
        int skipped = 0;
        int filtered = 0;

        for (Document document : batch) {
            List<double[]> chunks = resolver.vectorsOf(document.getId());
            if (chunks.isEmpty()) {
                log.warn("No embeddings found for document {}, leaving it for the next run", document.getId());
                skipped++;
                continue;
            }

            List<AnchorLink> candidates = new ArrayList<>(anchors.size());
            List<AnchorLink> belowMinimum = new ArrayList<>();
            try {
                for (AnchorComposite anchor : anchors) {
                    double score = score(chunks, anchor.getVector());
                    log.debug("Document {} vs anchor '{}': {}", document.getId(), anchor.getAnchor().getName(), score);

                    AnchorLink link = AnchorLink.builder()
                        .documentId(document.getId())
                        .anchorId(anchor.getAnchor().getId())
                        .score(score)
                        .createdAt(now)
                        .build();
                    // A link kept from an earlier match must not outlive a score that now fails the pre-filter
                    if (matching.isNoisy(document.getCategory()) && score < matching.getPrefilterMinimum()) {
                        belowMinimum.add(link);
                    } else {
                        candidates.add(link);
                    }
                }
            } catch (IllegalArgumentException e) {
                log.error("Failed to score document {}, leaving it for the next run", document.getId(), e);
                skipped++;
                continue;
            }

            links.addAll(candidates);
            dropped.addAll(belowMinimum);
            filtered += belowMinimum.size();
            matchedIds.add(document.getId());
        }

        transactionTemplate.executeWithoutResult(status -> {
            linkStore.upsertAll(links);
            linkStore.deletePairs(dropped);
            stateTracker.advance(matchedIds, PipelineStage.MATCHED, now);
        });

        if (filtered > 0) {
            log.info("Skipped {} links below the {} pre-filter minimum for noisy categories",
                filtered, matching.getPrefilterMinimum());
        }

        return StepResult.builder()
            .stepName(getName())
            .success(true)
            .batches(1)
            .documentsProcessed(matchedIds.size())
            .documentsSkipped(skipped)
            .linksWritten(links.size())
            .linksFiltered(filtered)
            .build();
    }

    /**
     * One document-anchor score in [0, 1] from the document's chunk vectors
     */
    double score(List<double[]> chunks, double[] anchorVector) {
        double[] chunkScores = new double[chunks.size()];
        for (int i = 0; i < chunks.size(); i++) {
            chunkScores[i] = VectorMath.cosineSimilarity(chunks.get(i), anchorVector);
        }
        EngineProperties.Matching matching = properties.getMatching();
        return VectorMath.clampUnit(matching.getChunkPolicy().reduce(chunkScores, matching.getTopK()));
    }
}
