package com.dcruver.anchorwatch.admin;

import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.pipeline.PipelineStateTracker;
import com.dcruver.anchorwatch.store.AnchorStore;
import com.dcruver.anchorwatch.store.DocumentStore;
import com.dcruver.anchorwatch.store.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Operator resets. These are the only operations that move a document backwards
 * through the pipeline; each runs in its own transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdministrativeResetService {

    private final LinkStore linkStore;
    private final DocumentStore documentStore;
    private final AnchorStore anchorStore;
    private final PipelineStateTracker stateTracker;
    private final TransactionTemplate transactionTemplate;

    /**
     * Delete every link and send every matched document back to the matching frontier.
     */
    public ResetSummary resetAnalysis() {
        ResetSummary summary = transactionTemplate.execute(status -> ResetSummary.builder()
            .scope("analysis")
            .linksDeleted(linkStore.deleteAll())
            .documentsReset(stateTracker.resetAll(PipelineStage.MATCHED))
            .build());
        log.info("Reset analysis: {}", summary);
        return summary;
    }

    /**
     * Delete one anchor's links and rematch the documents it was linked to.
     * Their other links are kept but lose their flags. Rematching rescores each of them,
     * and drops the ones a noisy category no longer lets through the pre-filter.
     */
    public ResetSummary resetAnalysisForAnchor(long anchorId) {
        if (anchorStore.findById(anchorId).isEmpty()) {
            throw new IllegalArgumentException("No anchor with id " + anchorId);
        }

        ResetSummary summary = transactionTemplate.execute(status -> {
            List<Long> documentIds = linkStore.documentIdsForAnchor(anchorId);
            int deleted = linkStore.deleteByAnchor(anchorId);
            return ResetSummary.builder()
                .scope("analysis of anchor " + anchorId)
                .linksDeleted(deleted)
                .linksCleared(linkStore.clearFlagsForDocuments(documentIds))
                .documentsReset(stateTracker.reset(documentIds, PipelineStage.MATCHED))
                .build();
        });
        log.info("Reset analysis for anchor {}: {}", anchorId, summary);
        return summary;
    }

    /**
     * Clear enrichment for enriched documents taken in ascending id order.
     *
     * @param limit  maximum number of documents, or null for all of them
     * @param offset documents to skip before the first reset one
     */
    public ResetSummary resetEnrichment(Integer limit, int offset) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }

        ResetSummary summary = transactionTemplate.execute(status -> {
            List<Long> documentIds = stateTracker.enrichedDocumentIds(limit, offset);
            return ResetSummary.builder()
                .scope("enrichment")
                .linksCleared(linkStore.clearFlagsForDocuments(documentIds))
                .documentsReset(stateTracker.reset(documentIds, PipelineStage.ENRICHED))
                .build();
        });
        log.info("Reset enrichment (limit={}, offset={}): {}", limit, offset, summary);
        return summary;
    }

    /**
     * Clear one document from {@code fromStage} onwards. Resetting matching also
     * deletes its links; resetting enrichment only clears their flags.
     */
    public ResetSummary resetDocument(long documentId, PipelineStage fromStage) {
        if (documentStore.findById(documentId).isEmpty()) {
            throw new IllegalArgumentException("No document with id " + documentId);
        }
        if (fromStage == PipelineStage.INGESTED) {
            throw new IllegalArgumentException("Ingestion timestamps cannot be reset");
        }

        List<Long> ids = List.of(documentId);
        ResetSummary summary = transactionTemplate.execute(status -> {
            ResetSummary.ResetSummaryBuilder builder = ResetSummary.builder().scope("document " + documentId);
            if (fromStage == PipelineStage.ENRICHED) {
                builder.linksCleared(linkStore.clearFlagsForDocuments(ids));
            } else {
                builder.linksDeleted(linkStore.deleteByDocuments(ids));
            }
            return builder.documentsReset(stateTracker.reset(ids, fromStage)).build();
        });
        log.info("Reset document {} from {}: {}", documentId, fromStage, summary);
        return summary;
    }

    /**
     * Soft delete: anchors stay in the store with their links, but stop matching.
     */
    public ResetSummary deactivateAllAnchors() {
        ResetSummary summary = ResetSummary.builder()
            .scope("anchors")
            .anchorsDeactivated(anchorStore.deactivateAll())
            .build();
        log.info("Deactivated all anchors: {}", summary);
        return summary;
    }
}
