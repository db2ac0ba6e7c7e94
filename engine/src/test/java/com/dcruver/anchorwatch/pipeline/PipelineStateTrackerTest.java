package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.Document;
import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineStateTrackerTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;
    private PipelineStateTracker tracker;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        tracker = fixture.stateTracker;
    }

    @Test
    void testMatchingFrontierNeedsIndexedDocuments() {
        fixture.documentStore.insert(Document.builder()
            .id(100)
            .category("Think Tank")
            .ingestedAt(Instant.now())
            .build());
        long indexed = fixture.indexedDocument("Think Tank", new double[]{1, 0});
        fixture.matchedDocument("Think Tank");

        List<Document> frontier = tracker.frontierFor(PipelineStage.MATCHED, 10);

        assertEquals(List.of(indexed), frontier.stream().map(Document::getId).toList());
        assertEquals(1, tracker.frontierSize(PipelineStage.MATCHED));
        assertEquals(1, tracker.frontierSize(PipelineStage.INDEXED));
    }

    @Test
    void testFrontierPagesByIdCursor() {
        long first = fixture.indexedDocument("Think Tank");
        long second = fixture.indexedDocument("Think Tank");
        long third = fixture.indexedDocument("Think Tank");

        assertEquals(List.of(first, second), ids(tracker.frontierFor(PipelineStage.MATCHED, 0L, 2)));
        assertEquals(List.of(third), ids(tracker.frontierFor(PipelineStage.MATCHED, second, 2)));
    }

    @Test
    void testIngestionHasNoFrontier() {
        assertThrows(IllegalArgumentException.class, () -> tracker.frontierFor(PipelineStage.INGESTED, 10));
    }

    @Test
    void testAdvanceIsIdempotent() {
        long doc = fixture.indexedDocument("Think Tank");
        Instant first = Instant.ofEpochMilli(1_700_000_000_000L);

        assertEquals(1, tracker.advance(doc, PipelineStage.MATCHED, first));
        assertEquals(0, tracker.advance(doc, PipelineStage.MATCHED, first.plusSeconds(60)));

        assertEquals(first, fixture.document(doc).getMatchedAt());
    }

    @Test
    void testAdvanceRequiresPreviousStage() {
        long doc = fixture.indexedDocument("Think Tank");

        assertEquals(0, tracker.advance(doc, PipelineStage.ENRICHED, Instant.now()));

        Document unchanged = fixture.document(doc);
        assertNull(unchanged.getEnrichedAt());
        assertTrue(unchanged.isLifecycleConsistent());
    }

    @Test
    void testEnrichedTimestampOnlyMovesForward() {
        long doc = fixture.matchedDocument("Think Tank");
        Instant first = Instant.ofEpochMilli(1_700_000_000_000L);

        tracker.advance(doc, PipelineStage.ENRICHED, first);
        assertEquals(1, tracker.advance(doc, PipelineStage.ENRICHED, first.plusSeconds(30)));
        assertEquals(0, tracker.advance(doc, PipelineStage.ENRICHED, first));

        assertEquals(first.plusSeconds(30), fixture.document(doc).getEnrichedAt());
    }

    @Test
    void testResetClearsLaterStagesAndHighlight() {
        long doc = fixture.matchedDocument("Think Tank");
        tracker.advance(doc, PipelineStage.ENRICHED, Instant.now());
        fixture.documentStore.updateOrgHighlights(Map.of(doc, true));

        assertEquals(1, tracker.reset(List.of(doc), PipelineStage.MATCHED));

        Document reset = fixture.document(doc);
        assertNotNull(reset.getIndexedAt());
        assertNull(reset.getMatchedAt());
        assertNull(reset.getEnrichedAt());
        assertNull(reset.getOrgHighlight());
        assertEquals(List.of(doc), ids(tracker.frontierFor(PipelineStage.MATCHED, 10)));
    }

    @Test
    void testIngestionCannotBeReset() {
        long doc = fixture.indexedDocument("Think Tank");

        assertThrows(IllegalArgumentException.class, () -> tracker.reset(List.of(doc), PipelineStage.INGESTED));
        assertThrows(IllegalArgumentException.class, () -> tracker.resetAll(PipelineStage.INGESTED));
    }

    @Test
    void testEnrichedDocumentIdsPaging() {
        for (int i = 0; i < 4; i++) {
            long doc = fixture.matchedDocument("Think Tank");
            tracker.advance(doc, PipelineStage.ENRICHED, Instant.now());
        }
        fixture.matchedDocument("Think Tank");

        assertEquals(List.of(1L, 2L, 3L, 4L), tracker.enrichedDocumentIds(null, 0));
        assertEquals(List.of(2L, 3L), tracker.enrichedDocumentIds(2, 1));
    }

    private List<Long> ids(List<Document> documents) {
        return documents.stream().map(Document::getId).toList();
    }
}
