package com.dcruver.anchorwatch.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void testLifecycleConsistency() {
        Instant now = Instant.now();
        Document indexed = Document.builder().id(1).ingestedAt(now).indexedAt(now).build();
        assertTrue(indexed.isLifecycleConsistent());
        assertTrue(indexed.hasReached(PipelineStage.INDEXED));
        assertFalse(indexed.hasReached(PipelineStage.MATCHED));

        Document enrichedButNeverMatched = indexed.withEnrichedAt(now);
        assertFalse(enrichedButNeverMatched.isLifecycleConsistent());
    }

    @Test
    void testTierFollowsCategory() {
        assertEquals(SourceTier.TIER_2_MEAN, Document.builder().category("Government").build().getTier());
    }

    @Test
    void testStagePredecessors() {
        assertNull(PipelineStage.INGESTED.predecessor());
        assertEquals(PipelineStage.MATCHED, PipelineStage.ENRICHED.predecessor());
        assertTrue(PipelineStage.ENRICHED.isAdvancesOnRevisit());
        assertFalse(PipelineStage.MATCHED.isAdvancesOnRevisit());
    }
}
