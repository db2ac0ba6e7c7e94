package com.dcruver.anchorwatch.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One on-topic passage in an otherwise unrelated document is the case the policies disagree on.
 */
class ChunkScoringPolicyTest {

    private static final double[] ONE_STRONG_PASSAGE = {0.1, 0.9, 0.2, 0.0};

    @Test
    void testMaxTakesBestChunk() {
        assertEquals(0.9, ChunkScoringPolicy.MAX.reduce(ONE_STRONG_PASSAGE, 3), 1e-9);
    }

    @Test
    void testMeanAveragesAllChunks() {
        assertEquals(0.3, ChunkScoringPolicy.MEAN.reduce(ONE_STRONG_PASSAGE, 3), 1e-9);
    }

    @Test
    void testTopKMeanAveragesBestChunks() {
        assertEquals((0.9 + 0.2 + 0.1) / 3, ChunkScoringPolicy.TOP_K_MEAN.reduce(ONE_STRONG_PASSAGE, 3), 1e-9);
        assertEquals(0.55, ChunkScoringPolicy.TOP_K_MEAN.reduce(ONE_STRONG_PASSAGE, 2), 1e-9);
    }

    @Test
    void testTopKLargerThanChunkCountUsesAllChunks() {
        assertEquals(0.5, ChunkScoringPolicy.TOP_K_MEAN.reduce(new double[]{0.4, 0.6}, 10), 1e-9);
    }

    @Test
    void testSingleChunkIsTheSameUnderEveryPolicy() {
        for (ChunkScoringPolicy policy : ChunkScoringPolicy.values()) {
            assertEquals(0.42, policy.reduce(new double[]{0.42}, 3), 1e-9, policy.name());
        }
    }

    @Test
    void testRejectsEmptyInputAndNonPositiveK() {
        assertThrows(IllegalArgumentException.class, () -> ChunkScoringPolicy.MAX.reduce(new double[0], 3));
        assertThrows(IllegalArgumentException.class, () -> ChunkScoringPolicy.TOP_K_MEAN.reduce(ONE_STRONG_PASSAGE, 0));
    }
}
