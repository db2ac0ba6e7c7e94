package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.SourceTier;
import com.dcruver.anchorwatch.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdStatisticsServiceTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;
    private long anchor;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.properties.getStatistics().setMinSamples(3);
        anchor = fixture.anchor("Statistics", new double[]{1, 0});
    }

    @Test
    void testMeanAndSampleStandardDeviationPerTier() {
        scores("Government", 0.2, 0.3, 0.4);
        scores("Think Tank", 0.9, 0.9, 0.9);

        ThresholdSnapshot snapshot = fixture.statisticsService.refresh();

        ThresholdStatistics government = snapshot.statisticsFor(anchor, SourceTier.TIER_2_MEAN).orElseThrow();
        assertEquals(3, government.getSampleCount());
        assertEquals(0.3, government.getMean(), 1e-9);
        assertEquals(0.1, government.getStddev(), 1e-9);
        assertFalse(government.isFallback());

        ThresholdStatistics research = snapshot.statisticsFor(anchor, SourceTier.TIER_1_FIXED).orElseThrow();
        assertEquals(0.9, research.getMean(), 1e-9);
        assertEquals(0.0, research.getStddev(), 1e-9);
    }

    @Test
    void testThresholdPerTierPolicy() {
        scores("Government", 0.2, 0.3, 0.4);
        scores("News Media", 0.2, 0.3, 0.4);

        ThresholdSnapshot snapshot = fixture.statisticsService.refresh();

        assertEquals(0.20, snapshot.thresholdFor(anchor, SourceTier.TIER_1_FIXED), 1e-12);
        assertEquals(0.3, snapshot.thresholdFor(anchor, SourceTier.TIER_2_MEAN), 1e-9);
        assertEquals(0.4, snapshot.thresholdFor(anchor, SourceTier.TIER_3_STRICT), 1e-9);
    }

    @Test
    void testTooFewSamplesFallBackToDefault() {
        scores("Government", 0.9, 0.9);

        ThresholdSnapshot snapshot = fixture.statisticsService.refresh();

        assertTrue(snapshot.statisticsFor(anchor, SourceTier.TIER_2_MEAN).orElseThrow().isFallback());
        assertEquals(0.35, snapshot.thresholdFor(anchor, SourceTier.TIER_2_MEAN), 1e-12);
        assertEquals(0.35, snapshot.thresholdFor(anchor, SourceTier.TIER_3_STRICT), 1e-12);
        assertEquals(0.35, snapshot.thresholdFor(999L, SourceTier.TIER_2_MEAN), 1e-12);
    }

    @Test
    void testScoresOutsideWindowAreIgnored() {
        Instant old = Instant.now().minus(Duration.ofDays(45));
        for (double score : new double[]{0.9, 0.9, 0.9}) {
            fixture.link(fixture.matchedDocument("Government"), anchor, score, old);
        }
        scores("Government", 0.1, 0.2, 0.3);

        ThresholdStatistics stats = fixture.statisticsService.refresh()
            .statisticsFor(anchor, SourceTier.TIER_2_MEAN).orElseThrow();

        assertEquals(3, stats.getSampleCount());
        assertEquals(0.2, stats.getMean(), 1e-9);
    }

    @Test
    void testInactiveAnchorsAreLeftOut() {
        scores("Government", 0.2, 0.3, 0.4);
        fixture.anchorStore.setActive(anchor, false);

        assertEquals(0, fixture.statisticsService.refresh().size());
    }

    @Test
    void testSingleSampleHasNoSpread() {
        ThresholdStatistics stats = ThresholdStatisticsService.summarize(
            new ThresholdSnapshot.Key(1L, SourceTier.TIER_3_STRICT), List.of(0.42), 5);

        assertEquals(0.42, stats.getMean(), 1e-12);
        assertEquals(0.0, stats.getStddev());
        assertTrue(stats.isFallback());
    }

    @Test
    void testCurrentComputesOnceAndKeepsSnapshotUntilRefresh() {
        ThresholdSnapshot first = fixture.statisticsService.current();
        scores("Government", 0.2, 0.3, 0.4);

        assertSame(first, fixture.statisticsService.current());
        assertEquals(0, first.size());

        ThresholdSnapshot refreshed = fixture.statisticsService.refresh();
        assertSame(refreshed, fixture.statisticsService.current());
        assertEquals(1, refreshed.size());
    }

    private void scores(String category, double... values) {
        for (double value : values) {
            fixture.link(fixture.matchedDocument(category), anchor, value);
        }
    }
}
