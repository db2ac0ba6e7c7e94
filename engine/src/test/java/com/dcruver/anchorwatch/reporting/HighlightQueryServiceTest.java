package com.dcruver.anchorwatch.reporting;

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

class HighlightQueryServiceTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;
    private HighlightQueryService service;
    private long anchor;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        service = new HighlightQueryService(fixture.dataSource);
        anchor = fixture.anchor("Reported", new double[]{1, 0});
    }

    @Test
    void testReturnsClassifiedLinksInWindowWithContext() {
        long strong = fixture.matchedDocument("Think Tank");
        long weak = fixture.matchedDocument("Academic");
        fixture.link(strong, anchor, 0.8);
        fixture.link(weak, anchor, 0.1);
        fixture.classifier().runAll();

        List<HighlightRecord> records = service.highlights(Instant.now().minus(Duration.ofHours(1)), Instant.now().plusSeconds(1));

        assertEquals(2, records.size());
        HighlightRecord highlight = records.stream().filter(r -> r.getDocumentId() == strong).findFirst().orElseThrow();
        assertTrue(highlight.isAnchorHighlight());
        assertEquals(Boolean.TRUE, highlight.getOrgHighlight());
        assertEquals("Reported", highlight.getAnchorName());
        assertEquals("Think Tank", highlight.getCategory());
        assertEquals(SourceTier.TIER_1_FIXED, highlight.getTier());
        assertEquals(0.8, highlight.getScore(), 1e-12);

        List<HighlightRecord> onlyHighlights = service.anchorHighlights(Instant.now().minus(Duration.ofHours(1)), Instant.now().plusSeconds(1));
        assertEquals(1, onlyHighlights.size());
        assertEquals(strong, onlyHighlights.get(0).getDocumentId());
    }

    @Test
    void testUnclassifiedAndOutOfWindowLinksAreHidden() {
        Instant now = Instant.now();
        long old = fixture.matchedDocument("Think Tank");
        fixture.link(old, anchor, 0.9, now.minus(Duration.ofDays(10)));
        fixture.classifier().runAll();
        long pending = fixture.matchedDocument("Think Tank");
        fixture.link(pending, anchor, 0.9, now);

        List<HighlightRecord> records = service.highlights(now.minus(Duration.ofDays(1)), now.plusSeconds(1));

        assertTrue(records.isEmpty());
        assertEquals(1, service.highlights(now.minus(Duration.ofDays(11)), now.minus(Duration.ofDays(9))).size());
    }

    @Test
    void testEmptyWindowIsRejected() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> service.highlights(now, now));
    }
}
