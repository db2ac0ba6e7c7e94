package com.dcruver.anchorwatch.store;

import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
import com.dcruver.anchorwatch.domain.PipelineRun;
import com.dcruver.anchorwatch.domain.PipelineRun.RunStatus;
import com.dcruver.anchorwatch.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnchorStoreTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;
    private AnchorStore anchors;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        anchors = fixture.anchorStore;
    }

    @Test
    void testInsertWithComponents() {
        long id = anchors.insert("AI Governance", "Policy work on AI", "analyst", List.of(
            AnchorComponent.of(ComponentType.TAG, "ai-policy"),
            AnchorComponent.of(ComponentType.PROGRAM, "AI-Gov")));

        Anchor anchor = anchors.findByName("AI Governance").orElseThrow();

        assertEquals(id, anchor.getId());
        assertTrue(anchor.isActive());
        assertEquals("analyst", anchor.getAuthor());
        assertEquals(2, anchor.getComponents().size());
        assertTrue(anchor.getComponents().contains(AnchorComponent.of(ComponentType.PROGRAM, "AI-Gov")));
    }

    @Test
    void testNamesAreUnique() {
        anchors.insert("Duplicate", null, null, List.of());

        assertThrows(DataAccessException.class, () -> anchors.insert("Duplicate", null, null, List.of()));
    }

    @Test
    void testAddingSameComponentTwiceKeepsOne() {
        long id = anchors.insert("Once", null, null, List.of(AnchorComponent.of(ComponentType.TAG, "t")));

        anchors.addComponent(id, AnchorComponent.of(ComponentType.TAG, "t"));

        assertEquals(1, anchors.findById(id).orElseThrow().getComponents().size());
    }

    @Test
    void testDeactivationIsSoft() {
        long first = anchors.insert("First", null, null, List.of());
        anchors.insert("Second", null, null, List.of());

        assertEquals(1, anchors.setActive(first, false));
        assertEquals(1, anchors.findActive().size());
        assertEquals(1, anchors.deactivateAll());

        assertTrue(anchors.findActive().isEmpty());
        assertEquals(2, anchors.findAll().size());
    }

    @Test
    void testRunLogRecordsLifecycle() {
        long runId = fixture.runLog.start();
        assertEquals(RunStatus.RUNNING, fixture.runLog.recent(1).get(0).getStatus());

        fixture.runLog.finish(runId, RunStatus.SUCCESS, 3, 5, 4, 2);

        PipelineRun run = fixture.runLog.recent(1).get(0);
        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(3, run.getDocumentsMatched());
        assertEquals(2, run.getHighlightsFound());
        assertNotNull(run.getEndedAt());
    }
}
