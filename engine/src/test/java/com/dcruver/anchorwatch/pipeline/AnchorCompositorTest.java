package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
import com.dcruver.anchorwatch.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnchorCompositorTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.vectorStore.storeTagVector("x", new double[]{1, 0});
        fixture.vectorStore.storeTagVector("y", new double[]{0, 1});
    }

    @Test
    void testCompositeIsCentroidOfComponents() {
        AnchorComposite composite = fixture.compositor.composite(anchor(
            AnchorComponent.of(ComponentType.TAG, "x"),
            AnchorComponent.of(ComponentType.TAG, "y")));

        assertTrue(composite.isComposable());
        assertArrayEquals(new double[]{0.5, 0.5}, composite.getVector(), 1e-12);
        assertEquals(2, composite.getResolvedComponents().size());
    }

    @Test
    void testRecomputationIsBitIdenticalRegardlessOfComponentOrder() {
        fixture.vectorStore.storeTagVector("z", new double[]{0.1, 0.7});
        AnchorComponent x = AnchorComponent.of(ComponentType.TAG, "x");
        AnchorComponent y = AnchorComponent.of(ComponentType.TAG, "y");
        AnchorComponent z = AnchorComponent.of(ComponentType.TAG, "z");

        double[] first = fixture.compositor.composite(anchor(x, y, z)).getVector();
        double[] second = fixture.compositor.composite(anchor(z, x, y)).getVector();

        assertArrayEquals(first, second);
    }

    @Test
    void testUnresolvableComponentsAreSkipped() {
        AnchorComposite composite = fixture.compositor.composite(anchor(
            AnchorComponent.of(ComponentType.TAG, "x"),
            AnchorComponent.of(ComponentType.KB_ITEM, "kb/missing.pdf")));

        assertTrue(composite.isComposable());
        assertArrayEquals(new double[]{1, 0}, composite.getVector());
        assertEquals(List.of(AnchorComponent.of(ComponentType.KB_ITEM, "kb/missing.pdf")), composite.getSkippedComponents());
    }

    @Test
    void testWrongDimensionComponentIsSkipped() {
        fixture.vectorStore.storeTagVector("wide", new double[]{1, 0, 0});

        AnchorComposite composite = fixture.compositor.composite(anchor(
            AnchorComponent.of(ComponentType.TAG, "wide"),
            AnchorComponent.of(ComponentType.TAG, "y")));

        assertArrayEquals(new double[]{0, 1}, composite.getVector());
        assertEquals(1, composite.getSkippedComponents().size());
    }

    @Test
    void testAnchorWithNothingResolvableIsNotComposable() {
        AnchorComposite composite = fixture.compositor.composite(anchor(
            AnchorComponent.of(ComponentType.TAG, "nobody-uses-this")));

        assertFalse(composite.isComposable());
        assertNull(composite.getVector());
        assertNotNull(composite.getNotComposableReason());

        assertFalse(fixture.compositor.composite(anchor()).isComposable());
    }

    @Test
    void testCompositeAllDropsNonComposableAnchors() {
        List<AnchorComposite> composites = fixture.compositor.compositeAll(List.of(
            anchor(AnchorComponent.of(ComponentType.TAG, "x")),
            anchor(AnchorComponent.of(ComponentType.TAG, "missing"))));

        assertEquals(1, composites.size());
    }

    @Test
    void testNewComponentChangesNextComposite() {
        long anchorId = fixture.anchorStore.insert("Evolving", null, null,
            List.of(AnchorComponent.of(ComponentType.TAG, "x")));
        Anchor before = fixture.anchorStore.findById(anchorId).orElseThrow();
        assertArrayEquals(new double[]{1, 0}, fixture.compositor.composite(before).getVector());

        fixture.anchorStore.addComponent(anchorId, AnchorComponent.of(ComponentType.TAG, "y"));
        Anchor after = fixture.anchorStore.findById(anchorId).orElseThrow();

        assertArrayEquals(new double[]{0.5, 0.5}, fixture.compositor.composite(after).getVector(), 1e-12);
    }

    private Anchor anchor(AnchorComponent... components) {
        return Anchor.builder()
            .id(1)
            .name("Test anchor")
            .active(true)
            .components(List.of(components))
            .build();
    }
}
