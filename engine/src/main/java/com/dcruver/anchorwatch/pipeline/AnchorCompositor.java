package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.config.EngineProperties;
import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.nlp.EmbeddingResolver;
import com.dcruver.anchorwatch.nlp.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the effective vector of an anchor as the centroid of its resolvable components.
 *
 * Nothing is cached: anchors can gain or lose components between runs, so the matcher
 * recomputes composites on every invocation. Components are averaged in a fixed order
 * so the same component set always yields the same vector.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnchorCompositor {

    private final EmbeddingResolver resolver;
    private final EngineProperties properties;

    public AnchorComposite composite(Anchor anchor) {
        if (!anchor.hasComponents()) {
            log.warn("Anchor '{}' has no components, skipping", anchor.getName());
            return AnchorComposite.notComposable(anchor, List.of(), "no components");
        }

        List<AnchorComponent> ordered = anchor.getComponents().stream()
            .sorted(AnchorComponent.RESOLUTION_ORDER)
            .toList();

        int expectedDimension = properties.getEmbeddingDimension();
        List<double[]> vectors = new ArrayList<>();
        List<AnchorComponent> resolved = new ArrayList<>();
        List<AnchorComponent> skipped = new ArrayList<>();

        for (AnchorComponent component : ordered) {
            Optional<double[]> vector = resolver.resolve(component);
            if (vector.isEmpty()) {
                log.warn("Anchor '{}': no vector for component {}, skipping", anchor.getName(), component);
                skipped.add(component);
                continue;
            }
            if (expectedDimension > 0 && vector.get().length != expectedDimension) {
                log.warn("Anchor '{}': component {} has dimension {} (expected {}), skipping",
                    anchor.getName(), component, vector.get().length, expectedDimension);
                skipped.add(component);
                continue;
            }
            vectors.add(vector.get());
            resolved.add(component);
        }

        if (vectors.isEmpty()) {
            log.warn("Anchor '{}' has none of its {} components resolvable, skipping",
                anchor.getName(), ordered.size());
            return AnchorComposite.notComposable(anchor, skipped, "no resolvable components");
        }

        log.debug("Composed anchor '{}' from {} of {} components", anchor.getName(), resolved.size(), ordered.size());
        return AnchorComposite.composable(anchor, VectorMath.centroid(vectors), resolved, skipped);
    }

    /**
     * Composites of the given anchors, dropping the ones that cannot be composed
     */
    public List<AnchorComposite> compositeAll(List<Anchor> anchors) {
        List<AnchorComposite> composites = anchors.stream()
            .map(this::composite)
            .filter(AnchorComposite::isComposable)
            .toList();

        log.info("Loaded composite vectors for {} of {} active anchors", composites.size(), anchors.size());
        return composites;
    }
}
