package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of composing one anchor: either its centroid vector or the reason it has none.
 */
@Data
@Builder
public class AnchorComposite {
    private final Anchor anchor;
    private final double[] vector;
    private final List<AnchorComponent> resolvedComponents;
    private final List<AnchorComponent> skippedComponents;
    private final String notComposableReason;

    public boolean isComposable() {
        return vector != null;
    }

    static AnchorComposite composable(Anchor anchor, double[] vector,
                                      List<AnchorComponent> resolved, List<AnchorComponent> skipped) {
        return AnchorComposite.builder()
            .anchor(anchor)
            .vector(vector)
            .resolvedComponents(resolved)
            .skippedComponents(skipped)
            .build();
    }

    static AnchorComposite notComposable(Anchor anchor, List<AnchorComponent> skipped, String reason) {
        return AnchorComposite.builder()
            .anchor(anchor)
            .resolvedComponents(List.of())
            .skippedComponents(skipped)
            .notComposableReason(reason)
            .build();
    }
}
