package com.dcruver.anchorwatch.domain;

import lombok.Builder;
import lombok.Data;

import java.util.Comparator;

/**
 * A tagged reference to one vector contributing to an anchor.
 */
@Data
@Builder
public class AnchorComponent {

    /**
     * Stable ordering used when averaging, so the centroid is reproducible
     */
    public static final Comparator<AnchorComponent> RESOLUTION_ORDER =
        Comparator.comparing(AnchorComponent::getType).thenComparing(AnchorComponent::getComponentId);

    private final ComponentType type;
    private final String componentId;

    public static AnchorComponent of(ComponentType type, String componentId) {
        return AnchorComponent.builder().type(type).componentId(componentId).build();
    }

    @Override
    public String toString() {
        return type.getCode() + ":" + componentId;
    }
}
