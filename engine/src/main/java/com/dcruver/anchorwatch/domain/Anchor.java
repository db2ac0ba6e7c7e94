package com.dcruver.anchorwatch.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;

/**
 * A named, user-defined topic. Its effective vector is derived from its components
 * on every matcher run and never stored.
 */
@Data
@Builder
@With
public class Anchor {
    private final long id;
    private final String name;
    private final String description;
    private final String author;
    private final boolean active;
    private final List<AnchorComponent> components;

    public boolean hasComponents() {
        return components != null && !components.isEmpty();
    }
}
