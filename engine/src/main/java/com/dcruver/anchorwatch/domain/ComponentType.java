package com.dcruver.anchorwatch.domain;

import java.util.Arrays;

/**
 * Kinds of building blocks an anchor can be composed from.
 * The persisted code is what the anchor_components table stores.
 */
public enum ComponentType {
    /**
     * A taxonomy tag with its own stored embedding
     */
    TAG("tag"),

    /**
     * A knowledge-base item, addressed by its source location
     */
    KB_ITEM("kb_item"),

    /**
     * Free text written by an administrator to describe the ideal match
     */
    HYPOTHETICAL_DOCUMENT("hypothetical_document"),

    /**
     * A program tag, resolved through the knowledge-base item holding its charter
     */
    PROGRAM("program");

    private final String code;

    ComponentType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ComponentType fromCode(String code) {
        return Arrays.stream(values())
            .filter(t -> t.code.equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown component type: " + code));
    }
}
