package com.architecture.memory.vuegraph.model;

import lombok.Builder;
import lombok.Value;

/**
 * A mind-map item. Immutable once inserted into the extraction context.
 */
@Value
@Builder
public class MapNode implements GraphEntity {

    public static final String TYPE = "Node";

    int id;
    String label;
    String layer;
    Integer parent;   // null for items directly under LW-MAP
    NodeResource resource;
    NodeMetadata metadata;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.NODE;
    }
}
