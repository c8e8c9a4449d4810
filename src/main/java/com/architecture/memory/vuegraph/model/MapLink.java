package com.architecture.memory.vuegraph.model;

import lombok.Builder;
import lombok.Value;

/**
 * A connector between two endpoints, each of which is a node or another link.
 * Endpoints are held as id references and resolved through {@link MapGraph#resolve(EndpointRef)}.
 */
@Value
@Builder(toBuilder = true)
public class MapLink implements GraphEntity {

    public static final String TYPE_PREFIX = "Link: ";

    int id;
    String label;
    EndpointRef start;
    EndpointRef end;
    Directionality directed;
    String type;

    @Override
    public ElementKind getKind() {
        return ElementKind.LINK;
    }

    public boolean touchesLink() {
        return start.getKind() == ElementKind.LINK || end.getKind() == ElementKind.LINK;
    }

    public static String typeOf(GraphEntity first, GraphEntity second) {
        return TYPE_PREFIX + first.getType() + "-" + second.getType();
    }
}
