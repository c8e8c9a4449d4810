package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.MapFormatException;
import com.architecture.memory.vuegraph.model.EndpointRef;
import com.architecture.memory.vuegraph.model.GraphEntity;
import com.architecture.memory.vuegraph.model.MapLink;
import com.architecture.memory.vuegraph.model.MapNode;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state shared by one extraction run: every node and link built so far, and the
 * link elements still waiting for an endpoint. Nested nodes write into the same maps.
 * Not thread-safe; one context belongs to one traversal.
 */
public class ExtractionContext {

    private final Map<Integer, MapNode> nodes = new HashMap<>();
    private final Map<Integer, MapLink> links = new HashMap<>();
    private final Map<Integer, Element> pending = new LinkedHashMap<>();

    /**
     * Reserve an id seen for the first time. Ids are unique across nodes and links.
     */
    void claim(int id) {
        if (nodes.containsKey(id) || links.containsKey(id) || pending.containsKey(id)) {
            throw new MapFormatException("Duplicate element ID " + id);
        }
    }

    void addNode(MapNode node) {
        nodes.put(node.getId(), node);
    }

    void addLink(MapLink link) {
        pending.remove(link.getId());
        links.put(link.getId(), link);
    }

    void defer(int linkId, Element element) {
        pending.put(linkId, element);
    }

    Optional<GraphEntity> lookup(EndpointRef ref) {
        return switch (ref.getKind()) {
            case NODE -> Optional.ofNullable(nodes.get(ref.getId()));
            case LINK -> Optional.ofNullable(links.get(ref.getId()));
            case OTHER -> Optional.empty();
        };
    }

    public Map<Integer, MapNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Map<Integer, MapLink> getLinks() {
        return Collections.unmodifiableMap(links);
    }

    public Map<Integer, Element> getPending() {
        return Collections.unmodifiableMap(pending);
    }
}
