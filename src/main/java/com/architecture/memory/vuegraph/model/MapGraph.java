package com.architecture.memory.vuegraph.model;

import com.architecture.memory.vuegraph.exception.UnresolvedLinksException;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of extracting a whole map: nodes and links keyed by id in ascending order,
 * plus the ids of links whose endpoints never resolved.
 */
@Getter
public class MapGraph {

    private final SortedMap<Integer, MapNode> nodes;
    private final SortedMap<Integer, MapLink> links;
    private final List<Integer> unresolvedLinkIds;

    public MapGraph(Map<Integer, MapNode> nodes, Map<Integer, MapLink> links, List<Integer> unresolvedLinkIds) {
        this.nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
        this.links = Collections.unmodifiableSortedMap(new TreeMap<>(links));
        this.unresolvedLinkIds = unresolvedLinkIds.stream().sorted().toList();
    }

    public Optional<GraphEntity> resolve(EndpointRef ref) {
        return switch (ref.getKind()) {
            case NODE -> Optional.ofNullable(nodes.get(ref.getId()));
            case LINK -> Optional.ofNullable(links.get(ref.getId()));
            case OTHER -> Optional.empty();
        };
    }

    public GraphEntity start(MapLink link) {
        return resolve(link.getStart()).orElseThrow(() ->
                new IllegalStateException("Dangling start endpoint on link " + link.getId()));
    }

    public GraphEntity end(MapLink link) {
        return resolve(link.getEnd()).orElseThrow(() ->
                new IllegalStateException("Dangling end endpoint on link " + link.getId()));
    }

    public boolean isFullyResolved() {
        return unresolvedLinkIds.isEmpty();
    }

    public MapGraph requireFullyResolved() {
        if (!isFullyResolved()) {
            throw new UnresolvedLinksException(unresolvedLinkIds);
        }
        return this;
    }
}
