package com.architecture.memory.vuegraph.dto;

import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.model.MapLink;
import com.architecture.memory.vuegraph.model.MapNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON view of an extracted map. Nodes and links are listed in ascending id order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapGraphResponse {
    private String source;
    private int nodeCount;
    private int linkCount;

    @Builder.Default
    private List<MapNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<MapLink> links = new ArrayList<>();

    @Builder.Default
    private List<Integer> unresolvedLinkIds = new ArrayList<>();

    public static MapGraphResponse from(String source, MapGraph graph) {
        return MapGraphResponse.builder()
                .source(source)
                .nodeCount(graph.getNodes().size())
                .linkCount(graph.getLinks().size())
                .nodes(new ArrayList<>(graph.getNodes().values()))
                .links(new ArrayList<>(graph.getLinks().values()))
                .unresolvedLinkIds(new ArrayList<>(graph.getUnresolvedLinkIds()))
                .build();
    }
}
