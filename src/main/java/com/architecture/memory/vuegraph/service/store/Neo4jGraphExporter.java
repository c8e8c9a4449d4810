package com.architecture.memory.vuegraph.service.store;

import com.architecture.memory.vuegraph.dto.ImportSummary;
import com.architecture.memory.vuegraph.dto.ImportVerification;
import com.architecture.memory.vuegraph.exception.GraphStoreException;
import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.model.MapLink;
import com.architecture.memory.vuegraph.model.MapNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts an extracted map into Neo4j.
 *
 * Nodes are merged on VUE_ID in one transaction, then links are merged between their endpoint
 * nodes in a second one, keyed on their own VUE_ID so parallel links stay distinct. Links that
 * end on another link are skipped, since a relationship can only join two nodes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphExporter {

    static final String NODE_LABEL = "Node";
    static final String ID_PROPERTY = "VUE_ID";

    static final String MERGE_NODE = """
            MERGE (n:Node {VUE_ID: $id})
            SET n += $props
            """;

    static final String MERGE_LINK_TEMPLATE = """
            MATCH (start:Node {VUE_ID: $startId}), (end:Node {VUE_ID: $endId})
            MERGE (start)-[r:%s {VUE_ID: $linkId}]->(end)
            SET r += $props
            """;

    static final String COUNT_NODES = "MATCH (n:Node) RETURN count(n) AS count";
    static final String COUNT_LINKS = "MATCH (:Node)-[r]->(:Node) RETURN count(r) AS count";

    private final Driver driver;
    private final ObjectMapper objectMapper;

    public ImportSummary export(MapGraph graph) {
        List<MapLink> compatible = compatibleLinks(graph);
        List<Integer> skipped = graph.getLinks().values().stream()
                .filter(MapLink::touchesLink)
                .map(MapLink::getId)
                .toList();
        if (!skipped.isEmpty()) {
            log.warn("[neo4j-export] Skipping {} link(s) with link endpoints, not representable as relationships: {}",
                    skipped.size(), skipped);
        }

        try (Session session = driver.session()) {
            session.executeWriteWithoutResult(tx -> {
                for (MapNode node : graph.getNodes().values()) {
                    tx.run(MERGE_NODE, Map.of("id", node.getId(), "props", nodeProperties(node)));
                }
            });
            log.info("[neo4j-export] Merged {} nodes", graph.getNodes().size());

            session.executeWriteWithoutResult(tx -> {
                for (MapLink link : compatible) {
                    tx.run(String.format(MERGE_LINK_TEMPLATE, relationshipType(link)), Map.of(
                            "linkId", link.getId(),
                            "startId", link.getStart().getId(),
                            "endId", link.getEnd().getId(),
                            "props", linkProperties(link)));
                }
            });
            log.info("[neo4j-export] Merged {} links", compatible.size());
        } catch (Neo4jException e) {
            log.error("[neo4j-export] Import failed", e);
            throw new GraphStoreException("Neo4j import failed: " + e.getMessage(), e);
        }

        return ImportSummary.builder()
                .nodesMerged(graph.getNodes().size())
                .linksMerged(compatible.size())
                .skippedLinkIds(skipped)
                .unresolvedLinkIds(graph.getUnresolvedLinkIds())
                .build();
    }

    /**
     * Compare counts in the database with the extracted graph. Expects the map to have been
     * imported into an otherwise empty database.
     */
    public ImportVerification verify(MapGraph graph) {
        try (Session session = driver.session()) {
            long nodeCount = session.executeRead(tx -> tx.run(COUNT_NODES).single().get("count").asLong());
            long linkCount = session.executeRead(tx -> tx.run(COUNT_LINKS).single().get("count").asLong());

            ImportVerification verification = ImportVerification.builder()
                    .expectedNodes(graph.getNodes().size())
                    .actualNodes(nodeCount)
                    .expectedLinks(compatibleLinks(graph).size())
                    .actualLinks(linkCount)
                    .build();
            if (!verification.isConsistent()) {
                log.warn("[neo4j-export] Unequal sets after import: nodes {}/{}, links {}/{}",
                        verification.getExpectedNodes(), nodeCount, verification.getExpectedLinks(), linkCount);
            }
            return verification;
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j verification failed: " + e.getMessage(), e);
        }
    }

    static List<MapLink> compatibleLinks(MapGraph graph) {
        return graph.getLinks().values().stream()
                .filter(link -> !link.touchesLink())
                .toList();
    }

    Map<String, Object> nodeProperties(MapNode node) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ID_PROPERTY, node.getId());
        props.put("type", node.getType());
        props.put("label", node.getLabel());
        putIfPresent(props, "layer", node.getLayer());
        putIfPresent(props, "parent", node.getParent());
        putIfPresent(props, "resource", toJson(node.getResource()));
        putIfPresent(props, "metadata", toJson(node.getMetadata()));
        return props;
    }

    static Map<String, Object> linkProperties(MapLink link) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ID_PROPERTY, link.getId());
        props.put("directed", link.getDirected().getValue());
        props.put("type", link.getType());
        return props;
    }

    /**
     * The link label names the relationship; unlabelled links fall back to their direction.
     */
    static String relationshipType(MapLink link) {
        String name = link.getLabel() == null || link.getLabel().isBlank()
                ? link.getDirected().getValue()
                : link.getLabel();
        return "`" + name.replace("`", "``") + "`";
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static void putIfPresent(Map<String, Object> props, String key, Object value) {
        if (value != null) {
            props.put(key, value);
        }
    }
}
