package com.architecture.memory.vuegraph.service;

import com.architecture.memory.vuegraph.dto.ImportSummary;
import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.service.extraction.MapGraphExtractor;
import com.architecture.memory.vuegraph.service.extraction.VueDocumentLoader;
import com.architecture.memory.vuegraph.service.render.GraphTableRenderer;
import com.architecture.memory.vuegraph.service.store.Neo4jGraphExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Orchestrates the map pipeline:
 *   1. Load the .vue document
 *   2. Extract nodes and links
 *   3. Render tables or import into Neo4j
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapImportService {

    private final VueDocumentLoader documentLoader;
    private final MapGraphExtractor graphExtractor;
    private final GraphTableRenderer tableRenderer;
    private final Neo4jGraphExporter graphExporter;

    @Value("${vuegraph.extraction.fail-on-unresolved:false}")
    private boolean failOnUnresolved;

    @Value("${vuegraph.import.verify:true}")
    private boolean verifyImport;

    @Value("${vuegraph.render.max-label-length:30}")
    private int maxLabelLength;

    @Value("${vuegraph.render.node-column:label}")
    private String nodeColumn;

    public MapGraph extract(Path path) {
        log.info("[vue-import] Extracting graph from {}", path);
        return extract(documentLoader.load(path));
    }

    public MapGraph extract(InputStream in, String sourceName) {
        log.info("[vue-import] Extracting graph from upload {}", sourceName);
        return extract(documentLoader.parse(in, sourceName));
    }

    private MapGraph extract(Element root) {
        MapGraph graph = graphExtractor.extract(root);
        return failOnUnresolved ? graph.requireFullyResolved() : graph;
    }

    public String renderTables(MapGraph graph) {
        return tableRenderer.renderNodes(graph, nodeColumn)
                + "\n"
                + tableRenderer.renderLinks(graph, maxLabelLength);
    }

    public ImportSummary importMap(InputStream in, String sourceName) {
        return importGraph(extract(in, sourceName), sourceName);
    }

    public ImportSummary importMap(Path path) {
        return importGraph(extract(path), path.toString());
    }

    public ImportSummary importGraph(MapGraph graph, String source) {
        ImportSummary summary = graphExporter.export(graph);
        summary.setSource(source);
        if (verifyImport) {
            summary.setVerification(graphExporter.verify(graph));
        }
        log.info("[vue-import] Imported {}: nodes={} links={} skipped={} unresolved={}",
                source, summary.getNodesMerged(), summary.getLinksMerged(),
                summary.getSkippedLinkIds().size(), summary.getUnresolvedLinkIds().size());
        return summary;
    }
}
