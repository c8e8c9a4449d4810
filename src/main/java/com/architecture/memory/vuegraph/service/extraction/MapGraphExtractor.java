package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.MapFormatException;
import com.architecture.memory.vuegraph.model.MapGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Turns a parsed {@code LW-MAP} element into a {@link MapGraph}.
 *
 * Extraction is a pure function of the element tree: the same tree always yields the same
 * nodes, links and unresolved ids. Malformed structure aborts the run with no partial result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapGraphExtractor {

    public static final String ROOT_TAG = "LW-MAP";

    private final MapTreeWalker walker;

    public MapGraph extract(Element root) {
        if (!ROOT_TAG.equals(XmlElements.nameOf(root))) {
            throw new MapFormatException("Expected <" + ROOT_TAG + "> root but found <" + XmlElements.nameOf(root) + ">");
        }

        ExtractionContext context = new ExtractionContext();
        walker.walk(root, context, null);
        List<Integer> unresolved = walker.resolvePending(context);

        if (!unresolved.isEmpty()) {
            log.warn("[vue-extract] {} link(s) reference elements that never appeared: {}", unresolved.size(), unresolved);
        }

        MapGraph graph = new MapGraph(context.getNodes(), context.getLinks(), unresolved);
        log.info("[vue-extract] Extracted nodes={} links={} unresolved={}",
                graph.getNodes().size(), graph.getLinks().size(), unresolved.size());
        return graph;
    }
}
