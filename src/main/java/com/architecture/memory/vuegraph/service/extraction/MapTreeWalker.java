package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.model.MapNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first walk over the {@code child} elements of a map.
 *
 * Pass 1 ({@link #walk}) visits every element in document order, descending into nested nodes.
 * Links that reference an element not yet visited are deferred.
 * Pass 2 ({@link #resolvePending}) retries the deferred links until a full pass resolves nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MapTreeWalker {

    static final String CHILD_TAG = "child";

    private final ElementClassifier classifier;
    private final NodeExtractor nodeExtractor;
    private final LinkExtractor linkExtractor;

    public void walk(Element parent, ExtractionContext context, Integer parentId) {
        for (Element child : XmlElements.children(parent, CHILD_TAG)) {
            switch (classifier.classify(child)) {
                case NODE -> {
                    MapNode node = nodeExtractor.extract(child, context, parentId);
                    if (XmlElements.hasChild(child, CHILD_TAG)) {
                        walk(child, context, node.getId());
                    }
                }
                case LINK -> {
                    context.claim(XmlElements.requiredIntAttribute(child, "ID"));
                    linkExtractor.extract(child, context);
                }
                case OTHER -> log.trace("[vue-extract] skipping <child> of type '{}'", XmlElements.xsiType(child));
            }
        }
    }

    /**
     * Retry deferred links against the current nodes and links until a pass makes no progress.
     *
     * @return ids of links that could not be resolved, in ascending order
     */
    public List<Integer> resolvePending(ExtractionContext context) {
        int pass = 0;
        while (!context.getPending().isEmpty()) {
            pass++;
            Map<Integer, Element> snapshot = new LinkedHashMap<>(context.getPending());
            int resolved = 0;
            for (Element element : snapshot.values()) {
                if (linkExtractor.extract(element, context)) {
                    resolved++;
                }
            }
            log.debug("[vue-extract] retry pass {} resolved {} of {} pending links", pass, resolved, snapshot.size());
            if (resolved == 0) {
                break;
            }
        }
        return context.getPending().keySet().stream().sorted().toList();
    }
}
