package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.MapFormatException;
import com.architecture.memory.vuegraph.exception.UnknownMetadataKindException;
import com.architecture.memory.vuegraph.model.MapNode;
import com.architecture.memory.vuegraph.model.NodeMetadata;
import com.architecture.memory.vuegraph.model.NodeResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link MapNode} from a node element, including its attached resource and keywords.
 * Nested children are walked by {@link MapTreeWalker}.
 */
@Component
@Slf4j
public class NodeExtractor {

    static final String KEYWORD_KIND = "1";

    public MapNode extract(Element element, ExtractionContext context, Integer parentId) {
        int id = XmlElements.requiredIntAttribute(element, "ID");
        context.claim(id);

        String label = XmlElements.attribute(element, "label", "").replace('\n', ' ');

        MapNode node = MapNode.builder()
                .id(id)
                .label(label)
                .layer(XmlElements.attribute(element, "layerID"))
                .parent(parentId)
                .resource(extractResource(id, element))
                .metadata(extractMetadata(id, element))
                .build();

        context.addNode(node);
        log.debug("[vue-extract] node id={} parent={} label='{}'", id, parentId, label);
        return node;
    }

    private NodeResource extractResource(int nodeId, Element element) {
        return XmlElements.firstChild(element, "resource")
                .map(resource -> {
                    NodeResource.NodeResourceBuilder builder = NodeResource.builder()
                            .id(nodeId)
                            .type(XmlElements.attribute(resource, "type"))
                            .title(XmlElements.childText(resource, "title"));
                    for (Element property : XmlElements.children(resource, "property")) {
                        String key = XmlElements.attribute(property, "key");
                        if (key == null) {
                            throw new MapFormatException("Resource property without a key on node " + nodeId);
                        }
                        builder.property(key, XmlElements.attribute(property, "value", ""));
                    }
                    return builder.build();
                })
                .orElse(null);
    }

    /**
     * Keywords are the only metadata kind VUE defines; anything else fails rather than being dropped.
     */
    private NodeMetadata extractMetadata(int nodeId, Element element) {
        Element metadataList = XmlElements.firstChild(element, "metadata-list").orElse(null);
        if (metadataList == null) {
            return null;
        }

        List<Element> entries = new ArrayList<>(XmlElements.children(metadataList, "md"));
        entries.addAll(XmlElements.children(element, "md"));

        NodeMetadata.NodeMetadataBuilder builder = NodeMetadata.builder();
        for (Element md : entries) {
            String kind = XmlElements.attribute(md, "t");
            if (kind == null) {
                throw new MapFormatException("Metadata entry without kind on node " + nodeId);
            }
            if (!KEYWORD_KIND.equals(kind)) {
                throw new UnknownMetadataKindException(nodeId, kind);
            }
            builder.keyword(XmlElements.attribute(md, "v", ""));
        }
        return builder.build();
    }
}
