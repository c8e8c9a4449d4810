package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.MapFormatException;
import com.architecture.memory.vuegraph.model.Directionality;
import com.architecture.memory.vuegraph.model.ElementKind;
import com.architecture.memory.vuegraph.model.EndpointRef;
import com.architecture.memory.vuegraph.model.GraphEntity;
import com.architecture.memory.vuegraph.model.MapLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Builds a {@link MapLink} once both of its endpoints exist in the context.
 * A link whose endpoint has not been seen yet is parked in the pending map instead.
 */
@Component
@Slf4j
public class LinkExtractor {

    /**
     * @return true if the link was resolved and added, false if it was deferred
     */
    public boolean extract(Element element, ExtractionContext context) {
        int id = XmlElements.requiredIntAttribute(element, "ID");
        EndpointRef first = endpointRef(id, element, "ID1");
        EndpointRef second = endpointRef(id, element, "ID2");
        int arrowState = XmlElements.requiredIntAttribute(element, "arrowState");

        Optional<GraphEntity> firstEntity = context.lookup(first);
        Optional<GraphEntity> secondEntity = context.lookup(second);
        if (firstEntity.isEmpty() || secondEntity.isEmpty()) {
            log.debug("[vue-extract] link id={} deferred, endpoints {} / {} not available yet", id, first, second);
            context.defer(id, element);
            return false;
        }

        // type follows element order, start/end follow the arrow
        String type = MapLink.typeOf(firstEntity.get(), secondEntity.get());
        boolean reversed = Directionality.isReversed(arrowState);

        MapLink link = MapLink.builder()
                .id(id)
                .label(XmlElements.attribute(element, "label", ""))
                .start(reversed ? second : first)
                .end(reversed ? first : second)
                .directed(Directionality.fromArrowState(arrowState))
                .type(type)
                .build();

        context.addLink(link);
        log.debug("[vue-extract] link id={} {} -> {} ({})", id, link.getStart(), link.getEnd(), type);
        return true;
    }

    private EndpointRef endpointRef(int linkId, Element element, String tag) {
        Element ref = XmlElements.firstChild(element, tag)
                .orElseThrow(() -> new MapFormatException(
                        String.format("Link %d is missing endpoint tag <%s>", linkId, tag)));

        ElementKind kind = ElementKind.fromDiscriminator(XmlElements.xsiType(ref));
        if (kind == ElementKind.OTHER) {
            throw new MapFormatException(String.format(
                    "Endpoint <%s> of link %d has unsupported type '%s', expected '%s' or '%s'",
                    tag, linkId, XmlElements.xsiType(ref),
                    ElementKind.NODE.getDiscriminator(), ElementKind.LINK.getDiscriminator()));
        }
        int targetId = XmlElements.parseInt(ref.getTextContent(),
                String.format("endpoint <%s> of link %d", tag, linkId));
        return EndpointRef.of(kind, targetId);
    }
}
