package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.model.ElementKind;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

/**
 * Decides whether a {@code child} element is a node, a link, or something the graph ignores.
 */
@Component
public class ElementClassifier {

    public ElementKind classify(Element element) {
        return ElementKind.fromDiscriminator(XmlElements.xsiType(element));
    }
}
