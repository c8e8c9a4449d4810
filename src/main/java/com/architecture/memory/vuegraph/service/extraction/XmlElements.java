package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.MapFormatException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Small DOM helpers shared by the extractors. Lookups are over direct children only.
 */
final class XmlElements {

    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    private XmlElements() {
    }

    static String nameOf(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tag.equals(nameOf(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Optional<Element> firstChild(Element parent, String tag) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tag.equals(nameOf(node))) {
                return Optional.of((Element) node);
            }
        }
        return Optional.empty();
    }

    static boolean hasChild(Element parent, String tag) {
        return firstChild(parent, tag).isPresent();
    }

    /**
     * Value of an attribute, or null when it is absent.
     */
    static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    static String attribute(Element element, String name, String defaultValue) {
        String value = attribute(element, name);
        return value != null ? value : defaultValue;
    }

    /**
     * The {@code xsi:type} discriminator, or null when the element carries none.
     */
    static String xsiType(Element element) {
        if (element.hasAttributeNS(XSI_NAMESPACE, "type")) {
            return element.getAttributeNS(XSI_NAMESPACE, "type");
        }
        return attribute(element, "xsi:type");
    }

    static int requiredIntAttribute(Element element, String name) {
        String value = attribute(element, name);
        if (value == null) {
            throw new MapFormatException(String.format("<%s> is missing required attribute '%s'", nameOf(element), name));
        }
        return parseInt(value, String.format("attribute '%s' of <%s>", name, nameOf(element)));
    }

    static int parseInt(String value, String what) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MapFormatException(String.format("Expected an integer in %s but found '%s'", what, value), e);
        }
    }

    static String childText(Element parent, String tag) {
        return firstChild(parent, tag).map(Element::getTextContent).orElse(null);
    }
}
