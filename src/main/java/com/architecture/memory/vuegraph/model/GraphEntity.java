package com.architecture.memory.vuegraph.model;

/**
 * Anything a link may connect to: a node, or another link.
 */
public interface GraphEntity {

    int getId();

    String getLabel();

    /**
     * "Node" for nodes, "Link: X-Y" for links.
     */
    String getType();

    ElementKind getKind();
}
