package com.architecture.memory.vuegraph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Content attached to a node (an image, a URL, a file). The id is the owning node's id.
 */
@Value
@Builder
public class NodeResource {
    int id;
    String title;
    String type;
    @Singular
    Map<String, String> properties;
}
