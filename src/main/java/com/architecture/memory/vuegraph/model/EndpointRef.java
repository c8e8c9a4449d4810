package com.architecture.memory.vuegraph.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Stable reference to a link endpoint: the kind of collection it lives in and its id.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class EndpointRef {
    ElementKind kind;
    int id;
}
