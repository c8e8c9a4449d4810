package com.architecture.memory.vuegraph.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NodeMetadata {
    @Singular
    List<String> keywords;
}
