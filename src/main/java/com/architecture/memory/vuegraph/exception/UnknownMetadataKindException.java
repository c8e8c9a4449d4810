package com.architecture.memory.vuegraph.exception;

import lombok.Getter;

@Getter
public class UnknownMetadataKindException extends VueGraphException {

    private final int nodeId;
    private final String kind;

    public UnknownMetadataKindException(int nodeId, String kind) {
        super(String.format("Invalid tag attribute on md of node %d: t=\"%s\"", nodeId, kind));
        this.nodeId = nodeId;
        this.kind = kind;
    }
}
