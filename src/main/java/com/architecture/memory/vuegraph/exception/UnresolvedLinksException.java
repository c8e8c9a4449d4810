package com.architecture.memory.vuegraph.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a caller requires a fully connected graph but some links still
 * reference ids that never appeared in the document.
 */
@Getter
public class UnresolvedLinksException extends VueGraphException {

    private final List<Integer> linkIds;

    public UnresolvedLinksException(List<Integer> linkIds) {
        super("Links with unresolvable endpoints: " + linkIds);
        this.linkIds = List.copyOf(linkIds);
    }
}
