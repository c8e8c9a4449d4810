package com.architecture.memory.vuegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node and relationship counts found in Neo4j after an import, compared with what was sent.
 * Only meaningful when importing into an empty database.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportVerification {
    private long expectedNodes;
    private long actualNodes;
    private long expectedLinks;
    private long actualLinks;

    public boolean isConsistent() {
        return expectedNodes == actualNodes && expectedLinks == actualLinks;
    }
}
