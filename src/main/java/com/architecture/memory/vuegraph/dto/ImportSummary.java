package com.architecture.memory.vuegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {
    private String source;
    private int nodesMerged;
    private int linksMerged;

    // Links with a link endpoint; Neo4j relationships only join nodes
    @Builder.Default
    private List<Integer> skippedLinkIds = new ArrayList<>();

    @Builder.Default
    private List<Integer> unresolvedLinkIds = new ArrayList<>();

    private ImportVerification verification;
}
