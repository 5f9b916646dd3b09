package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of one ingested repository. {@code name} is unique across the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryNode {

    public static final String LABEL = "RepositoryNode";

    private String id;

    private String name;
}
