package com.purchasingpower.codegraph.model.graph;

/**
 * The two embedding properties carried by every code node.
 * Each one is backed by its own vector index per {@link NodeKind}.
 */
public enum EmbeddingField {
    CODE("code_embedding", "Code"),
    SUMMARY("summary_embedding", "Summary");

    private final String property;
    private final String indexSuffix;

    EmbeddingField(String property, String indexSuffix) {
        this.property = property;
        this.indexSuffix = indexSuffix;
    }

    public String getProperty() {
        return property;
    }

    String getIndexSuffix() {
        return indexSuffix;
    }
}
