package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A File, Class or Function node in the knowledge graph.
 *
 * <p>One record type for all three kinds, tagged by {@link #kind}. Embeddings and summary
 * stay at their placeholders until the enrichment run fills them in.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeNode {

    public static final String SUMMARY_PLACEHOLDER = "N/A";

    /**
     * Store-assigned identity (Neo4j element id). Null before persistence.
     */
    private String id;

    private NodeKind kind;

    private String name;

    /**
     * 1-based start line; 0 for file nodes.
     */
    private int lineno;

    private String code;

    @Builder.Default
    private List<String> parameters = new ArrayList<>();

    private boolean async;

    @Builder.Default
    private String summary = SUMMARY_PLACEHOLDER;

    @Builder.Default
    private List<Double> codeEmbedding = new ArrayList<>();

    @Builder.Default
    private List<Double> summaryEmbedding = new ArrayList<>();

    /**
     * Parent name as reported by the extractor. Advisory only.
     */
    private String parentSourceIdentifier;

    /**
     * Child names as reported by the extractor, kept for audit.
     */
    @Builder.Default
    private List<String> childrenSourceIdentifiers = new ArrayList<>();

    public boolean hasSummary() {
        return summary != null && !summary.isBlank() && !SUMMARY_PLACEHOLDER.equals(summary);
    }
}
