package com.purchasingpower.codegraph.model.retrieval;

import com.purchasingpower.codegraph.model.graph.CodeNode;

/**
 * A node returned by a vector index together with its cosine similarity.
 */
public record ScoredNode(CodeNode node, double score) {
}
