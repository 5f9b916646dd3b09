package com.purchasingpower.codegraph.model.retrieval;

import com.purchasingpower.codegraph.model.graph.NodeKind;

/**
 * Identity used to merge and deduplicate retrieval results.
 *
 * <p>Two distinct graph nodes with the same kind and name collapse into one key.
 */
public record NodeKey(NodeKind kind, String name) {
}
