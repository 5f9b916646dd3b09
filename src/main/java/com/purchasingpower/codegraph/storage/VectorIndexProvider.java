package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.retrieval.ScoredNode;

import java.util.List;

/**
 * Approximate nearest-neighbour search over the named vector indexes, one per
 * node kind and embedding field. Similarity is cosine.
 */
public interface VectorIndexProvider {

    /**
     * @param indexName  e.g. {@code classSummaryEmbeddingIndex}
     * @param k          number of results wanted
     * @param vector     query embedding
     * @param repository restrict to nodes reachable from this repository, or {@code null}
     * @return nodes with scores, highest first
     */
    List<ScoredNode> search(String indexName, int k, List<Double> vector, String repository);

    /**
     * Creates the six indexes if they do not exist yet.
     */
    void ensureIndexes(int dimension);
}
