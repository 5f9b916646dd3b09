package com.purchasingpower.codegraph.retrieval;

import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;

import java.util.List;

/**
 * Answers free-text queries against the populated code graph.
 *
 * <p>Results are unique by (type, name), scored within [0, 1], highest first, and never
 * longer than {@code k}. Strategy failures shrink the answer instead of failing the call;
 * only an unreachable graph store propagates, as
 * {@link com.purchasingpower.codegraph.exception.GraphStoreUnavailableException}.
 */
public interface RetrievalService {

    /**
     * Multi-strategy retrieval: summary-semantic search, keyword graph search and
     * code-semantic search fused into one ranking, then enriched with graph neighbours
     * of the best results.
     *
     * @param query      free text
     * @param k          maximum number of results
     * @param repository restrict to one repository, or {@code null} for all
     */
    List<RetrievedNode> retrieveTopK(String query, int k, String repository);

    /**
     * Summary-semantic search only; no fusion and no enrichment.
     */
    List<RetrievedNode> retrieveSemantic(String query, int k, String repository);
}
