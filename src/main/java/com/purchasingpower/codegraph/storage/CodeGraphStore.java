package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;

import java.util.List;

/**
 * Property-graph operations needed by ingestion, enrichment and retrieval.
 *
 * <p>A {@code repository} argument of {@code null} means "no repository restriction".
 * Implementations signal an unreachable store with
 * {@link com.purchasingpower.codegraph.exception.GraphStoreUnavailableException}.
 */
public interface CodeGraphStore {

    /**
     * Returns the repository node with this name, creating it if absent.
     */
    RepositoryNode mergeRepository(String name);

    List<RepositoryNode> findRepositories();

    /**
     * Persists a new code node and returns its store identity.
     */
    String createNode(CodeNode node);

    /**
     * Adds a CHILD edge between two persisted nodes (repository or code node).
     *
     * @throws IllegalStateException when either endpoint does not exist
     */
    void createChildEdge(String parentId, String childId);

    /**
     * Distinct nodes reachable from the named repository via one or more CHILD edges.
     */
    long countReachable(String repository);

    /**
     * Tracked-type nodes reachable from no repository.
     */
    long countOrphaned();

    /**
     * Deletes the repository and every node reachable from it.
     *
     * @return number of deleted nodes, repository included; 0 when it does not exist
     */
    long deleteRepository(String name);

    /**
     * Nodes of any tracked kind whose lower-cased name or summary contains one of the
     * (already lower-cased) keywords.
     */
    List<CodeNode> findByKeywords(List<String> keywords, int limit, String repository);

    /**
     * Nodes reachable within 1-2 CHILD hops below nodes of this kind and name.
     */
    List<CodeNode> findChildren(NodeKind kind, String name, int limit, String repository);

    /**
     * Tracked-type nodes that reach nodes of this kind and name via 1-2 CHILD hops.
     */
    List<CodeNode> findParents(NodeKind kind, String name, int limit, String repository);

    /**
     * Code nodes under the repository whose summary is still the placeholder.
     */
    List<CodeNode> findUnsummarized(String repository);

    void updateEnrichment(String nodeId, String summary, List<Double> summaryEmbedding, List<Double> codeEmbedding);
}
