package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.graph.ParsedFile;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import com.purchasingpower.codegraph.model.ingest.IngestReport;
import com.purchasingpower.codegraph.model.ingest.IngestionResult;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;

import java.util.List;
import java.util.Optional;

/**
 * Materializes extractor parse trees into the Repository → File → Class/Function hierarchy.
 */
public interface GraphIngestionService {

    /**
     * Returns the repository node with this name, creating it on first use.
     * Calling it again with the same name yields the same node.
     *
     * @throws IllegalArgumentException when the name is blank
     */
    RepositoryNode createRepository(String name);

    /**
     * Persists one file's parse tree under {@code repository}, parents before children.
     *
     * <p>Best-effort: unknown node types are skipped with their subtree, a node that fails
     * to persist is skipped while its children are still persisted (unattached), and a failed
     * edge does not stop the walk. Nothing is rolled back; the report lists what went wrong.
     */
    IngestReport ingest(RepositoryNode repository, ParsedFile file);

    /**
     * Creates (or reuses) the repository, ingests every file into it and validates the
     * resulting structure once.
     */
    IngestionResult ingestAll(String repositoryName, List<ParsedFile> files);

    /**
     * Counts nodes connected to the repository and orphaned nodes across the graph.
     * Read-only; returns empty instead of throwing when the counts cannot be obtained.
     */
    Optional<StructureValidation> validateStructure(String repositoryName);

    /**
     * Deletes the repository and everything below it.
     *
     * @return number of deleted nodes, repository included
     */
    long deleteRepository(String repositoryName);

    List<RepositoryNode> listRepositories();
}
