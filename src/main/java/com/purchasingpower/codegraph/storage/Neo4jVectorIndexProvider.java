package com.purchasingpower.codegraph.storage;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.model.graph.EmbeddingField;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.retrieval.ScoredNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.codegraph.storage.Neo4jSessionTemplate.params;

/**
 * Vector search backed by Neo4j native vector indexes
 * ({@code db.index.vector.queryNodes}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Neo4jVectorIndexProvider implements VectorIndexProvider {

    private final Neo4jSessionTemplate template;

    @Override
    public List<ScoredNode> search(String indexName, int k, List<Double> vector, String repository) {
        Preconditions.checkArgument(k > 0, "k must be positive");

        // Filtering happens after the ANN step, so over-fetch when restricted to one repository.
        int candidates = repository != null ? k * 2 : k;

        String cypher = "CALL db.index.vector.queryNodes($indexName, $candidates, $embedding)\n"
                + "YIELD node, score\n"
                + (repository != null
                    ? "WHERE EXISTS { MATCH (:RepositoryNode {name: $repository})-[:CHILD*]->(node) }\n"
                    : "")
                + "RETURN " + Neo4jCodeGraphStore.projection("node") + ", score\n"
                + "ORDER BY score DESC\n"
                + "LIMIT $limit";

        Map<String, Object> params = params(
                "indexName", indexName,
                "candidates", candidates,
                "embedding", vector,
                "limit", k);
        if (repository != null) {
            params.put("repository", repository);
        }

        return template.read("VectorQuery:" + indexName, tx -> tx.run(cypher, params).list(record ->
                new ScoredNode(Neo4jCodeGraphStore.toCodeNode(record), record.get("score").asDouble())));
    }

    @Override
    public void ensureIndexes(int dimension) {
        Preconditions.checkArgument(dimension > 0, "dimension must be positive");

        int created = 0;
        for (NodeKind kind : NodeKind.values()) {
            for (EmbeddingField field : EmbeddingField.values()) {
                String indexName = kind.indexName(field);
                // Index names, labels and properties cannot be parameters; all come from enums.
                String cypher = String.format("""
                        CREATE VECTOR INDEX %s IF NOT EXISTS
                        FOR (n:%s)
                        ON (n.%s)
                        OPTIONS {
                            indexConfig: {
                                `vector.dimensions`: %d,
                                `vector.similarity_function`: 'cosine'
                            }
                        }
                        """, indexName, kind.getLabel(), field.getProperty(), dimension);
                try {
                    template.write("CreateVectorIndex:" + indexName, tx -> tx.run(cypher).consume());
                    created++;
                } catch (RuntimeException e) {
                    log.error("❌ Failed to create vector index {}: {}", indexName, e.getMessage());
                }
            }
        }
        log.info("✅ Vector indexes ensured: {}/{} (dimension {})",
                created, NodeKind.values().length * EmbeddingField.values().length, dimension);
    }
}
