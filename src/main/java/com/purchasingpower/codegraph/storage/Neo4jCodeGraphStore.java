package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.codegraph.storage.Neo4jSessionTemplate.params;

/**
 * Neo4j implementation of the code graph: {@code RepositoryNode}, {@code FileNode},
 * {@code ClassNode} and {@code FunctionNode} connected by {@code CHILD} edges.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class Neo4jCodeGraphStore implements CodeGraphStore {

    private static final String TRACKED = NodeKind.labelExpression();

    private final Neo4jSessionTemplate template;

    /**
     * Column list shared by every query returning code nodes.
     */
    static String projection(String variable) {
        return String.format("""
                elementId(%1$s) AS id,
                labels(%1$s)[0] AS label,
                %1$s.name AS name,
                %1$s.summary AS summary,
                %1$s.code AS code,
                %1$s.lineno AS lineno,
                %1$s.parameters AS parameters,
                %1$s.is_async AS isAsync
                """, variable);
    }

    static CodeNode toCodeNode(Record record) {
        return CodeNode.builder()
                .id(string(record.get("id")))
                .kind(NodeKind.fromLabel(record.get("label").asString()))
                .name(string(record.get("name")))
                .summary(string(record.get("summary")))
                .code(string(record.get("code")))
                .lineno(record.get("lineno").isNull() ? 0 : record.get("lineno").asInt())
                .parameters(record.get("parameters").isNull()
                        ? new ArrayList<>()
                        : new ArrayList<>(record.get("parameters").asList(Value::asString)))
                .async(!record.get("isAsync").isNull() && record.get("isAsync").asBoolean())
                .build();
    }

    private static String string(Value value) {
        return value == null || value.isNull() ? "" : value.asString();
    }

    private static String repositoryScope(String variable) {
        return "EXISTS { MATCH (:RepositoryNode {name: $repository})-[:CHILD*]->(" + variable + ") }";
    }

    // ================================================================
    // REPOSITORY NODES
    // ================================================================

    @Override
    public RepositoryNode mergeRepository(String name) {
        String cypher = """
                MERGE (r:RepositoryNode {name: $name})
                ON CREATE SET r.type = 'Code repository'
                RETURN elementId(r) AS id, r.name AS name
                """;

        return template.write("MergeRepository", tx -> {
            Record record = tx.run(cypher, params("name", name)).single();
            return RepositoryNode.builder()
                    .id(record.get("id").asString())
                    .name(record.get("name").asString())
                    .build();
        });
    }

    @Override
    public List<RepositoryNode> findRepositories() {
        String cypher = """
                MATCH (r:RepositoryNode)
                RETURN elementId(r) AS id, r.name AS name
                ORDER BY name
                """;

        return template.read("FindRepositories", tx -> tx.run(cypher).list(record ->
                RepositoryNode.builder()
                        .id(record.get("id").asString())
                        .name(record.get("name").asString())
                        .build()));
    }

    @Override
    public long deleteRepository(String name) {
        String cypher = """
                MATCH (r:RepositoryNode {name: $name})
                OPTIONAL MATCH (r)-[:CHILD*]->(n)
                WITH r, collect(DISTINCT n) AS descendants
                WITH r, descendants, size(descendants) + 1 AS removed
                FOREACH (d IN descendants | DETACH DELETE d)
                DETACH DELETE r
                RETURN removed
                """;

        return template.write("DeleteRepository", tx -> {
            Result result = tx.run(cypher, params("name", name));
            return result.hasNext() ? result.single().get("removed").asLong() : 0L;
        });
    }

    // ================================================================
    // INGESTION
    // ================================================================

    @Override
    public String createNode(CodeNode node) {
        // Labels cannot be parameterized; the label comes from the NodeKind enum only.
        String cypher = String.format("""
                CREATE (n:%s {
                    name: $name,
                    type: $type,
                    lineno: $lineno,
                    code: $code,
                    parameters: $parameters,
                    is_async: $isAsync,
                    summary: $summary,
                    code_embedding: $codeEmbedding,
                    summary_embedding: $summaryEmbedding,
                    parent_source_identifier: $parent,
                    children_source_identifiers: $children
                })
                RETURN elementId(n) AS id
                """, node.getKind().getLabel());

        Map<String, Object> params = params(
                "name", node.getName(),
                "type", node.getKind().getTypeName(),
                "lineno", node.getLineno(),
                "code", node.getCode(),
                "parameters", node.getParameters() != null ? node.getParameters() : List.of(),
                "isAsync", node.isAsync(),
                "summary", node.getSummary() != null ? node.getSummary() : CodeNode.SUMMARY_PLACEHOLDER,
                "codeEmbedding", node.getCodeEmbedding() != null ? node.getCodeEmbedding() : List.of(),
                "summaryEmbedding", node.getSummaryEmbedding() != null ? node.getSummaryEmbedding() : List.of(),
                "parent", node.getParentSourceIdentifier(),
                "children", node.getChildrenSourceIdentifiers() != null ? node.getChildrenSourceIdentifiers() : List.of()
        );

        return template.write("CreateNode", tx -> tx.run(cypher, params).single().get("id").asString());
    }

    @Override
    public void createChildEdge(String parentId, String childId) {
        String cypher = """
                MATCH (p) WHERE elementId(p) = $parentId
                MATCH (c) WHERE elementId(c) = $childId
                MERGE (p)-[:CHILD]->(c)
                RETURN count(*) AS linked
                """;

        long linked = template.write("CreateChildEdge", tx ->
                tx.run(cypher, params("parentId", parentId, "childId", childId)).single().get("linked").asLong());

        if (linked == 0) {
            throw new IllegalStateException("Cannot link " + parentId + " -> " + childId + ": endpoint not found");
        }
    }

    // ================================================================
    // VALIDATION
    // ================================================================

    @Override
    public long countReachable(String repository) {
        String cypher = """
                MATCH (:RepositoryNode {name: $repository})-[:CHILD*]->(n)
                RETURN count(DISTINCT n) AS count
                """;

        return template.read("CountReachable", tx ->
                tx.run(cypher, params("repository", repository)).single().get("count").asLong());
    }

    @Override
    public long countOrphaned() {
        String cypher = "MATCH (n:" + TRACKED + ")\n"
                + "WHERE NOT EXISTS { MATCH (:RepositoryNode)-[:CHILD*]->(n) }\n"
                + "RETURN count(n) AS count";

        return template.read("CountOrphaned", tx -> tx.run(cypher).single().get("count").asLong());
    }

    // ================================================================
    // RETRIEVAL
    // ================================================================

    @Override
    public List<CodeNode> findByKeywords(List<String> keywords, int limit, String repository) {
        String match = repository != null
                ? "MATCH (:RepositoryNode {name: $repository})-[:CHILD*]->(n:" + TRACKED + ")\nWITH DISTINCT n\n"
                : "MATCH (n:" + TRACKED + ")\n";

        String cypher = match
                + "WHERE ANY(kw IN $keywords WHERE toLower(coalesce(n.name, '')) CONTAINS kw)\n"
                + "   OR ANY(kw IN $keywords WHERE toLower(coalesce(n.summary, '')) CONTAINS kw)\n"
                + "RETURN " + projection("n")
                + "LIMIT $limit";

        Map<String, Object> params = params("keywords", keywords, "limit", limit);
        if (repository != null) {
            params.put("repository", repository);
        }

        return template.read("FindByKeywords", tx -> tx.run(cypher, params).list(Neo4jCodeGraphStore::toCodeNode));
    }

    @Override
    public List<CodeNode> findChildren(NodeKind kind, String name, int limit, String repository) {
        String cypher = "MATCH (n:" + kind.getLabel() + " {name: $name})-[:CHILD*1..2]->(child)\n"
                + (repository != null ? "WHERE " + repositoryScope("n") + "\n" : "")
                + "WITH DISTINCT child\n"
                + "RETURN " + projection("child")
                + "ORDER BY lineno\n"
                + "LIMIT $limit";

        return template.read("FindChildren", tx ->
                tx.run(cypher, neighbourParams(name, limit, repository)).list(Neo4jCodeGraphStore::toCodeNode));
    }

    @Override
    public List<CodeNode> findParents(NodeKind kind, String name, int limit, String repository) {
        String cypher = "MATCH (parent:" + TRACKED + ")-[:CHILD*1..2]->(n:" + kind.getLabel() + " {name: $name})\n"
                + (repository != null ? "WHERE " + repositoryScope("parent") + "\n" : "")
                + "WITH DISTINCT parent\n"
                + "RETURN " + projection("parent")
                + "ORDER BY lineno\n"
                + "LIMIT $limit";

        return template.read("FindParents", tx ->
                tx.run(cypher, neighbourParams(name, limit, repository)).list(Neo4jCodeGraphStore::toCodeNode));
    }

    private Map<String, Object> neighbourParams(String name, int limit, String repository) {
        Map<String, Object> params = params("name", name, "limit", limit);
        if (repository != null) {
            params.put("repository", repository);
        }
        return params;
    }

    // ================================================================
    // ENRICHMENT
    // ================================================================

    @Override
    public List<CodeNode> findUnsummarized(String repository) {
        String cypher = "MATCH (:RepositoryNode {name: $repository})-[:CHILD*]->(n:" + TRACKED + ")\n"
                + "WITH DISTINCT n\n"
                + "WHERE n.summary IS NULL OR trim(n.summary) = '' OR n.summary = $placeholder\n"
                + "RETURN " + projection("n");

        return template.read("FindUnsummarized", tx ->
                tx.run(cypher, params("repository", repository, "placeholder", CodeNode.SUMMARY_PLACEHOLDER))
                        .list(Neo4jCodeGraphStore::toCodeNode));
    }

    @Override
    public void updateEnrichment(String nodeId, String summary, List<Double> summaryEmbedding, List<Double> codeEmbedding) {
        String cypher = """
                MATCH (n) WHERE elementId(n) = $id
                SET n.summary = $summary,
                    n.summary_embedding = $summaryEmbedding,
                    n.code_embedding = $codeEmbedding
                RETURN count(n) AS updated
                """;

        long updated = template.write("UpdateEnrichment", tx -> tx.run(cypher, params(
                "id", nodeId,
                "summary", summary,
                "summaryEmbedding", summaryEmbedding,
                "codeEmbedding", codeEmbedding
        )).single().get("updated").asLong());

        if (updated == 0) {
            throw new IllegalStateException("Node " + nodeId + " no longer exists");
        }
    }
}
