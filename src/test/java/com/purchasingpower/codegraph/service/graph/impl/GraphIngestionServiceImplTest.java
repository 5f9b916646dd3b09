package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.graph.ParsedFile;
import com.purchasingpower.codegraph.model.graph.ParsedNode;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import com.purchasingpower.codegraph.model.ingest.IngestReport;
import com.purchasingpower.codegraph.model.ingest.IngestReport.SkipReason;
import com.purchasingpower.codegraph.model.ingest.IngestionResult;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;
import com.purchasingpower.codegraph.storage.InMemoryCodeGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Graph ingestion")
class GraphIngestionServiceImplTest {

    private InMemoryCodeGraphStore store;
    private GraphIngestionServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCodeGraphStore();
        service = new GraphIngestionServiceImpl(store);
    }

    @Test
    @DisplayName("Demo repository with one function is fully connected")
    void demoRepository_isFullyConnected() {
        // Given
        ParsedFile demo = file("demo.py", "def foo(): pass", function("foo", 1, "def foo(): pass"));

        // When
        IngestionResult result = service.ingestAll("demo", List.of(demo));

        // Then
        assertThat(result.reports()).singleElement().satisfies(report -> {
            assertThat(report.isClean()).isTrue();
            assertThat(report.getPersistedNodes()).isEqualTo(2);
            assertThat(report.getLinkedEdges()).isEqualTo(2);
        });
        assertThat(result.validation()).contains(new StructureValidation(2, 0));
    }

    @Test
    @DisplayName("Creating the same repository twice reuses the node")
    void createRepository_isIdempotent() {
        RepositoryNode first = service.createRepository("demo");
        RepositoryNode second = service.createRepository("demo");

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(service.listRepositories()).hasSize(1);
    }

    @Test
    @DisplayName("Blank repository name is rejected")
    void createRepository_blankName() {
        assertThatThrownBy(() -> service.createRepository("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Nested classes and methods hang under their parents in extractor order")
    void nestedHierarchy_preservesParentage() {
        // Given
        ParsedNode method = function("run", 3, "def run(self): ...");
        ParsedNode helper = function("helper", 5, "def helper(self): ...");
        ParsedNode worker = node("class", "Worker", 2, List.of(method, helper));
        ParsedFile file = file("worker.py", "class Worker: ...", worker, function("main", 10, "def main(): ..."));

        // When
        service.ingestAll("jobs", List.of(file));

        // Then
        assertThat(store.childNamesOf("worker.py")).containsExactly("Worker", "main");
        assertThat(store.childNamesOf("Worker")).containsExactly("run", "helper");
        assertThat(service.validateStructure("jobs")).contains(new StructureValidation(5, 0));

        CodeNode workerNode = findNode("Worker");
        assertThat(workerNode.getKind()).isEqualTo(NodeKind.CLASS);
        assertThat(workerNode.getChildrenSourceIdentifiers()).containsExactly("run", "helper");
        assertThat(workerNode.hasSummary()).isFalse();
    }

    @Test
    @DisplayName("File node gets line 0 and async functions are flagged")
    void fileAndAsyncAttributes() {
        ParsedNode fetch = node("async_function", "fetch", 4, List.of());
        fetch.setParameters(List.of("url", "timeout"));

        service.ingestAll("net", List.of(file("client.py", "async def fetch(url, timeout): ...", fetch)));

        assertThat(findNode("client.py").getLineno()).isZero();
        CodeNode fetchNode = findNode("fetch");
        assertThat(fetchNode.getKind()).isEqualTo(NodeKind.FUNCTION);
        assertThat(fetchNode.isAsync()).isTrue();
        assertThat(fetchNode.getParameters()).containsExactly("url", "timeout");
    }

    @Test
    @DisplayName("Unknown node types are skipped together with their subtree")
    void unknownType_skipsSubtree() {
        // Given
        ParsedNode decorator = node("decorator", "cached", 1, List.of(function("inner", 2, "def inner(): ...")));
        ParsedFile file = file("tools.py", "...", decorator, function("bar", 5, "def bar(): ..."));

        // When
        IngestReport report = service.ingestAll("tools", List.of(file)).reports().get(0);

        // Then
        assertThat(report.getPersistedNodes()).isEqualTo(2);
        assertThat(report.getSkipped()).singleElement().satisfies(skipped -> {
            assertThat(skipped.name()).isEqualTo("cached");
            assertThat(skipped.reason()).isEqualTo(SkipReason.UNKNOWN_TYPE);
        });
        assertThat(store.nodes()).extracting(CodeNode::getName).containsExactly("tools.py", "bar");
        assertThat(service.validateStructure("tools")).contains(new StructureValidation(2, 0));
    }

    @Test
    @DisplayName("A node that fails to persist leaves its children persisted but unattached")
    void persistenceFailure_childrenAreUnlinked() {
        // Given
        store.failCreateWhen(node -> "Broken".equals(node.getName()));
        ParsedNode broken = node("class", "Broken", 1, List.of(function("method", 2, "def method(self): ...")));
        ParsedFile file = file("broken.py", "...", broken, function("fine", 8, "def fine(): ..."));

        // When
        IngestReport report = service.ingestAll("shaky", List.of(file)).reports().get(0);

        // Then
        assertThat(report.isClean()).isFalse();
        assertThat(report.getSkipped()).extracting(IngestReport.SkippedNode::reason)
                .containsExactly(SkipReason.PERSISTENCE_FAILURE);
        assertThat(report.getUnlinked()).containsExactly("method");
        assertThat(store.nodes()).extracting(CodeNode::getName).contains("method", "fine");
        assertThat(service.validateStructure("shaky")).contains(new StructureValidation(2, 1));
    }

    @Test
    @DisplayName("Nodes without a name are not persisted")
    void missingName_isSkipped() {
        ParsedFile file = file("anon.py", "...", function(null, 1, "lambda: None"));

        IngestReport report = service.ingestAll("anon", List.of(file)).reports().get(0);

        assertThat(report.getSkipped()).singleElement()
                .extracting(IngestReport.SkippedNode::reason).isEqualTo(SkipReason.PERSISTENCE_FAILURE);
        assertThat(store.nodes()).hasSize(1);
    }

    @Test
    @DisplayName("A failed edge is reported and the walk continues")
    void linkFailure_isReported() {
        store.failEdgeTo("first");
        ParsedFile file = file("pair.py", "...", function("first", 1, "..."), function("second", 3, "..."));

        IngestReport report = service.ingestAll("pair", List.of(file)).reports().get(0);

        assertThat(report.getLinkFailures()).containsExactly("pair.py -> first");
        assertThat(report.getPersistedNodes()).isEqualTo(3);
        assertThat(service.validateStructure("pair")).contains(new StructureValidation(2, 1));
    }

    @Test
    @DisplayName("Missing file name falls back to unknown_file")
    void missingFileName() {
        ParsedFile file = file(null, "x = 1");

        IngestReport report = service.ingestAll("misc", List.of(file)).reports().get(0);

        assertThat(report.getFileName()).isEqualTo(ParsedFile.UNKNOWN_FILE);
        assertThat(report.isFileNodeCreated()).isTrue();
    }

    @Test
    @DisplayName("Child identifiers keep one entry per attempted child, nameless ones included")
    void childIdentifiers_matchAttemptedChildren() {
        ParsedFile file = file("mixed.py", "...", function("foo", 1, "def foo(): ..."),
                function(null, 3, "lambda: None"), node("decorator", "cached", 5, List.of()));

        IngestReport report = service.ingestAll("mixed", List.of(file)).reports().get(0);

        assertThat(report.getSkipped()).hasSize(2);
        assertThat(findNode("mixed.py").getChildrenSourceIdentifiers())
                .containsExactly("foo", "", "cached")
                .hasSameSizeAs(file.getChildren());
    }

    @Test
    @DisplayName("Batch ingestion keeps its reports when validation counts fail")
    void ingestAll_validationUnavailable() {
        store.failCounts();

        IngestionResult result = service.ingestAll("demo", List.of(file("demo.py", "...", function("foo", 1, "..."))));

        assertThat(result.reports()).singleElement().satisfies(report -> assertThat(report.isClean()).isTrue());
        assertThat(result.validation()).isEmpty();
    }

    @Test
    @DisplayName("Validation reports empty when the store is unreachable")
    void validateStructure_storeUnavailable() {
        service.createRepository("demo");
        store.setUnavailable(true);

        assertThat(service.validateStructure("demo")).isEmpty();
    }

    @Test
    @DisplayName("Deleting a repository removes everything below it")
    void deleteRepository_cascades() {
        service.ingestAll("demo", List.of(file("demo.py", "...", function("foo", 1, "..."))));

        long deleted = service.deleteRepository("demo");

        assertThat(deleted).isEqualTo(3);
        assertThat(store.nodes()).isEmpty();
        assertThat(service.listRepositories()).isEmpty();
        assertThat(service.deleteRepository("demo")).isZero();
    }

    private CodeNode findNode(String name) {
        return store.nodes().stream()
                .filter(node -> name.equals(node.getName()))
                .findFirst()
                .orElseThrow();
    }

    private static ParsedFile file(String name, String code, ParsedNode... children) {
        return ParsedFile.builder()
                .file(name)
                .code(code)
                .children(new ArrayList<>(List.of(children)))
                .build();
    }

    private static ParsedNode function(String name, int lineno, String code) {
        return ParsedNode.builder()
                .type("function")
                .name(name)
                .lineno(lineno)
                .code(code)
                .build();
    }

    private static ParsedNode node(String type, String name, int lineno, List<ParsedNode> children) {
        return ParsedNode.builder()
                .type(type)
                .name(name)
                .lineno(lineno)
                .code("...")
                .children(new ArrayList<>(children))
                .build();
    }
}
