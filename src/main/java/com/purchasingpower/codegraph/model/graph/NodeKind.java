package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Discriminant for the three tracked code node types.
 *
 * <p>Every kind-dependent decision (graph label, extractor type strings, vector index
 * names) goes through this table instead of branching on classes. The extractor reports
 * {@code async_function} separately; it maps onto {@link #FUNCTION} with the async flag set
 * on the node.
 */
public enum NodeKind {
    FILE("FileNode", "file", List.of("file")),
    CLASS("ClassNode", "class", List.of("class")),
    FUNCTION("FunctionNode", "function", List.of("function", "async_function"));

    public static final String ASYNC_FUNCTION_TYPE = "async_function";

    private static final Map<String, NodeKind> BY_EXTRACTOR_TYPE = Arrays.stream(values())
            .flatMap(kind -> kind.extractorTypes.stream().map(type -> Map.entry(type, kind)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private static final Map<String, NodeKind> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::getLabel, Function.identity()));

    private final String label;
    private final String typeName;
    private final List<String> extractorTypes;

    NodeKind(String label, String typeName, List<String> extractorTypes) {
        this.label = label;
        this.typeName = typeName;
        this.extractorTypes = extractorTypes;
    }

    /**
     * Neo4j label, also the {@code type} value exposed in retrieval results.
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Value of the {@code type} property written on the node.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Name of the vector index covering {@code field} for this kind,
     * e.g. {@code functionSummaryEmbeddingIndex}.
     */
    public String indexName(EmbeddingField field) {
        return typeName + field.getIndexSuffix() + "EmbeddingIndex";
    }

    public static Optional<NodeKind> fromExtractorType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTRACTOR_TYPE.get(type.trim().toLowerCase(Locale.ROOT)));
    }

    public static boolean isAsyncType(String type) {
        return type != null && ASYNC_FUNCTION_TYPE.equalsIgnoreCase(type.trim());
    }

    @JsonCreator
    public static NodeKind fromLabel(String label) {
        NodeKind kind = BY_LABEL.get(label);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node label: " + label);
        }
        return kind;
    }

    /**
     * Cypher label expression matching any tracked kind: {@code FileNode|ClassNode|FunctionNode}.
     */
    public static String labelExpression() {
        return Arrays.stream(values()).map(NodeKind::getLabel).collect(Collectors.joining("|"));
    }
}
