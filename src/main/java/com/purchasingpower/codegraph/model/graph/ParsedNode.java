package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of the structural parse tree produced by the language extractors.
 *
 * <p>{@code type} is kept as the raw extractor string so unknown types survive
 * deserialization and can be reported by the ingestor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedNode {

    private String type;

    private String name;

    private int lineno;

    private String code;

    @Builder.Default
    private List<String> parameters = new ArrayList<>();

    private String parent;

    @Builder.Default
    private List<ParsedNode> children = new ArrayList<>();

    /**
     * One entry per non-null child, in extractor order. A child without a name is listed
     * as an empty string so the list stays aligned with the children the ingestor attempts.
     */
    public List<String> childNames() {
        if (children == null) {
            return new ArrayList<>();
        }
        return children.stream()
                .filter(Objects::nonNull)
                .map(child -> child.getName() != null ? child.getName() : "")
                .toList();
    }
}
