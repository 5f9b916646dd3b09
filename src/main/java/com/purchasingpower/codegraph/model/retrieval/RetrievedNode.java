package com.purchasingpower.codegraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a retrieval answer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievedNode {

    private NodeKind type;
    private String name;
    private String summary;
    private String code;
    private int lineno;
    private double score;

    @JsonProperty("search_type")
    private SearchType searchType;

    /**
     * Only set on enrichment results.
     */
    private Relation relation;

    @JsonIgnore
    public NodeKey key() {
        return new NodeKey(type, name);
    }

    public static RetrievedNode from(CodeNode node, double score, SearchType searchType) {
        return RetrievedNode.builder()
                .type(node.getKind())
                .name(node.getName())
                .summary(node.getSummary() != null ? node.getSummary() : "")
                .code(node.getCode() != null ? node.getCode() : "")
                .lineno(node.getLineno())
                .score(score)
                .searchType(searchType)
                .build();
    }
}
