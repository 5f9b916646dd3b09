package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

    private boolean success;
    private String error;

    @Builder.Default
    private List<RetrievedNode> results = new ArrayList<>();

    public static SearchResponse success(List<RetrievedNode> results) {
        return SearchResponse.builder()
            .success(true)
            .results(results)
            .build();
    }

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
