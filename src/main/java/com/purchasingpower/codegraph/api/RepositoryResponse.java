package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.model.enrichment.EnrichmentReport;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope for the repository endpoints; only the field relevant to the call is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RepositoryResponse {

    private boolean success;
    private String error;
    private String repository;
    private List<RepositoryNode> repositories;
    private StructureValidation validation;
    private EnrichmentReport enrichment;
    private Long deletedNodes;

    public static RepositoryResponse error(String error) {
        return RepositoryResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
