package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.model.ingest.IngestReport;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion response. {@code validation} is absent when the counts could not be obtained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResponse {

    private boolean success;
    private String error;
    private String repository;

    @Builder.Default
    private List<IngestReport> reports = new ArrayList<>();

    private StructureValidation validation;
    private long durationMs;

    public static IngestResponse success(String repository, List<IngestReport> reports,
                                         StructureValidation validation, long durationMs) {
        return IngestResponse.builder()
            .success(true)
            .repository(repository)
            .reports(reports)
            .validation(validation)
            .durationMs(durationMs)
            .build();
    }

    public static IngestResponse error(String error) {
        return IngestResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
