package com.purchasingpower.codegraph.model.enrichment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of populating summaries and embeddings for one repository.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentReport {

    private String repository;
    private int candidates;
    private int enriched;
    private int failed;

    @Builder.Default
    private List<String> failedNodes = new ArrayList<>();

    private boolean indexesEnsured;
    private long durationMs;
}
