package com.purchasingpower.codegraph.service.enrichment;

import com.purchasingpower.codegraph.model.enrichment.EnrichmentReport;

/**
 * Fills in summary, summary embedding and code embedding for freshly ingested nodes.
 */
public interface NodeEnrichmentService {

    /**
     * Enriches every node under the repository that still carries the placeholder summary,
     * then makes sure the vector indexes exist. Per-node failures are counted, not thrown.
     */
    EnrichmentReport enrichRepository(String repositoryName);
}
