package com.purchasingpower.codegraph.model.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of ingesting a batch of files: one report per file plus the structure
 * validation taken right after, absent when the counts could not be obtained.
 */
public record IngestionResult(List<IngestReport> reports, Optional<StructureValidation> validation) {
}
