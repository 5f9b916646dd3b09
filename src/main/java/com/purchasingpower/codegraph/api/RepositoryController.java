package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.enrichment.EnrichmentReport;
import com.purchasingpower.codegraph.model.graph.ParsedFile;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import com.purchasingpower.codegraph.model.ingest.IngestionResult;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;
import com.purchasingpower.codegraph.service.enrichment.NodeEnrichmentService;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST controller for repository ingestion and maintenance.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/repositories")
@RequiredArgsConstructor
public class RepositoryController {

    private final GraphIngestionService ingestionService;
    private final NodeEnrichmentService enrichmentService;

    /**
     * GET /api/v1/repositories
     */
    @GetMapping
    public ResponseEntity<RepositoryResponse> listRepositories() {
        try {
            List<RepositoryNode> repositories = ingestionService.listRepositories();
            return ResponseEntity.ok(RepositoryResponse.builder()
                .success(true)
                .repositories(repositories)
                .build());
        } catch (GraphStoreUnavailableException e) {
            log.error("Graph store unavailable while listing repositories", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RepositoryResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to list repositories", e);
            return ResponseEntity.internalServerError()
                .body(RepositoryResponse.error("Failed to list repositories: " + e.getMessage()));
        }
    }

    /**
     * Ingest parsed files into a repository, then validate its structure.
     *
     * POST /api/v1/repositories/{name}/files
     */
    @PostMapping("/{name}/files")
    public ResponseEntity<IngestResponse> ingestFiles(@PathVariable String name, @RequestBody IngestRequest request) {
        try {
            List<ParsedFile> files = request.getFiles();
            if (files == null || files.isEmpty()) {
                return ResponseEntity.badRequest()
                    .body(IngestResponse.error("At least one file is required"));
            }

            log.info("Ingesting {} file(s) into repository: {}", files.size(), name);
            long start = System.currentTimeMillis();

            IngestionResult result = ingestionService.ingestAll(name, files);

            return ResponseEntity.ok(IngestResponse.success(
                name, result.reports(), result.validation().orElse(null), System.currentTimeMillis() - start));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(IngestResponse.error(e.getMessage()));
        } catch (GraphStoreUnavailableException e) {
            log.error("Graph store unavailable during ingestion", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(IngestResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Ingestion failed", e);
            return ResponseEntity.internalServerError()
                .body(IngestResponse.error("Ingestion failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/repositories/{name}/structure
     */
    @GetMapping("/{name}/structure")
    public ResponseEntity<RepositoryResponse> validateStructure(@PathVariable String name) {
        Optional<StructureValidation> validation = ingestionService.validateStructure(name);
        if (validation.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RepositoryResponse.error("Structure validation unavailable"));
        }
        return ResponseEntity.ok(RepositoryResponse.builder()
            .success(true)
            .repository(name)
            .validation(validation.get())
            .build());
    }

    /**
     * Generate summaries and embeddings for nodes not enriched yet.
     *
     * POST /api/v1/repositories/{name}/enrichment
     */
    @PostMapping("/{name}/enrichment")
    public ResponseEntity<RepositoryResponse> enrich(@PathVariable String name) {
        try {
            log.info("Enriching repository: {}", name);
            EnrichmentReport report = enrichmentService.enrichRepository(name);
            return ResponseEntity.ok(RepositoryResponse.builder()
                .success(true)
                .repository(name)
                .enrichment(report)
                .build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(RepositoryResponse.error(e.getMessage()));
        } catch (GraphStoreUnavailableException e) {
            log.error("Graph store unavailable during enrichment", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RepositoryResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Enrichment failed", e);
            return ResponseEntity.internalServerError()
                .body(RepositoryResponse.error("Enrichment failed: " + e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/repositories/{name}
     */
    @DeleteMapping("/{name}")
    public ResponseEntity<RepositoryResponse> deleteRepository(@PathVariable String name) {
        try {
            long deleted = ingestionService.deleteRepository(name);
            log.info("Deleted repository {} ({} nodes)", name, deleted);
            return ResponseEntity.ok(RepositoryResponse.builder()
                .success(true)
                .repository(name)
                .deletedNodes(deleted)
                .build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(RepositoryResponse.error(e.getMessage()));
        } catch (GraphStoreUnavailableException e) {
            log.error("Graph store unavailable during delete", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RepositoryResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Delete failed", e);
            return ResponseEntity.internalServerError()
                .body(RepositoryResponse.error("Delete failed: " + e.getMessage()));
        }
    }
}
