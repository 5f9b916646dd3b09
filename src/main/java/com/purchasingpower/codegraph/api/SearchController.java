package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.retrieval.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for retrieval.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    static final int DEFAULT_K = 5;

    private final RetrievalService retrievalService;

    /**
     * POST /api/v1/search
     */
    @PostMapping
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        try {
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("Query is required"));
            }

            int k = request.getK() != null ? request.getK() : DEFAULT_K;
            if (k < 1) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("k must be at least 1"));
            }

            boolean multiStrategy = request.getMultiStrategy() == null || request.getMultiStrategy();
            log.info("Search (k={}, multiStrategy={}): {}", k, multiStrategy, request.getQuery());

            List<RetrievedNode> results = multiStrategy
                ? retrievalService.retrieveTopK(request.getQuery(), k, request.getRepository())
                : retrievalService.retrieveSemantic(request.getQuery(), k, request.getRepository());

            return ResponseEntity.ok(SearchResponse.success(results));

        } catch (GraphStoreUnavailableException e) {
            log.error("Graph store unavailable during search", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(SearchResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }
}
