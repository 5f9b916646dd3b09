package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.RetrievalProperties;
import com.purchasingpower.codegraph.model.graph.EmbeddingField;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.retrieval.RetrievalService;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the strategies in a fixed order, because later ones reinforce the
 * higher-precision earlier ones:
 * <ol>
 *   <li>summary-semantic search (weight 1.0)</li>
 *   <li>keyword graph search (0.6 new, +0.3 boost)</li>
 *   <li>code-semantic search for k/2 (0.4 new, +0.2 boost)</li>
 *   <li>neighbour enrichment of the top fused results</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private final SemanticSearcher semanticSearcher;
    private final KeywordSearcher keywordSearcher;
    private final NeighborEnricher neighborEnricher;
    private final CodeGraphProperties properties;

    @Override
    public List<RetrievedNode> retrieveTopK(String query, int k, String repository) {
        if (query == null || query.isBlank() || k < 1) {
            log.warn("⚠️ Nothing to retrieve (query blank or k={})", k);
            return List.of();
        }

        String repo = normalize(repository);
        RetrievalProperties retrieval = properties.getRetrieval();
        log.info("🔍 Retrieving top {} results for query: {} (repo={})", k, ExternalCallLogger.truncate(query, 50), repo);

        ScoreFusion fusion = new ScoreFusion();

        log.debug("📌 Strategy 1: Semantic search on summaries");
        fusion.add(semanticSearcher.search(query, k, EmbeddingField.SUMMARY, repo), retrieval.getSummaryWeight());

        log.debug("📌 Strategy 2: Graph-based keyword search");
        fusion.reinforce(keywordSearcher.search(query, k, repo), retrieval.getKeywordWeight(), retrieval.getKeywordBoost());

        log.debug("📌 Strategy 3: Code embedding search");
        fusion.reinforce(semanticSearcher.search(query, Math.max(1, k / 2), EmbeddingField.CODE, repo),
                retrieval.getCodeWeight(), retrieval.getCodeBoost());

        List<RetrievedNode> ranked = fusion.ranked(k);
        log.debug("Fused {} candidates, kept {}", fusion.size(), ranked.size());

        log.debug("📌 Strategy 4: Enriching with related nodes");
        List<RetrievedNode> enriched = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            RetrievedNode result = ranked.get(i);
            enriched.add(result);
            if (i < retrieval.getEnrichTopResults()) {
                enriched.addAll(neighborEnricher.related(result, repo));
            }
        }

        List<RetrievedNode> results = ScoreFusion.assemble(enriched, k);
        log.info("✅ Returning {} results (multi-strategy)", results.size());
        return results;
    }

    @Override
    public List<RetrievedNode> retrieveSemantic(String query, int k, String repository) {
        if (query == null || query.isBlank() || k < 1) {
            log.warn("⚠️ Nothing to retrieve (query blank or k={})", k);
            return List.of();
        }

        List<RetrievedNode> results = semanticSearcher.search(query, k, EmbeddingField.SUMMARY, normalize(repository));
        log.info("✅ Returning {} results (semantic only)", results.size());
        return results;
    }

    private static String normalize(String repository) {
        return repository == null || repository.isBlank() ? null : repository.trim();
    }
}
