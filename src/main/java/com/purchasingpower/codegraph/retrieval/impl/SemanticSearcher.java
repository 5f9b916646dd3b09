package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.client.EmbeddingProvider;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.RetrievalProperties;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.graph.EmbeddingField;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.ScoredNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;
import com.purchasingpower.codegraph.storage.VectorIndexProvider;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Vector search over one embedding field of every node kind.
 *
 * <p>The query is embedded once; each kind's index is queried separately and the hits are
 * merged by raw similarity. A failing index is skipped, a failing embedding call makes the
 * whole search return nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticSearcher {

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexProvider vectorIndexProvider;
    private final CodeGraphProperties properties;

    public List<RetrievedNode> search(String query, int topK, EmbeddingField field, String repository) {
        if (query == null || query.isBlank()) {
            log.warn("⚠️ Empty query provided to semantic search");
            return List.of();
        }

        RetrievalProperties retrieval = properties.getRetrieval();
        int k = topK;
        if (k < 1 || k > retrieval.getMaxSemanticResults()) {
            log.warn("⚠️ Invalid top_k value: {}, using default {}", topK, retrieval.getDefaultSemanticResults());
            k = retrieval.getDefaultSemanticResults();
        }

        log.debug("🔍 Semantic search on {}: {} (repo={})", field, ExternalCallLogger.truncate(query, 50), repository);

        List<Double> embedding;
        try {
            embedding = embeddingProvider.embed(query);
        } catch (RuntimeException e) {
            log.error("❌ Failed to generate embedding for query: {}", e.getMessage());
            return List.of();
        }

        SearchType searchType = field == EmbeddingField.CODE ? SearchType.CODE : SearchType.SUMMARY;
        List<RetrievedNode> results = new ArrayList<>();

        for (NodeKind kind : NodeKind.values()) {
            String indexName = kind.indexName(field);
            try {
                List<ScoredNode> hits = vectorIndexProvider.search(indexName, k, embedding, repository);
                for (ScoredNode hit : hits) {
                    results.add(RetrievedNode.from(hit.node().toBuilder().kind(kind).build(), hit.score(), searchType));
                }
                log.debug("✅ Found {} results from {}", hits.size(), indexName);
            } catch (GraphStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("⚠️ Error querying {}: {}", indexName, e.getMessage());
            }
        }

        results.sort(Comparator.comparingDouble(RetrievedNode::getScore).reversed());
        List<RetrievedNode> top = new ArrayList<>(results.subList(0, Math.min(k, results.size())));
        log.debug("🎯 Retrieved {} {} results", top.size(), searchType.wireName());
        return top;
    }
}
