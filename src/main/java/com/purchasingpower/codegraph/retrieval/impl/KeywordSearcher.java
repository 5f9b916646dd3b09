package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;
import com.purchasingpower.codegraph.storage.CodeGraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Keyword match on node names and summaries.
 *
 * <p>Score is the fraction of query keywords found (case-insensitive substring) in the
 * node's name or summary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordSearcher {

    private final CodeGraphStore graphStore;
    private final CodeGraphProperties properties;

    public List<String> keywords(String query) {
        if (query == null) {
            return List.of();
        }
        int minLength = properties.getRetrieval().getMinKeywordLength();
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> word.length() > minLength)
                .toList();
    }

    public List<RetrievedNode> search(String query, int topK, String repository) {
        List<String> keywords = keywords(query);
        if (keywords.isEmpty() || topK < 1) {
            log.debug("No usable keywords in query, skipping graph search");
            return List.of();
        }

        List<CodeNode> candidates;
        try {
            candidates = graphStore.findByKeywords(keywords, candidateLimit(topK), repository);
        } catch (GraphStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Error in graph-based search: {}", e.getMessage());
            return List.of();
        }

        List<RetrievedNode> results = new ArrayList<>();
        for (CodeNode candidate : candidates) {
            results.add(RetrievedNode.from(candidate, score(candidate, keywords), SearchType.GRAPH));
        }

        results.sort(Comparator.comparingDouble(RetrievedNode::getScore).reversed());
        log.debug("Found {} results from graph search", results.size());
        return new ArrayList<>(results.subList(0, Math.min(topK, results.size())));
    }

    static int candidateLimit(int topK) {
        return Math.min(topK, Integer.MAX_VALUE / 2) * 2;
    }

    double score(CodeNode node, List<String> keywords) {
        String name = node.getName() != null ? node.getName().toLowerCase(Locale.ROOT) : "";
        String summary = node.getSummary() != null ? node.getSummary().toLowerCase(Locale.ROOT) : "";
        long matches = keywords.stream()
                .filter(keyword -> name.contains(keyword) || summary.contains(keyword))
                .count();
        return (double) matches / keywords.size();
    }
}
