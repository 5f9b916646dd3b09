package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.model.retrieval.NodeKey;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-request accumulator merging strategy results by (type, name).
 *
 * <p>Not thread-safe; create one per retrieval. Inputs are copied, never mutated.
 */
public class ScoreFusion {

    private static final Comparator<RetrievedNode> BY_SCORE_DESC =
            Comparator.comparingDouble(RetrievedNode::getScore).reversed();

    private final Map<NodeKey, RetrievedNode> fused = new LinkedHashMap<>();

    /**
     * Adds results not seen yet, scaled by {@code weight}.
     */
    public void add(List<RetrievedNode> results, double weight) {
        for (RetrievedNode result : firstPerKey(results)) {
            fused.putIfAbsent(result.key(), scaled(result, weight));
        }
    }

    /**
     * New results enter scaled by {@code weight}; results already present gain
     * {@code boost × score} (capped at 1.0) and become {@link SearchType#HYBRID}.
     */
    public void reinforce(List<RetrievedNode> results, double weight, double boost) {
        for (RetrievedNode result : firstPerKey(results)) {
            RetrievedNode existing = fused.get(result.key());
            if (existing != null) {
                existing.setScore(clamp(existing.getScore() + result.getScore() * boost));
                existing.setSearchType(SearchType.HYBRID);
            } else {
                fused.put(result.key(), scaled(result, weight));
            }
        }
    }

    public int size() {
        return fused.size();
    }

    /**
     * Fused candidates, highest score first, truncated to {@code k}.
     */
    public List<RetrievedNode> ranked(int k) {
        List<RetrievedNode> ranked = new ArrayList<>(fused.values());
        ranked.sort(BY_SCORE_DESC);
        return new ArrayList<>(ranked.subList(0, Math.min(Math.max(k, 0), ranked.size())));
    }

    /**
     * Final ordering of a ranked-plus-enriched list: keep the first entry per (type, name) in
     * list order, sort by score (stable), truncate to {@code k}. A fused result therefore
     * always wins over a later neighbour copy of itself.
     */
    public static List<RetrievedNode> assemble(List<RetrievedNode> enriched, int k) {
        List<RetrievedNode> deduplicated = new ArrayList<>(firstPerKey(enriched));
        deduplicated.sort(BY_SCORE_DESC);
        return new ArrayList<>(deduplicated.subList(0, Math.min(Math.max(k, 0), deduplicated.size())));
    }

    private static List<RetrievedNode> firstPerKey(List<RetrievedNode> results) {
        if (results == null) {
            return List.of();
        }
        Set<NodeKey> seen = new LinkedHashSet<>();
        List<RetrievedNode> unique = new ArrayList<>();
        for (RetrievedNode result : results) {
            if (result != null && seen.add(result.key())) {
                unique.add(result);
            }
        }
        return unique;
    }

    private static RetrievedNode scaled(RetrievedNode result, double weight) {
        return result.toBuilder().score(clamp(result.getScore() * weight)).build();
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
