package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.RetrievalProperties;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.retrieval.Relation;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;
import com.purchasingpower.codegraph.storage.CodeGraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds structural neighbours of a ranked result: descendants within two CHILD hops first,
 * then ancestors within two hops, up to the configured fan-out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NeighborEnricher {

    private final CodeGraphStore graphStore;
    private final CodeGraphProperties properties;

    public List<RetrievedNode> related(RetrievedNode result, String repository) {
        RetrievalProperties retrieval = properties.getRetrieval();
        int limit = retrieval.getRelatedPerResult();
        if (limit <= 0 || result.getType() == null || result.getName() == null) {
            return List.of();
        }

        log.debug("🔗 Retrieving related nodes for {}: {} (repo={})", result.getType(), result.getName(), repository);

        List<RetrievedNode> related = new ArrayList<>();
        try {
            for (CodeNode child : graphStore.findChildren(result.getType(), result.getName(), limit, repository)) {
                related.add(neighbour(child, retrieval.getChildScore(), Relation.CHILD));
            }
            if (related.size() < limit) {
                int remaining = limit - related.size();
                for (CodeNode parent : graphStore.findParents(result.getType(), result.getName(), remaining, repository)) {
                    related.add(neighbour(parent, retrieval.getParentScore(), Relation.PARENT));
                }
            }
        } catch (GraphStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Error retrieving related nodes for {}: {}", result.getName(), e.getMessage());
        }

        return new ArrayList<>(related.subList(0, Math.min(limit, related.size())));
    }

    private RetrievedNode neighbour(CodeNode node, double score, Relation relation) {
        RetrievedNode neighbour = RetrievedNode.from(node, score, SearchType.RELATED);
        neighbour.setRelation(relation);
        return neighbour;
    }
}
