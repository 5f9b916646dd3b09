package com.purchasingpower.codegraph.service.enrichment.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.client.EmbeddingProvider;
import com.purchasingpower.codegraph.client.SummaryProvider;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.EmbeddingException;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.enrichment.EnrichmentReport;
import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.service.enrichment.NodeEnrichmentService;
import com.purchasingpower.codegraph.storage.CodeGraphStore;
import com.purchasingpower.codegraph.storage.VectorIndexProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class NodeEnrichmentServiceImpl implements NodeEnrichmentService {

    private final CodeGraphStore graphStore;
    private final VectorIndexProvider vectorIndexProvider;
    private final SummaryProvider summaryProvider;
    private final EmbeddingProvider embeddingProvider;
    private final CodeGraphProperties properties;

    @Override
    public EnrichmentReport enrichRepository(String repositoryName) {
        Preconditions.checkArgument(repositoryName != null && !repositoryName.isBlank(), "Repository name is required");

        long start = System.currentTimeMillis();
        List<CodeNode> candidates = graphStore.findUnsummarized(repositoryName);
        log.info("📝 Enriching {} nodes of {} with {}", candidates.size(), repositoryName,
                embeddingProvider.getProviderName());

        EnrichmentReport report = EnrichmentReport.builder()
                .repository(repositoryName)
                .candidates(candidates.size())
                .build();

        for (CodeNode node : candidates) {
            try {
                enrichNode(node);
                report.setEnriched(report.getEnriched() + 1);
            } catch (GraphStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("❌ Error enriching {} {}: {}", node.getKind().getTypeName(), node.getName(), e.getMessage());
                report.setFailed(report.getFailed() + 1);
                report.getFailedNodes().add(node.getKind().getLabel() + ":" + node.getName());
            }
        }

        if (report.getEnriched() > 0) {
            vectorIndexProvider.ensureIndexes(properties.getVector().getDimension());
            report.setIndexesEnsured(true);
        }

        report.setDurationMs(System.currentTimeMillis() - start);
        log.info("✅ Enrichment of {} done: {} enriched, {} failed ({}ms)",
                repositoryName, report.getEnriched(), report.getFailed(), report.getDurationMs());
        return report;
    }

    private void enrichNode(CodeNode node) {
        String summary = summaryProvider.summarize(node.getKind(), node.getName(), node.getCode());
        List<Double> summaryEmbedding = checkDimension(embeddingProvider.embed(summary), "summary");
        List<Double> codeEmbedding = checkDimension(embeddingProvider.embed(codeText(node)), "code");

        graphStore.updateEnrichment(node.getId(), summary, summaryEmbedding, codeEmbedding);
        log.debug("✅ Enriched {} node: {}", node.getKind().getTypeName(), node.getName());
    }

    /**
     * Files with no body (e.g. an empty {@code __init__.py}) still get a code vector.
     */
    private String codeText(CodeNode node) {
        return node.getCode() != null && !node.getCode().isBlank() ? node.getCode() : node.getName();
    }

    private List<Double> checkDimension(List<Double> vector, String field) {
        int expected = properties.getVector().getDimension();
        if (vector == null || vector.size() != expected) {
            throw new EmbeddingException("Expected " + field + " embedding of dimension " + expected
                    + " but got " + (vector == null ? "none" : vector.size()));
        }
        return vector;
    }
}
