package com.purchasingpower.codegraph.client;

import com.purchasingpower.codegraph.model.graph.NodeKind;

/**
 * Produces a natural-language summary of a code span.
 */
public interface SummaryProvider {

    /**
     * @throws com.purchasingpower.codegraph.exception.SummaryException when the service fails
     */
    String summarize(NodeKind kind, String name, String code);
}
