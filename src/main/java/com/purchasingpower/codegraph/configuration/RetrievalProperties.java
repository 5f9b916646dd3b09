package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Weights and limits of the multi-strategy retrieval.
 *
 * <pre>
 * codegraph:
 *   retrieval:
 *     summary-weight: 1.0
 *     keyword-weight: 0.6
 *     keyword-boost: 0.3
 *     code-weight: 0.4
 *     code-boost: 0.2
 *     enrich-top-results: 3
 *     related-per-result: 2
 * </pre>
 */
@Data
public class RetrievalProperties {

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double summaryWeight = 1.0;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double keywordWeight = 0.6;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double keywordBoost = 0.3;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double codeWeight = 0.4;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double codeBoost = 0.2;

    @Min(0)
    private int enrichTopResults = 3;

    @Min(0)
    private int relatedPerResult = 2;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double childScore = 0.8;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double parentScore = 0.7;

    /**
     * Keywords must be longer than this many characters.
     */
    @Min(0)
    private int minKeywordLength = 2;

    /**
     * Largest per-strategy request a semantic search accepts; beyond it the default applies.
     */
    @Min(1)
    private int maxSemanticResults = 50;

    @Min(1)
    private int defaultSemanticResults = 10;
}
