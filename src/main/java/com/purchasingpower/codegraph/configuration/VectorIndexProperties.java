package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class VectorIndexProperties {

    /**
     * Embedding dimension; must match what the embedding model returns.
     */
    @Min(1)
    private int dimension = 768;

    /**
     * Create the six vector indexes at startup when they are missing.
     */
    private boolean createOnStartup = true;
}
