package com.purchasingpower.codegraph.client;

import java.util.List;

/**
 * Turns text into a fixed-dimension vector.
 */
public interface EmbeddingProvider {

    String getProviderName();

    /**
     * @throws com.purchasingpower.codegraph.exception.EmbeddingException when the service fails
     */
    List<Double> embed(String text);
}
