package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "qwen2.5-coder:7b";

    /**
     * nomic-embed-text produces 768-dimensional vectors.
     */
    @NotBlank
    private String embeddingModel = "nomic-embed-text";

    @Min(1)
    private int numCtx = 8192;

    @Min(1)
    private int connectTimeoutMs = 10_000;

    @Min(1)
    private int readTimeoutMinutes = 5;

    /**
     * Summaries are generated from at most this many characters of source.
     */
    @Min(1)
    private int maxCodeChars = 12_000;
}
