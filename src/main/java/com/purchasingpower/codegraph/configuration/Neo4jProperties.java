package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class Neo4jProperties {

    @NotBlank
    private String uri = "neo4j://127.0.0.1:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "";

    @NotBlank
    private String database = "neo4j";

    @Min(1)
    private int maxConnectionPoolSize = 50;

    @Min(1)
    private long connectionAcquisitionTimeoutSeconds = 30;
}
