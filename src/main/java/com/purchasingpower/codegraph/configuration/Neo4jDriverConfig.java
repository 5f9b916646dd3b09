package com.purchasingpower.codegraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Creates the single Neo4j {@link Driver} shared by the store and the vector index provider.
 * The driver connects lazily; nothing here touches the database.
 */
@Slf4j
@Configuration
public class Neo4jDriverConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(CodeGraphProperties properties) {
        Neo4jProperties neo4j = properties.getNeo4j();
        if (neo4j.getPassword() == null || neo4j.getPassword().isBlank()) {
            log.warn("⚠️ codegraph.neo4j.password is empty; authentication will fail against a secured server");
        }

        log.info("Connecting to Neo4j at: {} (database: {})", neo4j.getUri(), neo4j.getDatabase());

        Config config = Config.builder()
                .withMaxConnectionPoolSize(neo4j.getMaxConnectionPoolSize())
                .withConnectionAcquisitionTimeout(neo4j.getConnectionAcquisitionTimeoutSeconds(), TimeUnit.SECONDS)
                .build();

        return GraphDatabase.driver(neo4j.getUri(),
                AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword() != null ? neo4j.getPassword() : ""),
                config);
    }
}
