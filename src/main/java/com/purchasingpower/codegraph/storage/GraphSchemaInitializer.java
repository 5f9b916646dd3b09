package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the repository-name constraint and the vector indexes once the application is up.
 * Failures are logged; the service still starts so it can report the store as unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphSchemaInitializer {

    private final Neo4jSessionTemplate template;
    private final VectorIndexProvider vectorIndexProvider;
    private final CodeGraphProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        try {
            template.write("CreateRepositoryConstraint", tx -> tx.run("""
                    CREATE CONSTRAINT repository_name IF NOT EXISTS
                    FOR (r:RepositoryNode) REQUIRE r.name IS UNIQUE
                    """).consume());
            log.info("Neo4j repository constraint ready");
        } catch (RuntimeException e) {
            log.warn("Failed to create repository constraint (may already exist): {}", e.getMessage());
        }

        if (properties.getVector().isCreateOnStartup()) {
            vectorIndexProvider.ensureIndexes(properties.getVector().getDimension());
        }
    }
}
