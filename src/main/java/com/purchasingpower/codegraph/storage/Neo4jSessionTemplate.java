package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Runs one managed transaction per call against the configured database.
 *
 * <p>Connectivity failures are rethrown as {@link GraphStoreUnavailableException}; every
 * other driver error propagates unchanged so callers can decide whether it is fatal.
 */
@Slf4j
@Component
public class Neo4jSessionTemplate {

    private final Driver driver;
    private final SessionConfig sessionConfig;

    public Neo4jSessionTemplate(Driver driver, CodeGraphProperties properties) {
        this.driver = driver;
        this.sessionConfig = SessionConfig.forDatabase(properties.getNeo4j().getDatabase());
    }

    public <T> T read(String operation, TransactionCallback<T> work) {
        return execute(operation, false, work);
    }

    public <T> T write(String operation, TransactionCallback<T> work) {
        return execute(operation, true, work);
    }

    private <T> T execute(String operation, boolean write, TransactionCallback<T> work) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        call.logRequest(write ? "write" : "read");

        try (Session session = driver.session(sessionConfig)) {
            T result = write ? session.executeWrite(work) : session.executeRead(work);
            call.logResponse("ok");
            return result;
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            call.logError("Graph store unavailable", e);
            throw new GraphStoreUnavailableException("Neo4j is unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            call.logError("Query failed", e);
            throw e;
        }
    }

    /**
     * Builds a parameter map, replacing nulls with empty strings.
     */
    public static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            params.put((String) keyValues[i], value != null ? value : "");
        }
        return params;
    }
}
