package com.purchasingpower.codegraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call to a graph store or model endpoint: a short call id, the start time,
 * and request/response/error lines in a uniform format.
 *
 * <p>Request and response headlines go to DEBUG; ingestion issues one store call per node
 * and INFO would drown everything else. Errors always go to ERROR.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public class CallContext {

    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug("{} {} → {} [{}] {}",
                service.getEmoji(), service.getDisplayName(), operation, callId,
                summary != null ? summary : "");
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug("{} {} ← {} [{}] ({}ms) {}",
                service.getEmoji(), service.getDisplayName(), operation, callId, getElapsedMs(),
                summary != null ? summary : "");
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}: {}",
                service.getEmoji(), service.getDisplayName(), operation, callId, getElapsedMs(),
                errorMessage, ex != null ? ex.getMessage() : "");
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
