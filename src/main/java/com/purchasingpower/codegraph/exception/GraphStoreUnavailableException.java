package com.purchasingpower.codegraph.exception;

/**
 * The graph store cannot be reached at all. Unlike per-query failures, this is never
 * absorbed by the retrieval strategies.
 */
public class GraphStoreUnavailableException extends RuntimeException {

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
