package com.codegraph.core.service.store;

/**
 * Thrown when the backing database cannot be reached.
 */
public class GraphStoreUnavailableException extends GraphStoreException {

    public static final String UNAVAILABLE = "GRAPH_STORE_UNAVAILABLE";

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, UNAVAILABLE, cause);
    }
}
