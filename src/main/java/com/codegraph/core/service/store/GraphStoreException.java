package com.codegraph.core.service.store;

import lombok.Getter;

/**
 * Base exception for graph store failures.
 */
@Getter
public class GraphStoreException extends RuntimeException {

    public static final String STORE_ERROR = "GRAPH_STORE_ERROR";

    private final String errorCode;

    public GraphStoreException(String message) {
        this(message, STORE_ERROR, null);
    }

    public GraphStoreException(String message, String errorCode) {
        this(message, errorCode, null);
    }

    public GraphStoreException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
