package com.codegraph.core.service.store;

/**
 * Thrown when a store operation is invoked before {@link GraphStore#connect()}.
 */
public class GraphStoreNotConnectedException extends GraphStoreException {

    public static final String NOT_CONNECTED = "GRAPH_STORE_NOT_CONNECTED";

    public GraphStoreNotConnectedException(String backend) {
        super("Graph store '" + backend + "' is not connected", NOT_CONNECTED);
    }
}
