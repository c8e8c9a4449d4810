package com.architecture.memory.vuegraph.exception;

/**
 * Wraps driver-level failures while writing to or reading from Neo4j.
 */
public class GraphStoreException extends VueGraphException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
