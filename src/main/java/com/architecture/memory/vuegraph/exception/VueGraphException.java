package com.architecture.memory.vuegraph.exception;

/**
 * Base type for every failure raised while loading, extracting or importing a VUE map.
 */
public class VueGraphException extends RuntimeException {

    public VueGraphException(String message) {
        super(message);
    }

    public VueGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
