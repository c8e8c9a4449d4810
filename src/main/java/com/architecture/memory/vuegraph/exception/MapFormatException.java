package com.architecture.memory.vuegraph.exception;

/**
 * The map document is structurally malformed: missing ID or type attributes,
 * non-integer ids, duplicate ids, or XML that cannot be parsed at all.
 */
public class MapFormatException extends VueGraphException {

    public MapFormatException(String message) {
        super(message);
    }

    public MapFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
