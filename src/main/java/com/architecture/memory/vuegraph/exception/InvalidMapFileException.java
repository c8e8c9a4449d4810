package com.architecture.memory.vuegraph.exception;

public class InvalidMapFileException extends VueGraphException {

    public InvalidMapFileException(String message) {
        super(message);
    }

    public InvalidMapFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
