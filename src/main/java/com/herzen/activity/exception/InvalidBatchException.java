package com.herzen.activity.exception;

/**
 * The whole ingestion batch is refused; nothing from it has been written.
 */
public class InvalidBatchException extends RuntimeException {
    public InvalidBatchException(String message) {
        super(message);
    }

    public InvalidBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
