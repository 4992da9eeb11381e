package com.sandy.aiot.vision.baseline.exception;

/**
 * Raised when the metrics backend cannot be queried or answers with an error.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

}
