package com.z254.sipo.ingest;

/**
 * Raised when an alert source cannot be read or written.
 */
public class AlertIngestionException extends RuntimeException {

    public AlertIngestionException(String message) {
        super(message);
    }

    public AlertIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
