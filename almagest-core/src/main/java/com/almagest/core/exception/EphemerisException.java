package com.almagest.core.exception;

/**
 * Failure of a position provider to answer a query.
 */
public class EphemerisException extends Exception {

    public EphemerisException(String message) {
        super(message);
    }

    public EphemerisException(String message, Throwable cause) {
        super(message, cause);
    }
}
