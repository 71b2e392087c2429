package com.almagest.core.exception;

/**
 * Base class for input errors detected by the analytics components.
 * These fail the specific call; they never stand for "no result".
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }
}
