package com.almagest.ephemeris.horizons;

import com.almagest.core.exception.EphemerisException;

/**
 * The Horizons service could not be reached or answered without an ephemeris.
 */
public class HorizonsException extends EphemerisException {

    private final int httpStatus;

    public HorizonsException(String message) {
        super(message);
        this.httpStatus = -1;
    }

    public HorizonsException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public HorizonsException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /**
     * HTTP status of the failed response, or -1 if the failure was not an HTTP error.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
