package com.almagest.core.exception;

import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;

/**
 * The provider knows the body but could not produce a position for the instant,
 * e.g. a live service that does not cover the date or did not respond in time.
 */
public class PositionUnavailableException extends EphemerisException {

    private final Body body;
    private final JulianDate at;

    public PositionUnavailableException(Body body, JulianDate at, String reason) {
        super(buildMessage(body, at, reason));
        this.body = body;
        this.at = at;
    }

    public PositionUnavailableException(Body body, JulianDate at, String reason, Throwable cause) {
        super(buildMessage(body, at, reason), cause);
        this.body = body;
        this.at = at;
    }

    private static String buildMessage(Body body, JulianDate at, String reason) {
        return String.format("No position for %s at %s: %s", body.name(), at, reason);
    }

    public Body getBody() {
        return body;
    }

    public JulianDate getAt() {
        return at;
    }
}
