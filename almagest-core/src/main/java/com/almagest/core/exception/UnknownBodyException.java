package com.almagest.core.exception;

import com.almagest.core.model.Body;

public class UnknownBodyException extends EphemerisException {

    private final Body body;

    public UnknownBodyException(Body body, String providerName) {
        super("Provider '" + providerName + "' has no data for body " + body.name());
        this.body = body;
    }

    public Body getBody() {
        return body;
    }
}
