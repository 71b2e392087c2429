package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-item outcome of a position lookup. Exactly one of {@code position} and
 * {@code failure} is set, so a batch keeps going when single items fail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositionResult(
    Body body,
    JulianDate at,
    Position position,
    Failure failure,
    String message
) {
    public enum Failure {
        UNKNOWN_BODY,
        UNAVAILABLE
    }

    public PositionResult {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(at, "at");
        if ((position == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of position and failure must be set");
        }
    }

    public static PositionResult ok(Position position) {
        return new PositionResult(position.body(), position.at(), position, null, null);
    }

    public static PositionResult failed(Body body, JulianDate at, Failure failure, String message) {
        return new PositionResult(body, at, null, Objects.requireNonNull(failure, "failure"), message);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return position != null;
    }

    @JsonIgnore
    public Optional<Position> asOptional() {
        return Optional.ofNullable(position);
    }
}
