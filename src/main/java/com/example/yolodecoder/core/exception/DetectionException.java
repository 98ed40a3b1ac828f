package com.example.yolodecoder.core.exception;

import java.util.Objects;

/**
 * Base type for every precondition violation detected while turning a raw
 * network output into detections. None of these failures are recovered
 * internally; the caller has to supply corrected input.
 */
public abstract class DetectionException extends IllegalArgumentException {

    private final ErrorKind kind;

    protected DetectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
