package com.example.yolodecoder.core.exception;

/**
 * Failure categories raised by the decoding pipeline. The code is exposed to
 * API clients so they can tell apart the violated precondition.
 */
public enum ErrorKind {
    SHAPE_MISMATCH,
    INVALID_IMAGE_SIZE,
    INVALID_PARAMETER,
    LABEL_TABLE_TOO_SMALL,
    DEGENERATE_BOX
}
