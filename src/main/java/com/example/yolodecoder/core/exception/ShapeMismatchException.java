package com.example.yolodecoder.core.exception;

/**
 * Raised when the length of a raw output buffer disagrees with the grid,
 * class and box counts it is decoded with.
 */
public class ShapeMismatchException extends DetectionException {

    private final int expectedLength;
    private final int actualLength;

    public ShapeMismatchException(int expectedLength, int actualLength) {
        super(ErrorKind.SHAPE_MISMATCH,
                "Raw output holds " + actualLength + " values but the layout requires exactly " + expectedLength);
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
