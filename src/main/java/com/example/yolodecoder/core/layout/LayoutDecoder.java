package com.example.yolodecoder.core.layout;

import com.example.yolodecoder.core.exception.ShapeMismatchException;

import java.util.Objects;

/**
 * Splits a flat network output into its class-probability, confidence and
 * geometry regions. No arithmetic happens here: the returned grids are views
 * over the same immutable buffer.
 */
public class LayoutDecoder {

    public DecodedOutput decode(RawOutput raw, OutputLayout layout) {
        Objects.requireNonNull(raw, "raw output must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
        int expected = layout.expectedLength();
        if (raw.length() != expected) {
            throw new ShapeMismatchException(expected, raw.length());
        }
        return new DecodedOutput(
                new ClassProbabilityGrid(raw, layout),
                new ConfidenceGrid(raw, layout),
                new RawBoxGeometry(raw, layout));
    }
}
