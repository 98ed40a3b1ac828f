package com.example.yolodecoder.core.layout;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable copy of the flat tensor produced by the detection network. The
 * caller's array is copied on construction so later writes to it cannot leak
 * into a decode in progress.
 */
public final class RawOutput {

    private final float[] values;

    private RawOutput(float[] values) {
        this.values = values;
    }

    public static RawOutput of(float... values) {
        Objects.requireNonNull(values, "values must not be null");
        return new RawOutput(values.clone());
    }

    public int length() {
        return values.length;
    }

    public float get(int index) {
        return values[Objects.checkIndex(index, values.length)];
    }

    public float[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RawOutput that)) {
            return false;
        }
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "RawOutput[length=" + values.length + "]";
    }
}
