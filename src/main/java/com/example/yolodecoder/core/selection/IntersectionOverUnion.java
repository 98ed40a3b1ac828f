package com.example.yolodecoder.core.selection;

import com.example.yolodecoder.core.exception.DegenerateBoxException;
import com.example.yolodecoder.core.geometry.CenterBox;

import java.util.Objects;

/**
 * Overlap ratio of two center-size boxes. The first extent pair is computed
 * from the x center and width, the second from the y center and height.
 */
public final class IntersectionOverUnion {

    private IntersectionOverUnion() {
    }

    public static double compute(CenterBox first, CenterBox second) {
        Objects.requireNonNull(first, "first box must not be null");
        Objects.requireNonNull(second, "second box must not be null");
        requireArea(first);
        requireArea(second);

        double top = Math.min(first.centerX() + first.width() / 2, second.centerX() + second.width() / 2);
        double bottom = Math.max(first.centerX() - first.width() / 2, second.centerX() - second.width() / 2);
        double left = Math.min(first.centerY() + first.height() / 2, second.centerY() + second.height() / 2);
        double right = Math.max(first.centerY() - first.height() / 2, second.centerY() - second.height() / 2);
        double intersection = Math.max(0d, top - bottom) * Math.max(0d, left - right);

        double union = first.area() + second.area() - intersection;
        if (union <= 0d) {
            throw new DegenerateBoxException("Boxes " + first + " and " + second + " have no union area");
        }
        return intersection / union;
    }

    private static void requireArea(CenterBox box) {
        // NaN sizes fail this check as well
        if (!(box.width() > 0d && box.height() > 0d)) {
            throw new DegenerateBoxException("Box " + box + " has zero or negative area");
        }
    }
}
