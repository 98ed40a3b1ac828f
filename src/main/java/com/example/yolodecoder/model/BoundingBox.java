package com.example.yolodecoder.model;

import com.example.yolodecoder.core.selection.Detection;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Integer rectangle of a detection clipped to the source image. Coordinates
 * follow the image pixel grid with the origin located in the top-left corner.
 */
@Schema(description = "Axis-aligned rectangle of a detection, clipped to the image bounds")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "347") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "347") int y,
        @Schema(description = "Bounding box width in pixels", example = "6") int width,
        @Schema(description = "Bounding box height in pixels", example = "6") int height) {

    private static final double PIXEL_LIMIT = 1e15;

    public BoundingBox {
        if (width < 0) {
            throw new IllegalArgumentException("Bounding box width must not be negative");
        }
        if (height < 0) {
            throw new IllegalArgumentException("Bounding box height must not be negative");
        }
    }

    /**
     * Truncates the detection's center and size to whole pixels, expands half
     * the size to each side and clips the result to {@code [0, imageWidth]} and
     * {@code [0, imageHeight]}. Boxes entirely outside the image collapse to a
     * zero-size rectangle on the nearest image edge.
     */
    public static BoundingBox clippedTo(Detection detection, int imageWidth, int imageHeight) {
        long centerX = truncate(detection.xCenter());
        long centerY = truncate(detection.yCenter());
        long halfWidth = Math.floorDiv(truncate(detection.width()), 2L);
        long halfHeight = Math.floorDiv(truncate(detection.height()), 2L);
        long xMin = Math.min(Math.max(centerX - halfWidth, 0L), imageWidth);
        long xMax = Math.min(centerX + halfWidth, imageWidth);
        long yMin = Math.min(Math.max(centerY - halfHeight, 0L), imageHeight);
        long yMax = Math.min(centerY + halfHeight, imageHeight);
        return new BoundingBox((int) xMin, (int) yMin, (int) Math.max(xMax - xMin, 0L), (int) Math.max(yMax - yMin, 0L));
    }

    // bounded so that sums of two truncated values cannot overflow a long
    private static long truncate(double value) {
        return (long) Math.max(-PIXEL_LIMIT, Math.min(PIXEL_LIMIT, value));
    }
}
