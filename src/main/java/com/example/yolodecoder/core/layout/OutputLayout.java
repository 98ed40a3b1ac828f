package com.example.yolodecoder.core.layout;

import com.example.yolodecoder.core.exception.InvalidParameterException;

/**
 * Shape contract of the detector's flat output: an {@code S x S} grid, {@code C}
 * class probabilities per cell and {@code B} boxes per cell. The buffer holds
 * three contiguous regions in this order: class probabilities
 * ({@code S*S*C}), box confidences ({@code S*S*B}) and box geometry
 * ({@code S*S*B*4}).
 */
public record OutputLayout(int gridSize, int classCount, int boxesPerCell) {

    public static final int BOX_COMPONENTS = 4;

    public OutputLayout {
        if (gridSize < 1) {
            throw new InvalidParameterException("Grid size must be at least 1 but was " + gridSize);
        }
        if (classCount < 1) {
            throw new InvalidParameterException("Class count must be at least 1 but was " + classCount);
        }
        if (boxesPerCell < 1) {
            throw new InvalidParameterException("Boxes per cell must be at least 1 but was " + boxesPerCell);
        }
        long cells = (long) gridSize * gridSize;
        long total = cells * classCount + cells * boxesPerCell + cells * boxesPerCell * BOX_COMPONENTS;
        if (total > Integer.MAX_VALUE) {
            throw new InvalidParameterException("Layout " + gridSize + "x" + gridSize + "x(" + classCount + "+"
                    + boxesPerCell + "*5) does not fit into a single buffer");
        }
    }

    public int cellCount() {
        return gridSize * gridSize;
    }

    public int confidenceOffset() {
        return cellCount() * classCount;
    }

    public int geometryOffset() {
        return confidenceOffset() + cellCount() * boxesPerCell;
    }

    public int expectedLength() {
        return geometryOffset() + cellCount() * boxesPerCell * BOX_COMPONENTS;
    }
}
