package com.example.yolodecoder.core.layout;

import java.util.Objects;

/**
 * Read-only {@code [row, col, box]} view over the confidence region. Values
 * outside {@code [0, 1]} are passed through unclamped.
 */
public final class ConfidenceGrid {

    private final RawOutput raw;
    private final OutputLayout layout;

    ConfidenceGrid(RawOutput raw, OutputLayout layout) {
        this.raw = raw;
        this.layout = layout;
    }

    public OutputLayout layout() {
        return layout;
    }

    public float get(int row, int col, int box) {
        int grid = layout.gridSize();
        Objects.checkIndex(row, grid);
        Objects.checkIndex(col, grid);
        Objects.checkIndex(box, layout.boxesPerCell());
        return raw.get(layout.confidenceOffset() + (row * grid + col) * layout.boxesPerCell() + box);
    }
}
