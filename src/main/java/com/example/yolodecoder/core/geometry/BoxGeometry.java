package com.example.yolodecoder.core.geometry;

import com.example.yolodecoder.core.layout.OutputLayout;

import java.util.Objects;

/**
 * Pixel-space boxes indexed {@code [row, col, box]}. Instances own their
 * backing array and never share it with the raw output they were resolved
 * from.
 */
public final class BoxGeometry {

    private final OutputLayout layout;
    private final double[] values;

    BoxGeometry(OutputLayout layout, double[] values) {
        this.layout = layout;
        this.values = values;
    }

    public OutputLayout layout() {
        return layout;
    }

    public CenterBox box(int row, int col, int box) {
        int offset = offset(row, col, box);
        return new CenterBox(values[offset], values[offset + 1], values[offset + 2], values[offset + 3]);
    }

    private int offset(int row, int col, int box) {
        int grid = layout.gridSize();
        Objects.checkIndex(row, grid);
        Objects.checkIndex(col, grid);
        Objects.checkIndex(box, layout.boxesPerCell());
        return ((row * grid + col) * layout.boxesPerCell() + box) * OutputLayout.BOX_COMPONENTS;
    }
}
