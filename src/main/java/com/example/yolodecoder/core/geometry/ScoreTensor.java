package com.example.yolodecoder.core.geometry;

import com.example.yolodecoder.core.layout.OutputLayout;

import java.util.Objects;

/**
 * Fused detection scores indexed {@code [row, col, box, class]}. The class
 * axis varies fastest, which is also the order candidates are enumerated in.
 */
public final class ScoreTensor {

    private final OutputLayout layout;
    private final double[] values;

    ScoreTensor(OutputLayout layout, double[] values) {
        this.layout = layout;
        this.values = values;
    }

    public OutputLayout layout() {
        return layout;
    }

    public double get(int row, int col, int box, int classId) {
        int grid = layout.gridSize();
        Objects.checkIndex(row, grid);
        Objects.checkIndex(col, grid);
        Objects.checkIndex(box, layout.boxesPerCell());
        Objects.checkIndex(classId, layout.classCount());
        return values[((row * grid + col) * layout.boxesPerCell() + box) * layout.classCount() + classId];
    }
}
