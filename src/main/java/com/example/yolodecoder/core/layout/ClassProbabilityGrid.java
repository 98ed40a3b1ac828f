package com.example.yolodecoder.core.layout;

import java.util.Objects;

/**
 * Read-only {@code [row, col, class]} view over the class-probability region
 * of a {@link RawOutput}. Values are exposed exactly as the network wrote them.
 */
public final class ClassProbabilityGrid {

    private final RawOutput raw;
    private final OutputLayout layout;

    ClassProbabilityGrid(RawOutput raw, OutputLayout layout) {
        this.raw = raw;
        this.layout = layout;
    }

    public OutputLayout layout() {
        return layout;
    }

    public float get(int row, int col, int classId) {
        int grid = layout.gridSize();
        Objects.checkIndex(row, grid);
        Objects.checkIndex(col, grid);
        Objects.checkIndex(classId, layout.classCount());
        return raw.get((row * grid + col) * layout.classCount() + classId);
    }
}
