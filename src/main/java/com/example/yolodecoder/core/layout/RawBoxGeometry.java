package com.example.yolodecoder.core.layout;

import java.util.Objects;

/**
 * Read-only {@code [row, col, box, component]} view over the geometry region.
 * Components are grid-relative and square-root encoded; see
 * {@code BoxGeometryResolver} for the transform into pixels.
 */
public final class RawBoxGeometry {

    public static final int X = 0;
    public static final int Y = 1;
    public static final int WIDTH = 2;
    public static final int HEIGHT = 3;

    private final RawOutput raw;
    private final OutputLayout layout;

    RawBoxGeometry(RawOutput raw, OutputLayout layout) {
        this.raw = raw;
        this.layout = layout;
    }

    public OutputLayout layout() {
        return layout;
    }

    public float get(int row, int col, int box, int component) {
        int grid = layout.gridSize();
        int boxes = layout.boxesPerCell();
        Objects.checkIndex(row, grid);
        Objects.checkIndex(col, grid);
        Objects.checkIndex(box, boxes);
        Objects.checkIndex(component, OutputLayout.BOX_COMPONENTS);
        int cellBox = (row * grid + col) * boxes + box;
        return raw.get(layout.geometryOffset() + cellBox * OutputLayout.BOX_COMPONENTS + component);
    }
}
