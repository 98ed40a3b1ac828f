package com.example.yolodecoder.core.geometry;

import com.example.yolodecoder.core.exception.InvalidImageSizeException;
import com.example.yolodecoder.core.layout.ClassProbabilityGrid;
import com.example.yolodecoder.core.layout.ConfidenceGrid;
import com.example.yolodecoder.core.layout.OutputLayout;
import com.example.yolodecoder.core.layout.RawBoxGeometry;

import java.util.Objects;

/**
 * Turns the decoded network regions into pixel-space boxes and fused
 * per-class scores. Both operations allocate fresh output arrays.
 */
public class BoxGeometryResolver {

    /**
     * Recovers pixel boxes from grid-relative predictions. The x offset is
     * taken from the column index and the y offset from the row index; width
     * and height are stored as square roots of the normalized size.
     *
     * @param rawGeometry geometry region of the network output
     * @param imageWidth  source image width in pixels
     * @param imageHeight source image height in pixels
     * @return center-size boxes in pixels
     */
    public BoxGeometry resolve(RawBoxGeometry rawGeometry, int imageWidth, int imageHeight) {
        Objects.requireNonNull(rawGeometry, "raw geometry must not be null");
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new InvalidImageSizeException("Image size must be positive but was " + imageWidth + "x" + imageHeight);
        }
        OutputLayout layout = rawGeometry.layout();
        int grid = layout.gridSize();
        int boxes = layout.boxesPerCell();
        double[] values = new double[layout.cellCount() * boxes * OutputLayout.BOX_COMPONENTS];
        int offset = 0;
        for (int row = 0; row < grid; row++) {
            for (int col = 0; col < grid; col++) {
                for (int box = 0; box < boxes; box++) {
                    double rx = rawGeometry.get(row, col, box, RawBoxGeometry.X);
                    double ry = rawGeometry.get(row, col, box, RawBoxGeometry.Y);
                    double rw = rawGeometry.get(row, col, box, RawBoxGeometry.WIDTH);
                    double rh = rawGeometry.get(row, col, box, RawBoxGeometry.HEIGHT);
                    values[offset++] = (rx + col) / grid * imageWidth;
                    values[offset++] = (ry + row) / grid * imageHeight;
                    values[offset++] = rw * rw * imageWidth;
                    values[offset++] = rh * rh * imageHeight;
                }
            }
        }
        return new BoxGeometry(layout, values);
    }

    /**
     * Multiplies every class probability of a cell with every box confidence
     * of the same cell.
     */
    public ScoreTensor fuse(ClassProbabilityGrid classProbabilities, ConfidenceGrid confidences) {
        Objects.requireNonNull(classProbabilities, "class probabilities must not be null");
        Objects.requireNonNull(confidences, "confidences must not be null");
        OutputLayout layout = classProbabilities.layout();
        if (!layout.equals(confidences.layout())) {
            throw new IllegalArgumentException("Class probabilities and confidences were decoded with different layouts");
        }
        int grid = layout.gridSize();
        int boxes = layout.boxesPerCell();
        int classes = layout.classCount();
        double[] values = new double[layout.cellCount() * boxes * classes];
        int offset = 0;
        for (int row = 0; row < grid; row++) {
            for (int col = 0; col < grid; col++) {
                for (int box = 0; box < boxes; box++) {
                    double confidence = confidences.get(row, col, box);
                    for (int classId = 0; classId < classes; classId++) {
                        values[offset++] = (double) classProbabilities.get(row, col, classId) * confidence;
                    }
                }
            }
        }
        return new ScoreTensor(layout, values);
    }
}
