package com.example.yolodecoder.core;

import com.example.yolodecoder.core.exception.InvalidParameterException;
import com.example.yolodecoder.core.exception.LabelTableTooSmallException;
import com.example.yolodecoder.core.layout.OutputLayout;

import java.util.List;
import java.util.Objects;

/**
 * Everything the pipeline needs besides the buffer and the image size: the
 * output layout, both thresholds and the class id to label table.
 */
public record DetectionConfig(OutputLayout layout, double threshold, double iouThreshold, List<String> labels) {

    public static final int DEFAULT_GRID_SIZE = 7;
    public static final int DEFAULT_CLASS_COUNT = 20;
    public static final int DEFAULT_BOXES_PER_CELL = 2;
    public static final double DEFAULT_THRESHOLD = 0.2;
    public static final double DEFAULT_IOU_THRESHOLD = 0.5;

    /**
     * PASCAL VOC class names in the order the 20-class detector emits them.
     */
    public static final List<String> VOC_LABELS = List.of(
            "aeroplane", "bicycle", "bird", "boat", "bottle", "bus", "car",
            "cat", "chair", "cow", "diningtable", "dog", "horse", "motorbike",
            "person", "pottedplant", "sheep", "sofa", "train", "tvmonitor");

    public DetectionConfig {
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (!Double.isFinite(threshold) || threshold < 0d || threshold > 1d) {
            throw new InvalidParameterException("threshold must be a finite value in [0, 1] but was " + threshold);
        }
        if (!Double.isFinite(iouThreshold) || iouThreshold < 0d || iouThreshold > 1d) {
            throw new InvalidParameterException("iouThreshold must be a finite value in [0, 1] but was " + iouThreshold);
        }
        labels = List.copyOf(labels);
        if (labels.size() < layout.classCount()) {
            throw new LabelTableTooSmallException(layout.classCount(), labels.size());
        }
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
                new OutputLayout(DEFAULT_GRID_SIZE, DEFAULT_CLASS_COUNT, DEFAULT_BOXES_PER_CELL),
                DEFAULT_THRESHOLD,
                DEFAULT_IOU_THRESHOLD,
                VOC_LABELS);
    }
}
