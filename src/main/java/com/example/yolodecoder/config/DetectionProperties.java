package com.example.yolodecoder.config;

import com.example.yolodecoder.core.DetectionConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    private int gridSize = DetectionConfig.DEFAULT_GRID_SIZE;
    private int classCount = DetectionConfig.DEFAULT_CLASS_COUNT;
    private int boxesPerCell = DetectionConfig.DEFAULT_BOXES_PER_CELL;
    private double threshold = DetectionConfig.DEFAULT_THRESHOLD;
    private double iouThreshold = DetectionConfig.DEFAULT_IOU_THRESHOLD;
    private List<String> labels = new ArrayList<>(DetectionConfig.VOC_LABELS);

    public int getGridSize() {
        return gridSize;
    }

    public void setGridSize(int gridSize) {
        this.gridSize = gridSize;
    }

    public int getClassCount() {
        return classCount;
    }

    public void setClassCount(int classCount) {
        this.classCount = classCount;
    }

    public int getBoxesPerCell() {
        return boxesPerCell;
    }

    public void setBoxesPerCell(int boxesPerCell) {
        this.boxesPerCell = boxesPerCell;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getIouThreshold() {
        return iouThreshold;
    }

    public void setIouThreshold(double iouThreshold) {
        this.iouThreshold = iouThreshold;
    }

    public List<String> getLabels() {
        return labels;
    }

    public void setLabels(List<String> labels) {
        this.labels = labels;
    }
}
