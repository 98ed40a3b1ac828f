package com.example.yolodecoder.model;

import java.util.List;

public record DetectionConfigResponse(
        int gridSize,
        int classCount,
        int boxesPerCell,
        double threshold,
        double iouThreshold,
        List<String> labels,
        int expectedOutputLength) {
}
