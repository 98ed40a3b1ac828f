package com.example.yolodecoder.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Single detection that survived non-maximum suppression")
public record DetectionResult(
        @Schema(description = "Class label", example = "person") String label,
        @Schema(description = "Box center x in pixels", example = "350.0") double xCenter,
        @Schema(description = "Box center y in pixels", example = "350.0") double yCenter,
        @Schema(description = "Box width in pixels", example = "7.0") double width,
        @Schema(description = "Box height in pixels", example = "7.0") double height,
        @Schema(description = "Fused class probability and box confidence", example = "0.93") double score,
        @Schema(description = "Integer rectangle clipped to the image") BoundingBox bounds) {
}
