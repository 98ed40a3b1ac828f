package com.example.yolodecoder.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Detections decoded from a single network output, highest score first")
public record DetectionResponse(
        @Schema(description = "Detections in descending score order") List<DetectionResult> detections,
        @Schema(description = "Time spent decoding in milliseconds", example = "1") long decodeTimeMs) {
}
