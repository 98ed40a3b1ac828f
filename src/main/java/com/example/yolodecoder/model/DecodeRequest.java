package com.example.yolodecoder.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Raw detector output together with the size of the image it was computed for")
public record DecodeRequest(
        @Schema(description = "Flat output tensor: class probabilities, then box confidences, then box geometry")
        @NotNull float[] output,
        @Schema(description = "Source image width in pixels", example = "700") int imageWidth,
        @Schema(description = "Source image height in pixels", example = "700") int imageHeight) {
}
