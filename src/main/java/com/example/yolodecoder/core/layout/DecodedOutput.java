package com.example.yolodecoder.core.layout;

public record DecodedOutput(
        ClassProbabilityGrid classProbabilities,
        ConfidenceGrid confidences,
        RawBoxGeometry rawGeometry) {
}
