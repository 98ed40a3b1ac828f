package com.example.yolodecoder.controller;

import com.example.yolodecoder.core.DetectionConfig;
import com.example.yolodecoder.core.selection.Detection;
import com.example.yolodecoder.model.BoundingBox;
import com.example.yolodecoder.model.DecodeRequest;
import com.example.yolodecoder.model.DetectionConfigResponse;
import com.example.yolodecoder.model.DetectionResponse;
import com.example.yolodecoder.model.DetectionResult;
import com.example.yolodecoder.service.DetectionService;
import com.example.yolodecoder.service.DetectionServiceResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Post-processing of raw single-shot detector output")
public class DetectionController {

    private final DetectionService service;

    public DetectionController(DetectionService service) {
        this.service = service;
    }

    @Operation(
            summary = "Decode a raw detector output",
            description = "Accepts the flat output tensor and the source image size, and returns thresholded, de-duplicated detections.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Output decoded",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = DetectionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Output length, image size or configuration rejected", content = @Content)
    })
    @PostMapping(value = "/decode", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DetectionResponse> decode(@Valid @RequestBody DecodeRequest request) {
        DetectionServiceResult result = service.decode(request.output(), request.imageWidth(), request.imageHeight());
        List<DetectionResult> detections = result.detections().stream()
                .map(detection -> toDetectionResult(detection, request.imageWidth(), request.imageHeight()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new DetectionResponse(detections, result.decodeTimeMs()));
    }

    @GetMapping("/config")
    @Operation(summary = "Retrieve the active output layout, thresholds and labels")
    public ResponseEntity<DetectionConfigResponse> config() {
        DetectionConfig config = service.config();
        return ResponseEntity.ok(new DetectionConfigResponse(
                config.layout().gridSize(),
                config.layout().classCount(),
                config.layout().boxesPerCell(),
                config.threshold(),
                config.iouThreshold(),
                config.labels(),
                config.layout().expectedLength()));
    }

    private DetectionResult toDetectionResult(Detection detection, int imageWidth, int imageHeight) {
        return new DetectionResult(
                detection.label(),
                detection.xCenter(),
                detection.yCenter(),
                detection.width(),
                detection.height(),
                detection.score(),
                BoundingBox.clippedTo(detection, imageWidth, imageHeight));
    }
}
