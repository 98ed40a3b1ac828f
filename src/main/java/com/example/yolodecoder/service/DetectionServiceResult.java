package com.example.yolodecoder.service;

import com.example.yolodecoder.core.selection.Detection;

import java.util.List;

public record DetectionServiceResult(List<Detection> detections, long decodeTimeMs) {
}
