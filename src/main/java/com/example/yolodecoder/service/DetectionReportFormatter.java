package com.example.yolodecoder.service;

import com.example.yolodecoder.core.selection.Detection;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders detections as the plain-text console report, one line per
 * detection with geometry truncated to whole pixels.
 */
@Component
public class DetectionReportFormatter {

    public String formatLine(Detection detection) {
        return String.format(Locale.ROOT, "    class : %s, [x,y,w,h]=[%d,%d,%d,%d], Confidence = %s",
                detection.label(),
                (int) detection.xCenter(),
                (int) detection.yCenter(),
                (int) detection.width(),
                (int) detection.height(),
                detection.score());
    }

    public String format(List<Detection> detections) {
        return detections.stream()
                .map(this::formatLine)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
