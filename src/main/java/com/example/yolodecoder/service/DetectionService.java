package com.example.yolodecoder.service;

import com.example.yolodecoder.core.DetectionConfig;
import com.example.yolodecoder.core.DetectionPipeline;
import com.example.yolodecoder.core.layout.RawOutput;
import com.example.yolodecoder.core.selection.Detection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final DetectionPipeline pipeline;
    private final DetectionReportFormatter reportFormatter;

    public DetectionService(DetectionPipeline pipeline, DetectionReportFormatter reportFormatter) {
        this.pipeline = pipeline;
        this.reportFormatter = reportFormatter;
    }

    public DetectionConfig config() {
        return pipeline.config();
    }

    public DetectionServiceResult decode(float[] output, int imageWidth, int imageHeight) {
        Objects.requireNonNull(output, "output must not be null");
        RawOutput raw = RawOutput.of(output);
        long start = System.nanoTime();
        List<Detection> detections = pipeline.run(raw, imageWidth, imageHeight);
        long elapsed = System.nanoTime() - start;

        long decodeTimeMs = Duration.ofNanos(elapsed).toMillis();
        log.debug("Decoded {} detections from {} values for a {}x{} image in {} ms",
                detections.size(), raw.length(), imageWidth, imageHeight, decodeTimeMs);
        if (log.isDebugEnabled() && !detections.isEmpty()) {
            log.debug("Detections:{}{}", System.lineSeparator(), reportFormatter.format(detections));
        }
        return new DetectionServiceResult(detections, decodeTimeMs);
    }
}
