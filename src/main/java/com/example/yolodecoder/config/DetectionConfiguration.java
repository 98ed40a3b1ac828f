package com.example.yolodecoder.config;

import com.example.yolodecoder.core.DetectionConfig;
import com.example.yolodecoder.core.DetectionPipeline;
import com.example.yolodecoder.core.layout.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable {@link DetectionConfig} from the bound properties and
 * exposes a shared {@link DetectionPipeline}. An invalid configuration fails
 * application start-up with the same typed errors the pipeline raises.
 */
@Configuration
public class DetectionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfiguration.class);

    @Bean
    public DetectionConfig detectionConfig(DetectionProperties properties) {
        OutputLayout layout = new OutputLayout(
                properties.getGridSize(),
                properties.getClassCount(),
                properties.getBoxesPerCell());
        DetectionConfig config = new DetectionConfig(
                layout,
                properties.getThreshold(),
                properties.getIouThreshold(),
                properties.getLabels());
        log.info("Decoding {}x{} grid with {} classes and {} boxes per cell (expected output length {}, threshold {}, IoU threshold {})",
                layout.gridSize(), layout.gridSize(), layout.classCount(), layout.boxesPerCell(),
                layout.expectedLength(), config.threshold(), config.iouThreshold());
        return config;
    }

    @Bean
    public DetectionPipeline detectionPipeline(DetectionConfig config) {
        return new DetectionPipeline(config);
    }
}
