package com.example.yolodecoder.core;

import com.example.yolodecoder.core.geometry.BoxGeometry;
import com.example.yolodecoder.core.geometry.BoxGeometryResolver;
import com.example.yolodecoder.core.geometry.ScoreTensor;
import com.example.yolodecoder.core.layout.DecodedOutput;
import com.example.yolodecoder.core.layout.LayoutDecoder;
import com.example.yolodecoder.core.layout.RawOutput;
import com.example.yolodecoder.core.selection.Detection;
import com.example.yolodecoder.core.selection.DetectionSelector;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the post-processing core: decode the buffer layout, resolve
 * pixel boxes and fused scores, then select the final detections. Stateless
 * between calls and safe to share across threads.
 */
public class DetectionPipeline {

    private final DetectionConfig config;
    private final LayoutDecoder decoder;
    private final BoxGeometryResolver resolver;
    private final DetectionSelector selector;

    public DetectionPipeline(DetectionConfig config) {
        this(config, new LayoutDecoder(), new BoxGeometryResolver(), new DetectionSelector());
    }

    public DetectionPipeline(DetectionConfig config, LayoutDecoder decoder, BoxGeometryResolver resolver,
                             DetectionSelector selector) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
    }

    public DetectionConfig config() {
        return config;
    }

    public List<Detection> run(float[] raw, int imageWidth, int imageHeight) {
        return run(RawOutput.of(raw), imageWidth, imageHeight);
    }

    public List<Detection> run(RawOutput raw, int imageWidth, int imageHeight) {
        DecodedOutput decoded = decoder.decode(raw, config.layout());
        BoxGeometry boxes = resolver.resolve(decoded.rawGeometry(), imageWidth, imageHeight);
        ScoreTensor scores = resolver.fuse(decoded.classProbabilities(), decoded.confidences());
        return selector.select(scores, boxes, config.threshold(), config.iouThreshold(), config.labels());
    }
}
