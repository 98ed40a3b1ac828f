package com.example.yolodecoder.core;

import com.example.yolodecoder.core.exception.DegenerateBoxException;
import com.example.yolodecoder.core.exception.InvalidImageSizeException;
import com.example.yolodecoder.core.exception.ShapeMismatchException;
import com.example.yolodecoder.core.layout.OutputLayout;
import com.example.yolodecoder.core.selection.Detection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DetectionPipelineTest {

    private final DetectionPipeline pipeline = new DetectionPipeline(DetectionConfig.defaults());

    @Test
    void shouldDetectSinglePersonInCenterCell() {
        float[] raw = new RawOutputBuilder(DetectionConfig.defaults().layout())
                .classProbability(3, 3, 14, 1.0f)
                .confidence(3, 3, 0, 1.0f)
                .geometry(3, 3, 0, 0.5f, 0.5f, 0.1f, 0.1f)
                .toArray();

        List<Detection> detections = pipeline.run(raw, 700, 700);

        assertThat(detections).hasSize(1);
        Detection detection = detections.get(0);
        assertThat(detection.label()).isEqualTo("person");
        assertThat(detection.xCenter()).isCloseTo(350.0, within(1e-4));
        assertThat(detection.yCenter()).isCloseTo(350.0, within(1e-4));
        assertThat(detection.width()).isCloseTo(7.0, within(1e-4));
        assertThat(detection.height()).isCloseTo(7.0, within(1e-4));
        assertThat(detection.score()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldNotModifyTheCallerBuffer() {
        RawOutputBuilder builder = new RawOutputBuilder(DetectionConfig.defaults().layout())
                .classProbability(1, 2, 6, 0.8f)
                .confidence(1, 2, 1, 0.9f)
                .geometry(1, 2, 1, 0.3f, 0.6f, 0.4f, 0.5f);
        float[] raw = builder.toArray();

        pipeline.run(raw, 448, 448);

        assertThat(raw).containsExactly(builder.toArray());
    }

    @Test
    void shouldRejectWrongBufferLength() {
        assertThatThrownBy(() -> pipeline.run(new float[1469], 700, 700))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void shouldRejectNonPositiveImageSize() {
        assertThatThrownBy(() -> pipeline.run(new float[1470], 700, 0))
                .isInstanceOf(InvalidImageSizeException.class);
    }

    @Test
    void shouldRejectZeroSizeBoxesThatReachSuppression() {
        float[] raw = new RawOutputBuilder(DetectionConfig.defaults().layout())
                .classProbability(0, 0, 0, 1.0f)
                .confidence(0, 0, 0, 1.0f)
                .confidence(0, 0, 1, 1.0f)
                .toArray();

        assertThatThrownBy(() -> pipeline.run(raw, 700, 700))
                .isInstanceOf(DegenerateBoxException.class);
    }

    @Test
    void shouldDecodeWithCustomLayout() {
        DetectionConfig config = new DetectionConfig(new OutputLayout(2, 2, 1), 0.1, 0.5, List.of("ball", "goal"));
        float[] raw = new RawOutputBuilder(config.layout())
                .classProbability(1, 0, 1, 0.5f)
                .confidence(1, 0, 0, 0.5f)
                .geometry(1, 0, 0, 0.5f, 0.5f, 0.5f, 0.5f)
                .toArray();

        List<Detection> detections = new DetectionPipeline(config).run(raw, 200, 100);

        assertThat(detections).hasSize(1);
        assertThat(detections.get(0).label()).isEqualTo("goal");
        assertThat(detections.get(0).xCenter()).isCloseTo(50.0, within(1e-6));
        assertThat(detections.get(0).yCenter()).isCloseTo(75.0, within(1e-6));
        assertThat(detections.get(0).width()).isCloseTo(50.0, within(1e-6));
        assertThat(detections.get(0).height()).isCloseTo(25.0, within(1e-6));
        assertThat(detections.get(0).score()).isCloseTo(0.25, within(1e-9));
    }
}
