package com.example.yolodecoder.core.geometry;

import com.example.yolodecoder.core.RawOutputBuilder;
import com.example.yolodecoder.core.exception.InvalidImageSizeException;
import com.example.yolodecoder.core.layout.DecodedOutput;
import com.example.yolodecoder.core.layout.LayoutDecoder;
import com.example.yolodecoder.core.layout.OutputLayout;
import com.example.yolodecoder.core.layout.RawOutput;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BoxGeometryResolverTest {

    private static final OutputLayout LAYOUT = new OutputLayout(7, 20, 2);

    private final LayoutDecoder decoder = new LayoutDecoder();
    private final BoxGeometryResolver resolver = new BoxGeometryResolver();

    @Test
    void shouldAddColumnToXAndRowToY() {
        RawOutput raw = new RawOutputBuilder(LAYOUT)
                .geometry(1, 5, 0, 0.25f, 0.75f, 0.5f, 0.5f)
                .build();

        BoxGeometry boxes = resolver.resolve(decoder.decode(raw, LAYOUT).rawGeometry(), 700, 350);
        CenterBox box = boxes.box(1, 5, 0);

        assertThat(box.centerX()).isCloseTo((0.25 + 5) / 7 * 700, within(1e-9));
        assertThat(box.centerY()).isCloseTo((0.75 + 1) / 7 * 350, within(1e-9));
    }

    @Test
    void shouldSquareEncodedSizesAndScaleByImageDimensions() {
        RawOutput raw = new RawOutputBuilder(LAYOUT)
                .geometry(0, 0, 1, 0f, 0f, 0.5f, 0.25f)
                .build();

        CenterBox box = resolver.resolve(decoder.decode(raw, LAYOUT).rawGeometry(), 640, 480).box(0, 0, 1);

        assertThat(box.width()).isCloseTo(0.25 * 640, within(1e-9));
        assertThat(box.height()).isCloseTo(0.0625 * 480, within(1e-9));
    }

    @Test
    void shouldProduceZeroSizeForZeroEncodedSize() {
        RawOutput raw = new RawOutputBuilder(LAYOUT).build();

        CenterBox box = resolver.resolve(decoder.decode(raw, LAYOUT).rawGeometry(), 700, 700).box(6, 6, 1);

        assertThat(box.width()).isZero();
        assertThat(box.height()).isZero();
        assertThat(box.centerX()).isCloseTo(600.0, within(1e-9));
        assertThat(box.centerY()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void shouldRejectNonPositiveImageSize() {
        DecodedOutput decoded = decoder.decode(new RawOutputBuilder(LAYOUT).build(), LAYOUT);

        assertThatThrownBy(() -> resolver.resolve(decoded.rawGeometry(), 0, 100))
                .isInstanceOf(InvalidImageSizeException.class);
        assertThatThrownBy(() -> resolver.resolve(decoded.rawGeometry(), 100, -5))
                .isInstanceOf(InvalidImageSizeException.class);
    }

    @Test
    void shouldFuseEveryClassWithEveryBoxOfTheSameCell() {
        RawOutput raw = new RawOutputBuilder(LAYOUT)
                .classProbability(2, 4, 3, 0.5f)
                .classProbability(2, 4, 7, 0.25f)
                .confidence(2, 4, 0, 0.8f)
                .confidence(2, 4, 1, 0.4f)
                .confidence(2, 5, 0, 1.0f)
                .build();
        DecodedOutput decoded = decoder.decode(raw, LAYOUT);

        ScoreTensor scores = resolver.fuse(decoded.classProbabilities(), decoded.confidences());

        assertThat(scores.get(2, 4, 0, 3)).isCloseTo(0.4, within(1e-6));
        assertThat(scores.get(2, 4, 1, 3)).isCloseTo(0.2, within(1e-6));
        assertThat(scores.get(2, 4, 0, 7)).isCloseTo(0.2, within(1e-6));
        assertThat(scores.get(2, 4, 1, 7)).isCloseTo(0.1, within(1e-6));
        assertThat(scores.get(2, 4, 0, 0)).isZero();
        assertThat(scores.get(2, 5, 0, 3)).isZero();
    }

    @Test
    void shouldLeaveTheRawOutputUntouched() {
        RawOutputBuilder builder = new RawOutputBuilder(LAYOUT)
                .classProbability(0, 0, 0, 0.9f)
                .confidence(0, 0, 0, 0.9f)
                .geometry(3, 2, 1, 0.4f, 0.6f, 0.3f, 0.2f);
        RawOutput raw = builder.build();
        DecodedOutput decoded = decoder.decode(raw, LAYOUT);

        resolver.resolve(decoded.rawGeometry(), 1280, 720);
        resolver.fuse(decoded.classProbabilities(), decoded.confidences());

        assertThat(raw.toArray()).containsExactly(builder.toArray());
        assertThat(decoded.rawGeometry().get(3, 2, 1, 0)).isEqualTo(0.4f);
    }
}
