package com.example.yolodecoder.core.selection;

import com.example.yolodecoder.core.exception.InvalidParameterException;
import com.example.yolodecoder.core.exception.LabelTableTooSmallException;
import com.example.yolodecoder.core.geometry.BoxGeometry;
import com.example.yolodecoder.core.geometry.ScoreTensor;
import com.example.yolodecoder.core.layout.OutputLayout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Thresholds fused scores and runs greedy, class-agnostic non-maximum
 * suppression over the surviving candidates.
 */
public class DetectionSelector {

    // numeric comparison: -0.0 and 0.0 tie, unlike Double.compare
    private static final Comparator<Candidate> BY_SCORE_DESCENDING = (first, second) -> {
        if (first.score() > second.score()) {
            return -1;
        }
        return first.score() < second.score() ? 1 : 0;
    };

    /**
     * Selects the final detections.
     *
     * <p>Candidates are enumerated in {@code [row, col, box, class]} order with
     * the class index varying fastest, kept when {@code score >= threshold}, and
     * sorted by score descending. The sort is stable, so equal scores keep their
     * enumeration order. A kept candidate suppresses every later candidate whose
     * IoU with it exceeds {@code iouThreshold}, whatever its class.
     *
     * @return survivors in descending score order
     */
    public List<Detection> select(ScoreTensor scores, BoxGeometry boxes, double threshold, double iouThreshold,
                                  List<String> labels) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(boxes, "boxes must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        requireUnitInterval("threshold", threshold);
        requireUnitInterval("iouThreshold", iouThreshold);
        OutputLayout layout = scores.layout();
        if (!layout.equals(boxes.layout())) {
            throw new IllegalArgumentException("Scores and boxes were produced with different layouts");
        }
        if (labels.size() < layout.classCount()) {
            throw new LabelTableTooSmallException(layout.classCount(), labels.size());
        }

        List<Candidate> candidates = filter(scores, boxes, threshold);
        candidates.sort(BY_SCORE_DESCENDING);
        boolean[] suppressed = suppress(candidates, iouThreshold);

        List<Detection> detections = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (suppressed[i]) {
                continue;
            }
            Candidate candidate = candidates.get(i);
            detections.add(new Detection(
                    labels.get(candidate.classId()),
                    candidate.box().centerX(),
                    candidate.box().centerY(),
                    candidate.box().width(),
                    candidate.box().height(),
                    candidate.score()));
        }
        return detections;
    }

    private List<Candidate> filter(ScoreTensor scores, BoxGeometry boxes, double threshold) {
        OutputLayout layout = scores.layout();
        int grid = layout.gridSize();
        List<Candidate> candidates = new ArrayList<>();
        for (int row = 0; row < grid; row++) {
            for (int col = 0; col < grid; col++) {
                for (int box = 0; box < layout.boxesPerCell(); box++) {
                    for (int classId = 0; classId < layout.classCount(); classId++) {
                        double score = scores.get(row, col, box, classId);
                        if (score >= threshold) {
                            candidates.add(new Candidate(classId, boxes.box(row, col, box), score));
                        }
                    }
                }
            }
        }
        return candidates;
    }

    private boolean[] suppress(List<Candidate> sorted, double iouThreshold) {
        boolean[] suppressed = new boolean[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            if (suppressed[i]) {
                continue;
            }
            Candidate current = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                if (suppressed[j]) {
                    continue;
                }
                if (IntersectionOverUnion.compute(current.box(), sorted.get(j).box()) > iouThreshold) {
                    suppressed[j] = true;
                }
            }
        }
        return suppressed;
    }

    private static void requireUnitInterval(String name, double value) {
        if (!Double.isFinite(value) || value < 0d || value > 1d) {
            throw new InvalidParameterException(name + " must be a finite value in [0, 1] but was " + value);
        }
    }
}
