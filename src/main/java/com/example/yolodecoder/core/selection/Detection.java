package com.example.yolodecoder.core.selection;

/**
 * Labeled box surviving suppression. Geometry is in center-size pixel form.
 */
public record Detection(String label, double xCenter, double yCenter, double width, double height, double score) {
}
