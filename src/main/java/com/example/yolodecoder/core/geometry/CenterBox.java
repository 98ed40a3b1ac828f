package com.example.yolodecoder.core.geometry;

/**
 * Box in center-size form, in image pixel units.
 */
public record CenterBox(double centerX, double centerY, double width, double height) {

    public double area() {
        return width * height;
    }
}
