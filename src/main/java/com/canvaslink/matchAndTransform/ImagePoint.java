package com.canvaslink.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class ImagePoint {
    private final double x;
    private final double y;

    public ImagePoint translate(double dx, double dy) {
        return new ImagePoint(x + dx, y + dy);
    }

    public ImagePoint scale(double sx, double sy) {
        return new ImagePoint(x * sx, y * sy);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
