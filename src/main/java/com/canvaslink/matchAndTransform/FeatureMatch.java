package com.canvaslink.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A scored correspondence. {@code point1} is local to the first image, {@code point2} to the second;
 * {@code reliability} lies in (0, 1], higher meaning a closer descriptor match.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class FeatureMatch {
    private final ImagePoint point1;
    private final ImagePoint point2;
    private final double reliability;

    @Override
    public String toString() {
        return String.format("FeatureMatch[%s -> %s, reliability=%.4f]", point1, point2, reliability);
    }
}
