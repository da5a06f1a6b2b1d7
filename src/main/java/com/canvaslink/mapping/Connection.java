package com.canvaslink.mapping;

import com.canvaslink.matchAndTransform.ImagePoint;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A correspondence in canvas-global pixels, ready to be drawn as a line from {@code a} to {@code b}.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Connection {
    private final ImagePoint a;
    private final ImagePoint b;
    private final double reliability;

    @Override
    public String toString() {
        return "Connection[" + a + " -> " + b + "]";
    }
}
