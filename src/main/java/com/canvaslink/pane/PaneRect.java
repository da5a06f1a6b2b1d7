package com.canvaslink.pane;

import com.canvaslink.exception.InvalidGeometryException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Rectangular region of the canvas, in canvas-global pixels. {@code x1 > x0} and {@code y1 > y0}.
 */
@Getter
@EqualsAndHashCode
public class PaneRect {
    private final double x0, y0;
    private final double x1, y1;

    public PaneRect(double x0, double y0, double x1, double y1) {
        if (!(x1 > x0) || !(y1 > y0)) {
            throw new InvalidGeometryException(String.format(
                    "Pane rect (%.1f,%.1f)-(%.1f,%.1f) has no area", x0, y0, x1, y1));
        }
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }

    @Override
    public String toString() {
        return String.format("(%.1f,%.1f)-(%.1f,%.1f)", x0, y0, x1, y1);
    }
}
