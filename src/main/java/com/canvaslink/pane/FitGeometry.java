package com.canvaslink.pane;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Aspect-preserving size and centring offset of an image inside a pane.
 * Offsets stay fractional here; they are floored only where pixels are addressed.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class FitGeometry {
    private final double scaledWidth;
    private final double scaledHeight;
    private final double offsetX;
    private final double offsetY;

    public int pixelOffsetX() {
        return (int) Math.floor(offsetX);
    }

    public int pixelOffsetY() {
        return (int) Math.floor(offsetY);
    }

    /** Width of the raster the image is resized to, never below one pixel. */
    public int rasterWidth() {
        return Math.max(1, (int) scaledWidth);
    }

    public int rasterHeight() {
        return Math.max(1, (int) scaledHeight);
    }

    @Override
    public String toString() {
        return String.format("FitGeometry[%.2fx%.2f at (%.2f, %.2f)]", scaledWidth, scaledHeight, offsetX, offsetY);
    }
}
