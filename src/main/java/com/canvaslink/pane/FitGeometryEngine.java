package com.canvaslink.pane;

import com.canvaslink.exception.InvalidGeometryException;

public class FitGeometryEngine {

    private FitGeometryEngine() {
    }

    /**
     * Scales an image of the given size into {@code rect} keeping its aspect ratio and centres it.
     * When the rect is relatively wider than the image the height constrains, otherwise the width does.
     *
     * @throws InvalidGeometryException if the rect or the image has no area
     */
    public static FitGeometry fit(PaneRect rect, int imageWidth, int imageHeight) {
        if (rect == null || !(rect.width() > 0) || !(rect.height() > 0)) {
            throw new InvalidGeometryException("Pane rect has no area: " + rect);
        }
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new InvalidGeometryException("Image has no area: " + imageWidth + "x" + imageHeight);
        }

        double rectAspect = rect.width() / rect.height();
        double imageAspect = (double) imageWidth / imageHeight;

        double scaledWidth, scaledHeight;
        if (rectAspect > imageAspect) {
            scaledHeight = rect.height();
            scaledWidth = rect.height() * imageAspect;
        } else {
            scaledWidth = rect.width();
            scaledHeight = rect.width() / imageAspect;
        }

        double offsetX = rect.getX0() + (rect.width() - scaledWidth) / 2;
        double offsetY = rect.getY0() + (rect.height() - scaledHeight) / 2;
        return new FitGeometry(scaledWidth, scaledHeight, offsetX, offsetY);
    }
}
