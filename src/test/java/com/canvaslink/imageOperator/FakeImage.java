package com.canvaslink.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Size-only image for tests that never touch pixels.
 */
public class FakeImage implements CanvasImage {
    private final int width;
    private final int height;

    public FakeImage(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public Mat mat() {
        throw new UnsupportedOperationException("FakeImage has no pixels");
    }

    /** Scaler producing fake images of the requested size. */
    public static ImageScaler scaler() {
        return (image, w, h) -> new FakeImage(w, h);
    }
}
