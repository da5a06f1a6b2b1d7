package com.canvaslink.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * A decoded raster with three colour channels (BGR order when backed by OpenCV).
 */
public interface CanvasImage {

    int getWidth();

    int getHeight();

    /** Pixel data for OpenCV routines. */
    Mat mat();
}
