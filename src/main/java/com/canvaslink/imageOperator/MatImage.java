package com.canvaslink.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

public class MatImage implements CanvasImage {
    private final Mat mat;

    public MatImage(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Image is empty");
        }
        this.mat = mat;
    }

    @Override
    public int getWidth() {
        return mat.cols();
    }

    @Override
    public int getHeight() {
        return mat.rows();
    }

    @Override
    public Mat mat() {
        return mat;
    }

    @Override
    public String toString() {
        return "MatImage[" + getWidth() + "x" + getHeight() + ", channels=" + mat.channels() + "]";
    }
}
