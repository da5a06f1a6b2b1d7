package com.canvaslink.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

public class ColourImageToGray {

    private ColourImageToGray() {
    }

    /**
     * Returns a single channel copy for feature detection. Gray inputs are returned as is.
     */
    public static Mat toGray(Mat image) {
        switch (image.channels()) {
            case 1:
                return image;
            case 4:
                Mat grayFromBgra = new Mat();
                cvtColor(image, grayFromBgra, COLOR_BGRA2GRAY);
                return grayFromBgra;
            default:
                Mat gray = new Mat();
                cvtColor(image, gray, COLOR_BGR2GRAY);
                return gray;
        }
    }
}
