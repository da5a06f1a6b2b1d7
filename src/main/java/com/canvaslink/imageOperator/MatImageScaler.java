package com.canvaslink.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

public class MatImageScaler implements ImageScaler {

    @Override
    public CanvasImage scale(CanvasImage image, int width, int height) {
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        Mat src = image.mat();
        Mat dst = new Mat();
        // INTER_AREA for shrinking, bilinear when the pane is larger than the capture
        int interpolation = (width < image.getWidth()) ? INTER_AREA : INTER_LINEAR;
        resize(src, dst, new Size(width, height), 0, 0, interpolation);
        return new MatImage(dst);
    }
}
