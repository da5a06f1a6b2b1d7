package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DescribedImage;
import com.canvaslink.matchAndTransform.ImagePoint;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Keypoints of one image and their descriptor matrix, one row per keypoint.
 */
public class OpenCvFeatures implements DescribedImage {
    final KeyPointVector keypoints;
    final Mat descriptors;

    OpenCvFeatures(KeyPointVector keypoints, Mat descriptors) {
        this.keypoints = keypoints;
        this.descriptors = descriptors;
    }

    @Override
    public int numberOfFeatures() {
        if (descriptors == null || descriptors.empty()) return 0;
        return descriptors.rows();
    }

    ImagePoint location(int index) {
        KeyPoint kp = keypoints.get(index);
        return new ImagePoint(kp.pt().x(), kp.pt().y());
    }
}
