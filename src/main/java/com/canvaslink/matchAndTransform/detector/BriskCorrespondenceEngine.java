package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_features2d.BRISK;

import static org.bytedeco.opencv.global.opencv_core.NORM_HAMMING;

public class BriskCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public BriskCorrespondenceEngine(DetectorConfig config) {
        super("BRISK", BRISK.create((int) config.getThreshold(), config.getLevels(), 1.0f), NORM_HAMMING, false);
    }
}
