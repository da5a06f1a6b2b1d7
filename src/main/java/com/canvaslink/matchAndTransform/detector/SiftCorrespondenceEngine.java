package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_features2d.SIFT;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

public class SiftCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public SiftCorrespondenceEngine(DetectorConfig config) {
        super("SIFT", SIFT.create(
                config.getFeatureCount(),
                config.getOctaveLayers(),
                config.getThreshold(),   // contrastThreshold
                10.0,                    // edgeThreshold
                1.6,                     // sigma
                false
        ), NORM_L2, false);
    }
}
