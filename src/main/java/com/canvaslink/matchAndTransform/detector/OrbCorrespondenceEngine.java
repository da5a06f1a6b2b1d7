package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_features2d.ORB;

import static org.bytedeco.opencv.global.opencv_core.NORM_HAMMING;

public class OrbCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public OrbCorrespondenceEngine(DetectorConfig config) {
        super("ORB", createDetector(config), NORM_HAMMING, true);
    }

    private static ORB createDetector(DetectorConfig config) {
        ORB orb = ORB.create();
        orb.setMaxFeatures(config.getFeatureCount());
        orb.setScaleFactor(config.getScaleFactor());
        orb.setNLevels(config.getLevels());
        return orb;
    }
}
