package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_features2d.KAZE;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

public class KazeCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public KazeCorrespondenceEngine(DetectorConfig config) {
        super("KAZE", createDetector(config), NORM_L2, false);
    }

    private static KAZE createDetector(DetectorConfig config) {
        KAZE kaze = KAZE.create();
        kaze.setExtended(config.isExtended());
        kaze.setUpright(config.isUpright());
        kaze.setThreshold(config.getThreshold());
        kaze.setNOctaves(config.getLevels());
        kaze.setNOctaveLayers(config.getOctaveLayers());
        return kaze;
    }
}
