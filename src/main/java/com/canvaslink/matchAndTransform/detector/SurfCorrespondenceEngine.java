package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_xfeatures2d.SURF;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * SURF lives in the non-free contrib module; builds without it fail in {@code SURF.create}.
 */
public class SurfCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public SurfCorrespondenceEngine(DetectorConfig config) {
        super("SURF", SURF.create(config.getThreshold(), config.getLevels(), config.getOctaveLayers(),
                config.isExtended(), config.isUpright()), NORM_L2, false);
    }
}
