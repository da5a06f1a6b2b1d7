package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.matchAndTransform.DetectorConfig;
import org.bytedeco.opencv.opencv_features2d.AKAZE;

import static org.bytedeco.opencv.global.opencv_core.NORM_HAMMING;
import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * AKAZE with either KAZE (float, L2) or MLDB (binary, Hamming) descriptors.
 */
public class AkazeCorrespondenceEngine extends OpenCvCorrespondenceEngine {

    public AkazeCorrespondenceEngine(DetectorConfig config) {
        super("AKAZE", createDetector(config), normFor(config.getDescriptorType()), false);
    }

    static int normFor(int descriptorType) {
        return descriptorType == DetectorConfig.AKAZE_DESCRIPTOR_KAZE
                || descriptorType == DetectorConfig.AKAZE_DESCRIPTOR_KAZE_UPRIGHT ? NORM_L2 : NORM_HAMMING;
    }

    private static AKAZE createDetector(DetectorConfig config) {
        AKAZE akaze = AKAZE.create();
        akaze.setDescriptorType(config.getDescriptorType());
        akaze.setThreshold(config.getThreshold());
        akaze.setNOctaves(config.getLevels());
        akaze.setNOctaveLayers(config.getOctaveLayers());
        return akaze;
    }
}
