package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.matchAndTransform.detector.AkazeCorrespondenceEngine;
import com.canvaslink.matchAndTransform.detector.BriskCorrespondenceEngine;
import com.canvaslink.matchAndTransform.detector.KazeCorrespondenceEngine;
import com.canvaslink.matchAndTransform.detector.OrbCorrespondenceEngine;
import com.canvaslink.matchAndTransform.detector.SiftCorrespondenceEngine;
import com.canvaslink.matchAndTransform.detector.SurfCorrespondenceEngine;

public class CorrespondenceEngineFactory {

    private CorrespondenceEngineFactory() {
    }

    /**
     * Builds the engine for {@code config.getType()}.
     *
     * @throws DetectorUnavailableException if the variant cannot be constructed, e.g. SURF without the
     *                                      non-free module
     */
    public static CorrespondenceEngine create(DetectorConfig config) {
        try {
            switch (config.getType()) {
                case ORB:
                    return new OrbCorrespondenceEngine(config);
                case KAZE:
                    return new KazeCorrespondenceEngine(config);
                case AKAZE:
                    return new AkazeCorrespondenceEngine(config);
                case BRISK:
                    return new BriskCorrespondenceEngine(config);
                case SURF:
                    return new SurfCorrespondenceEngine(config);
                case SIFT:
                    return new SiftCorrespondenceEngine(config);
                default:
                    throw new DetectorUnavailableException("Unsupported detector " + config.getType());
            }
        } catch (DetectorUnavailableException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new DetectorUnavailableException("Cannot create " + config.getType() + " detector: " + e.getMessage(), e);
        }
    }
}
