package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.imageOperator.CanvasImage;

import java.util.List;

/**
 * Stands in for an engine whose construction failed. Every match reports the original failure.
 */
public class UnavailableCorrespondenceEngine implements CorrespondenceEngine {
    private final DetectorUnavailableException cause;

    public UnavailableCorrespondenceEngine(DetectorUnavailableException cause) {
        this.cause = cause;
    }

    @Override
    public List<FeatureMatch> match(CanvasImage imageA, CanvasImage imageB) {
        throw new DetectorUnavailableException(cause.getMessage(), cause);
    }
}
