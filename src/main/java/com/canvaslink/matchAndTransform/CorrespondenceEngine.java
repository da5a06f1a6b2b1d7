package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.imageOperator.CanvasImage;

import java.util.List;

/**
 * Finds corresponding features between two images.
 * <p>
 * Implementations return at most {@link CorrespondenceRanker#MAX_MATCHES} matches sorted by reliability,
 * highest first, and an empty list when either image has no descriptors. Images must already be at the
 * resolution the resulting points are meant for (the displayed, fit-scaled raster).
 * <p>
 * Results are repeatable for identical input, except that some detectors order equal-distance candidates
 * differently across platforms. Callers must not depend on the order among equal reliabilities beyond
 * what the detector reported.
 */
public interface CorrespondenceEngine {

    /**
     * @throws DetectorUnavailableException if detection or matching fails
     */
    List<FeatureMatch> match(CanvasImage imageA, CanvasImage imageB);
}
