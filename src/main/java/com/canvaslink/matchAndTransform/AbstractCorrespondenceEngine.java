package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.imageOperator.CanvasImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Detector-independent part of matching: empty-descriptor handling, scoring, ordering and truncation.
 * Subclasses supply detection and descriptor matching.
 *
 * @param <D> the detector's description of one image
 */
public abstract class AbstractCorrespondenceEngine<D extends DescribedImage> implements CorrespondenceEngine {
    private static final Logger logger = LoggerFactory.getLogger(AbstractCorrespondenceEngine.class);

    @Override
    public final List<FeatureMatch> match(CanvasImage imageA, CanvasImage imageB) {
        List<RawCorrespondence> raw;
        try {
            D describedA = describe(imageA);
            if (describedA.isEmpty()) {
                logger.debug("{}: no descriptors in first image", getName());
                return Collections.emptyList();
            }
            D describedB = describe(imageB);
            if (describedB.isEmpty()) {
                logger.debug("{}: no descriptors in second image", getName());
                return Collections.emptyList();
            }
            raw = correspond(describedA, describedB);
            logger.debug("{}: {} x {} features, {} raw correspondences", getName(),
                    describedA.numberOfFeatures(), describedB.numberOfFeatures(), raw.size());
        } catch (DetectorUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DetectorUnavailableException(getName() + " failed: " + e.getMessage(), e);
        }
        return CorrespondenceRanker.rank(raw);
    }

    public abstract String getName();

    protected abstract D describe(CanvasImage image);

    /**
     * Best correspondences between two non-empty descriptor sets, in the order the matcher reports them.
     */
    protected abstract List<RawCorrespondence> correspond(D describedA, D describedB);
}
