package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores raw correspondences, orders them by reliability and keeps the best ones.
 */
public class CorrespondenceRanker {

    /** Upper bound on matches handed to rendering, whatever the detector reports. */
    public static final int MAX_MATCHES = 50;

    private CorrespondenceRanker() {
    }

    /**
     * Maps a descriptor distance into (0, 1].
     *
     * @throws DetectorUnavailableException for a negative, NaN or infinite distance
     */
    public static double reliability(double distance) {
        if (Double.isNaN(distance) || Double.isInfinite(distance) || distance < 0) {
            throw new DetectorUnavailableException("Detector reported invalid distance " + distance);
        }
        return 1.0 / (1.0 + distance);
    }

    /**
     * List.sort is stable, so correspondences with equal reliability keep the detector's order.
     */
    public static List<FeatureMatch> rank(List<RawCorrespondence> correspondences) {
        List<FeatureMatch> result = new ArrayList<>(correspondences.size());
        for (RawCorrespondence c : correspondences) {
            result.add(new FeatureMatch(c.getQuery(), c.getTrain(), reliability(c.getDistance())));
        }
        result.sort(Comparator.comparingDouble(FeatureMatch::getReliability).reversed());
        if (result.size() > MAX_MATCHES) {
            return new ArrayList<>(result.subList(0, MAX_MATCHES));
        }
        return result;
    }
}
