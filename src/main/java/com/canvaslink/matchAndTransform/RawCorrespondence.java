package com.canvaslink.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A detector-reported correspondence before scoring: a point in each image and the descriptor distance.
 */
@Getter
@AllArgsConstructor
public class RawCorrespondence {
    private final ImagePoint query;
    private final ImagePoint train;
    private final double distance;
}
