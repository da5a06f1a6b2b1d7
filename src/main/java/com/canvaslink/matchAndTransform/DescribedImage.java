package com.canvaslink.matchAndTransform;

/**
 * Keypoints and descriptors computed for one image by a detector.
 */
public interface DescribedImage {

    int numberOfFeatures();

    default boolean isEmpty() {
        return numberOfFeatures() == 0;
    }
}
