package com.canvaslink.matchAndTransform;

public enum DetectorType {
    ORB,
    KAZE,
    AKAZE,
    BRISK,
    SURF,
    SIFT
}
