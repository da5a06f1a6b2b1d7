package com.canvaslink.matchAndTransform.detector;

import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.ColourImageToGray;
import com.canvaslink.matchAndTransform.AbstractCorrespondenceEngine;
import com.canvaslink.matchAndTransform.RawCorrespondence;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.Feature2D;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenCV detect-and-compute followed by brute-force matching under the variant's norm.
 */
public abstract class OpenCvCorrespondenceEngine extends AbstractCorrespondenceEngine<OpenCvFeatures> {
    private final String name;
    private final Feature2D detector;
    private final BFMatcher matcher;

    protected OpenCvCorrespondenceEngine(String name, Feature2D detector, int normType, boolean crossCheck) {
        this.name = name;
        this.detector = detector;
        this.matcher = new BFMatcher(normType, crossCheck);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    protected OpenCvFeatures describe(CanvasImage image) {
        Mat gray = ColourImageToGray.toGray(image.mat());
        KeyPointVector keypoints = new KeyPointVector();
        Mat descriptors = new Mat();
        detector.detectAndCompute(gray, new Mat(), keypoints, descriptors);
        if (gray != image.mat()) gray.release();
        return new OpenCvFeatures(keypoints, descriptors);
    }

    @Override
    protected List<RawCorrespondence> correspond(OpenCvFeatures describedA, OpenCvFeatures describedB) {
        DMatchVector matches = new DMatchVector();
        matcher.match(describedA.descriptors, describedB.descriptors, matches);

        long size = matches.size();
        List<RawCorrespondence> result = new ArrayList<>((int) size);
        for (long i = 0; i < size; i++) {
            DMatch m = matches.get(i);
            result.add(new RawCorrespondence(
                    describedA.location(m.queryIdx()),
                    describedB.location(m.trainIdx()),
                    m.distance()));
        }
        return result;
    }
}
