package com.canvaslink.feed;

import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.MatImage;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class VideoCaptureFrameSource implements FrameSource {
    private static final Logger logger = LoggerFactory.getLogger(VideoCaptureFrameSource.class);

    private final int cameraIndex;
    private final VideoCapture capture;

    public VideoCaptureFrameSource(int cameraIndex) {
        this.cameraIndex = cameraIndex;
        this.capture = new VideoCapture(cameraIndex);
        if (!capture.isOpened()) {
            logger.error("Camera {} could not be opened, feed will stay empty", cameraIndex);
        } else {
            logger.info("Camera {} opened", cameraIndex);
        }
    }

    @Override
    public Optional<CanvasImage> grab() {
        if (!capture.isOpened()) return Optional.empty();
        Mat frame = new Mat();
        if (!capture.read(frame) || frame.empty()) {
            frame.release();
            return Optional.empty();
        }
        return Optional.of(new MatImage(frame));
    }

    @Override
    public void close() {
        logger.info("Releasing camera {}", cameraIndex);
        capture.release();
    }
}
