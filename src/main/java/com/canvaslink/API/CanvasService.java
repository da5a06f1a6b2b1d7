package com.canvaslink.API;

import com.canvaslink.canvasComposition.Canvas;
import com.canvaslink.canvasComposition.CanvasSnapshot;
import com.canvaslink.canvasComposition.TransitionReport;
import com.canvaslink.exception.PaneIndexOutOfRangeException;
import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.render.MatCanvasRenderer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serialises every canvas transition: HTTP requests and the feed poller run on different threads,
 * while the canvas itself must only be changed by one at a time.
 */
@Service
public class CanvasService {
    private static final Logger logger = LoggerFactory.getLogger(CanvasService.class);

    private final Canvas canvas;
    private final MatCanvasRenderer renderer;
    private final ImageCodecService imageCodecService;

    public CanvasService(Canvas canvas, MatCanvasRenderer renderer, ImageCodecService imageCodecService) {
        this.canvas = canvas;
        this.renderer = renderer;
        this.imageCodecService = imageCodecService;
    }

    public synchronized TransitionReport pushFrame(CanvasImage frame) {
        return canvas.updateFeed(frame);
    }

    public TransitionReport pushFrame(byte[] encodedFrame) {
        return pushFrame(imageCodecService.decode(encodedFrame));
    }

    public synchronized TransitionReport capture(int index, byte[] encodedImage) {
        CanvasImage image = imageCodecService.decode(encodedImage);
        TransitionReport report = canvas.capture(index, image);
        logReport(report);
        return report;
    }

    /**
     * Captures the latest feed frame into pane {@code index}.
     *
     * @throws PaneIndexOutOfRangeException if {@code index} is not a capture pane, checked first
     * @throws IllegalStateException        if no feed frame has arrived yet
     */
    public synchronized TransitionReport captureFromFeed(int index) {
        canvas.checkCaptureIndex(index);
        CanvasImage frame = canvas.getLatestFeedFrame();
        if (frame == null) {
            throw new IllegalStateException("Feed is not streaming yet");
        }
        TransitionReport report = canvas.capture(index, frame);
        logReport(report);
        return report;
    }

    public CanvasSnapshot snapshot() {
        return canvas.snapshot();
    }

    public byte[] renderJpeg() {
        Mat rendered = renderer.render(canvas.snapshot());
        try {
            return imageCodecService.encodeJpeg(rendered);
        } finally {
            rendered.release();
        }
    }

    private static void logReport(TransitionReport report) {
        logger.info("{}: {} pair(s) updated, {} failed", report.getPaneId(),
                report.getUpdatedPairs().size(), report.getFailures().size());
    }
}
