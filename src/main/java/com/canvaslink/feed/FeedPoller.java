package com.canvaslink.feed;

import com.canvaslink.API.CanvasService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pulls camera frames into the feed pane on a fixed delay. Only active with
 * {@code canvas.feed.camera-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "canvas.feed", name = "camera-enabled", havingValue = "true")
public class FeedPoller {
    private static final Logger logger = LoggerFactory.getLogger(FeedPoller.class);

    private final FrameSource frameSource;
    private final CanvasService canvasService;

    public FeedPoller(FrameSource frameSource, CanvasService canvasService) {
        this.frameSource = frameSource;
        this.canvasService = canvasService;
    }

    @Scheduled(fixedDelayString = "${canvas.feed.poll-interval-ms:33}")
    public void poll() {
        try {
            frameSource.grab().ifPresent(canvasService::pushFrame);
        } catch (RuntimeException e) {
            logger.warn("Feed frame dropped: {}", e.getMessage());
        }
    }
}
