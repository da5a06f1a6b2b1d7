package com.canvaslink.config;

import com.canvaslink.canvasComposition.Canvas;
import com.canvaslink.canvasComposition.CanvasLayout;
import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.feed.FrameSource;
import com.canvaslink.feed.VideoCaptureFrameSource;
import com.canvaslink.imageOperator.ImageScaler;
import com.canvaslink.imageOperator.MatImageScaler;
import com.canvaslink.matchAndTransform.CorrespondenceEngine;
import com.canvaslink.matchAndTransform.CorrespondenceEngineFactory;
import com.canvaslink.matchAndTransform.DeadlineCorrespondenceEngine;
import com.canvaslink.matchAndTransform.DetectorConfig;
import com.canvaslink.matchAndTransform.UnavailableCorrespondenceEngine;
import com.canvaslink.render.DecorativeOverlay;
import com.canvaslink.render.MatCanvasRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(CanvasProperties.class)
public class CanvasConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CanvasConfiguration.class);

    /**
     * A detector that cannot be built leaves the application running; every pair then reports
     * the construction failure.
     */
    @Bean
    public CorrespondenceEngine correspondenceEngine(CanvasProperties properties) {
        DetectorConfig config = properties.getDetector().toDetectorConfig();
        CorrespondenceEngine engine;
        try {
            engine = CorrespondenceEngineFactory.create(config);
            logger.info("Correspondence engine ready: {}", config);
        } catch (DetectorUnavailableException e) {
            logger.error("Detector {} unavailable: {}", config.getType(), e.getMessage());
            return new UnavailableCorrespondenceEngine(e);
        }

        long timeoutMs = properties.getMatching().getTimeoutMs();
        if (timeoutMs > 0) {
            return new DeadlineCorrespondenceEngine(engine, Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "matcher");
                t.setDaemon(true);
                return t;
            }), timeoutMs);
        }
        return engine;
    }

    @Bean
    public ImageScaler imageScaler() {
        return new MatImageScaler();
    }

    @Bean
    public Canvas canvas(CanvasProperties properties, CorrespondenceEngine engine, ImageScaler scaler) {
        CanvasLayout layout = CanvasLayout.standard(properties.getWidth(), properties.getHeight(),
                properties.getCaptureCount());
        logger.info("Canvas {}x{} with {} capture panes, pairing {}, matching on {} images",
                layout.getWidth(), layout.getHeight(), properties.getCaptureCount(),
                properties.getPairing(), properties.getMatching().getResolution());
        return new Canvas(layout, engine, scaler, properties.getPairing(), properties.getMatching().getResolution());
    }

    @Bean
    public MatCanvasRenderer canvasRenderer(CanvasProperties properties) {
        int points = properties.getOverlay().getDecorativePoints();
        if (points > 0) {
            return new MatCanvasRenderer(new DecorativeOverlay(new Random()), points);
        }
        return new MatCanvasRenderer();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "canvas.feed", name = "camera-enabled", havingValue = "true")
    public FrameSource frameSource(CanvasProperties properties) {
        return new VideoCaptureFrameSource(properties.getFeed().getCameraIndex());
    }
}
