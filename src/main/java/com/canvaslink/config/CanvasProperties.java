package com.canvaslink.config;

import com.canvaslink.canvasComposition.MatchResolution;
import com.canvaslink.canvasComposition.PairingPolicy;
import com.canvaslink.matchAndTransform.DetectorConfig;
import com.canvaslink.matchAndTransform.DetectorType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code canvas} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "canvas")
public class CanvasProperties {
    private int width = 1920;
    private int height = 1080;
    private int captureCount = 4;
    private PairingPolicy pairing = PairingPolicy.FEED_TO_CAPTURES;
    private final Matching matching = new Matching();
    private final Detector detector = new Detector();
    private final Feed feed = new Feed();
    private final Overlay overlay = new Overlay();

    @Getter
    @Setter
    public static class Matching {
        private MatchResolution resolution = MatchResolution.DISPLAY;
        /** Per-call deadline; 0 disables it. */
        private long timeoutMs = 0;
    }

    /**
     * Detector type plus optional overrides of that type's defaults.
     */
    @Getter
    @Setter
    public static class Detector {
        private DetectorType type = DetectorType.ORB;
        private Integer featureCount;
        private Double scaleFactor;
        private Integer levels;
        private Integer octaveLayers;
        private Double threshold;
        private Boolean extended;
        private Boolean upright;
        private Integer descriptorType;

        public DetectorConfig toDetectorConfig() {
            DetectorConfig.DetectorConfigBuilder b = DetectorConfig.defaults(type).toBuilder();
            if (featureCount != null) b.featureCount(featureCount);
            if (scaleFactor != null) b.scaleFactor(scaleFactor);
            if (levels != null) b.levels(levels);
            if (octaveLayers != null) b.octaveLayers(octaveLayers);
            if (threshold != null) b.threshold(threshold);
            if (extended != null) b.extended(extended);
            if (upright != null) b.upright(upright);
            if (descriptorType != null) b.descriptorType(descriptorType);
            return b.build();
        }
    }

    @Getter
    @Setter
    public static class Feed {
        private boolean cameraEnabled = false;
        private int cameraIndex = 0;
        private long pollIntervalMs = 33;
    }

    @Getter
    @Setter
    public static class Overlay {
        /** Random decorative circles per pane pair; 0 turns the overlay off. */
        private int decorativePoints = 0;
    }
}
