package com.canvaslink.config;

import com.canvaslink.matchAndTransform.DetectorConfig;
import com.canvaslink.matchAndTransform.DetectorType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CanvasPropertiesTest {

    @Test
    void testDetector_UnsetParametersUseTypeDefaults() {
        CanvasProperties properties = new CanvasProperties();
        properties.getDetector().setType(DetectorType.BRISK);

        DetectorConfig config = properties.getDetector().toDetectorConfig();

        assertEquals(DetectorType.BRISK, config.getType());
        assertEquals(30.0, config.getThreshold());
        assertEquals(3, config.getLevels());
    }

    @Test
    void testDetector_OverridesReplaceDefaults() {
        CanvasProperties properties = new CanvasProperties();
        properties.getDetector().setFeatureCount(1500);
        properties.getDetector().setLevels(4);

        DetectorConfig config = properties.getDetector().toDetectorConfig();

        assertEquals(DetectorType.ORB, config.getType());
        assertEquals(1500, config.getFeatureCount());
        assertEquals(4, config.getLevels());
        assertEquals(1.2, config.getScaleFactor());
    }

    @Test
    void testDefaults() {
        CanvasProperties properties = new CanvasProperties();

        assertEquals(1920, properties.getWidth());
        assertEquals(4, properties.getCaptureCount());
        assertEquals(0, properties.getMatching().getTimeoutMs());
        assertFalse(properties.getFeed().isCameraEnabled());
    }
}
