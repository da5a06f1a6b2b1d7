package com.canvaslink.mapping;

import com.canvaslink.imageOperator.FakeImage;
import com.canvaslink.matchAndTransform.FeatureMatch;
import com.canvaslink.matchAndTransform.ImagePoint;
import com.canvaslink.pane.Pane;
import com.canvaslink.pane.PaneRect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateMapperTest {

    private Pane feed;
    private Pane capture;

    @BeforeEach
    void setUp() {
        feed = new Pane("feed", new PaneRect(0, 0, 1280, 1080));
        capture = new Pane("capture-0", new PaneRect(800, 0, 1200, 300));
    }

    @Test
    void testToGlobal_TranslatesByFlooredOffsets() {
        feed.assign(new FakeImage(1280, 720), FakeImage.scaler());
        capture.assign(new FakeImage(1280, 720), FakeImage.scaler());
        FeatureMatch match = new FeatureMatch(new ImagePoint(10.5, 20), new ImagePoint(0, 0), 0.8);

        List<Connection> connections = CoordinateMapper.toGlobal(feed, capture, List.of(match));

        assertEquals(1, connections.size());
        Connection c = connections.get(0);
        assertEquals(new ImagePoint(10.5, 20 + 180), c.getA());
        assertEquals(new ImagePoint(800, 37), c.getB());
        assertEquals(0.8, c.getReliability());
    }

    @Test
    void testToGlobal_KeepsMatchOrder() {
        feed.assign(new FakeImage(1280, 1080), FakeImage.scaler());
        capture.assign(new FakeImage(400, 300), FakeImage.scaler());
        List<FeatureMatch> matches = List.of(
                new FeatureMatch(new ImagePoint(1, 1), new ImagePoint(2, 2), 1.0),
                new FeatureMatch(new ImagePoint(3, 3), new ImagePoint(4, 4), 0.5));

        List<Connection> connections = CoordinateMapper.toGlobal(feed, capture, matches);

        assertEquals(new ImagePoint(1, 1), connections.get(0).getA());
        assertEquals(new ImagePoint(804, 4), connections.get(1).getB());
    }

    @Test
    void testToGlobal_EmptyPaneYieldsNothing() {
        feed.assign(new FakeImage(640, 480), FakeImage.scaler());
        FeatureMatch match = new FeatureMatch(new ImagePoint(1, 1), new ImagePoint(2, 2), 1.0);

        assertTrue(CoordinateMapper.toGlobal(feed, capture, List.of(match)).isEmpty());
    }

    @Test
    void testToGlobal_NoMatches() {
        feed.assign(new FakeImage(640, 480), FakeImage.scaler());
        capture.assign(new FakeImage(640, 480), FakeImage.scaler());

        assertTrue(CoordinateMapper.toGlobal(feed, capture, List.of()).isEmpty());
    }

    @Test
    void testToGlobal_ScalesSourcePointsIntoDisplayedSpace() {
        feed.assign(new FakeImage(1280, 1080), FakeImage.scaler());
        capture.assign(new FakeImage(1280, 720), FakeImage.scaler());
        FeatureMatch match = new FeatureMatch(new ImagePoint(100, 100), new ImagePoint(640, 360), 0.5);

        List<Connection> connections = CoordinateMapper.toGlobal(feed, capture, List.of(match),
                feed.displayScaleX(), feed.displayScaleY(), capture.displayScaleX(), capture.displayScaleY());

        assertEquals(new ImagePoint(100, 100), connections.get(0).getA());
        assertEquals(800 + 200.0, connections.get(0).getB().getX(), 1e-9);
        assertEquals(37 + 112.5, connections.get(0).getB().getY(), 1e-9);
    }
}
