package com.canvaslink.render;

import com.canvaslink.pane.PaneRect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DecorativeOverlayTest {

    @Test
    void testRandomCircles_StayInsideRectWithBoundedRadius() {
        DecorativeOverlay overlay = new DecorativeOverlay(new Random(5));
        PaneRect rect = new PaneRect(1280, 270, 1920, 540);

        List<CircleFeature> circles = overlay.randomCircles(rect, 200);

        assertEquals(200, circles.size());
        for (CircleFeature c : circles) {
            assertTrue(c.getX() >= 1280 && c.getX() <= 1920);
            assertTrue(c.getY() >= 270 && c.getY() <= 540);
            assertTrue(c.getRadius() >= 270 / 20 && c.getRadius() <= 270 / 5);
            assertTrue(c.getRed() >= 0 && c.getRed() < 256);
        }
    }

    @Test
    void testRandomCircles_SameSeedSameCircles() {
        PaneRect rect = new PaneRect(0, 0, 100, 100);

        List<CircleFeature> first = new DecorativeOverlay(new Random(9)).randomCircles(rect, 3);
        List<CircleFeature> second = new DecorativeOverlay(new Random(9)).randomCircles(rect, 3);

        for (int i = 0; i < 3; i++) {
            assertEquals(first.get(i).getX(), second.get(i).getX());
            assertEquals(first.get(i).getRadius(), second.get(i).getRadius());
        }
    }

    @Test
    void testRandomCircles_RegeneratedOnEveryCall() {
        DecorativeOverlay overlay = new DecorativeOverlay(new Random(11));
        PaneRect rect = new PaneRect(0, 0, 640, 480);

        List<CircleFeature> first = overlay.randomCircles(rect, 10);
        List<CircleFeature> second = overlay.randomCircles(rect, 10);

        boolean moved = false;
        for (int i = 0; i < 10; i++) {
            moved |= first.get(i).getX() != second.get(i).getX() || first.get(i).getY() != second.get(i).getY();
        }
        assertTrue(moved);
    }

    @Test
    void testPairPositionally_TruncatesToShorterList() {
        DecorativeOverlay overlay = new DecorativeOverlay(new Random(1));
        PaneRect rect = new PaneRect(0, 0, 100, 100);
        List<CircleFeature> a = overlay.randomCircles(rect, 5);
        List<CircleFeature> b = overlay.randomCircles(rect, 3);

        List<CircleFeature[]> pairs = overlay.pairPositionally(a, b);

        assertEquals(3, pairs.size());
        assertSame(a.get(2), pairs.get(2)[0]);
        assertSame(b.get(2), pairs.get(2)[1]);
    }
}
