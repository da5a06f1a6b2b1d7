package com.canvaslink.canvasComposition;

import com.canvaslink.pane.PaneRect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanvasLayoutTest {

    @Test
    void testStandard_FeedLeftCapturesStackedRight() {
        CanvasLayout layout = CanvasLayout.standard(1920, 1080, 4);

        assertEquals(new PaneRect(0, 0, 1280, 1080), layout.getFeedRect());
        List<PaneRect> captures = layout.getCaptureRects();
        assertEquals(4, captures.size());
        assertEquals(new PaneRect(1280, 0, 1920, 270), captures.get(0));
        assertEquals(new PaneRect(1280, 810, 1920, 1080), captures.get(3));
    }

    @Test
    void testStandard_CaptureRectsTileRightColumn() {
        CanvasLayout layout = CanvasLayout.standard(900, 700, 3);

        List<PaneRect> captures = layout.getCaptureRects();
        for (int i = 1; i < captures.size(); i++) {
            assertEquals(captures.get(i - 1).getY1(), captures.get(i).getY0());
        }
        assertEquals(700.0, captures.get(2).getY1());
    }

    @Test
    void testStandard_RejectsNoCapturePanes() {
        assertThrows(IllegalArgumentException.class, () -> CanvasLayout.standard(1920, 1080, 0));
    }

    @Test
    void testConstructor_RejectsNonPositiveSize() {
        PaneRect r = new PaneRect(0, 0, 10, 10);
        assertThrows(IllegalArgumentException.class, () -> new CanvasLayout(0, 100, r, List.of(r)));
    }
}
