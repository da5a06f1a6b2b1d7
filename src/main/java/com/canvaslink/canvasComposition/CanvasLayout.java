package com.canvaslink.canvasComposition;

import com.canvaslink.pane.PaneRect;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canvas size and the rects of the feed pane and the capture panes.
 */
@Getter
public class CanvasLayout {
    private final int width;
    private final int height;
    private final PaneRect feedRect;
    private final List<PaneRect> captureRects;

    public CanvasLayout(int width, int height, PaneRect feedRect, List<PaneRect> captureRects) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive: " + width + "x" + height);
        }
        if (captureRects.isEmpty()) {
            throw new IllegalArgumentException("At least one capture pane is required");
        }
        this.width = width;
        this.height = height;
        this.feedRect = feedRect;
        this.captureRects = Collections.unmodifiableList(new ArrayList<>(captureRects));
    }

    /**
     * Feed on the left two thirds, capture panes stacked top to bottom in the right third.
     */
    public static CanvasLayout standard(int width, int height, int captureCount) {
        if (captureCount <= 0) {
            throw new IllegalArgumentException("captureCount must be positive: " + captureCount);
        }
        double x0 = width * 2.0 / 3.0;
        PaneRect feed = new PaneRect(0, 0, x0, height);
        List<PaneRect> captures = new ArrayList<>();
        for (int i = 0; i < captureCount; i++) {
            double y0 = i * (double) height / captureCount;
            double y1 = (i + 1) * (double) height / captureCount;
            captures.add(new PaneRect(x0, y0, width, y1));
        }
        return new CanvasLayout(width, height, feed, captures);
    }
}
