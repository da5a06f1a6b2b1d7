package com.canvaslink.render;

import com.canvaslink.pane.PaneRect;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Cosmetic random circles inside pane rects, paired by position across two panes. Has no relation to
 * detected features and never feeds the connection set.
 * <p>
 * Circles are not cached: every call draws from the shared {@link Random}, so a renderer that asks on each
 * frame gets a new arrangement each time and the overlay changes between renders.
 */
public class DecorativeOverlay {
    private final Random random;

    public DecorativeOverlay(Random random) {
        this.random = random;
    }

    /**
     * {@code count} circles uniformly placed inside {@code rect}, radius between 1/20 and 1/5 of the
     * rect's shorter side.
     */
    public List<CircleFeature> randomCircles(PaneRect rect, int count) {
        int w = (int) rect.width();
        int h = (int) rect.height();
        int minRadius = Math.max(1, Math.min(w, h) / 20);
        int maxRadius = Math.max(minRadius, Math.min(w, h) / 5);

        List<CircleFeature> circles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int x = (int) rect.getX0() + random.nextInt(w + 1);
            int y = (int) rect.getY0() + random.nextInt(h + 1);
            int radius = minRadius + random.nextInt(maxRadius - minRadius + 1);
            circles.add(new CircleFeature(x, y, radius, random.nextInt(256), random.nextInt(256), random.nextInt(256)));
        }
        return circles;
    }

    /**
     * Pairs the i-th circle of {@code a} with the i-th circle of {@code b}.
     */
    public List<CircleFeature[]> pairPositionally(List<CircleFeature> a, List<CircleFeature> b) {
        int n = Math.min(a.size(), b.size());
        List<CircleFeature[]> pairs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            pairs.add(new CircleFeature[]{a.get(i), b.get(i)});
        }
        return pairs;
    }
}
