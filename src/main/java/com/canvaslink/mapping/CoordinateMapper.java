package com.canvaslink.mapping;

import com.canvaslink.matchAndTransform.FeatureMatch;
import com.canvaslink.pane.FitGeometry;
import com.canvaslink.pane.Pane;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Translates pane-local match points into canvas coordinates.
 * <p>
 * Points are expected in the pixel space of the image displayed in the pane (the fit-scaled raster).
 * Matches computed on the original capture must go through the scaled overload instead.
 */
public class CoordinateMapper {

    private CoordinateMapper() {
    }

    /**
     * Returns an empty list when either pane has no fit geometry.
     */
    public static List<Connection> toGlobal(Pane paneA, Pane paneB, List<FeatureMatch> matches) {
        return toGlobal(paneA, paneB, matches, 1.0, 1.0, 1.0, 1.0);
    }

    /**
     * Like {@link #toGlobal(Pane, Pane, List)} but first scales each point from the matched image's pixel
     * space into the displayed one.
     */
    public static List<Connection> toGlobal(Pane paneA, Pane paneB, List<FeatureMatch> matches,
                                            double scaleAX, double scaleAY, double scaleBX, double scaleBY) {
        FitGeometry fitA = paneA.getFit();
        FitGeometry fitB = paneB.getFit();
        if (fitA == null || fitB == null || matches.isEmpty()) {
            return Collections.emptyList();
        }

        int ax = fitA.pixelOffsetX(), ay = fitA.pixelOffsetY();
        int bx = fitB.pixelOffsetX(), by = fitB.pixelOffsetY();

        List<Connection> connections = new ArrayList<>(matches.size());
        for (FeatureMatch m : matches) {
            connections.add(new Connection(
                    m.getPoint1().scale(scaleAX, scaleAY).translate(ax, ay),
                    m.getPoint2().scale(scaleBX, scaleBY).translate(bx, by),
                    m.getReliability()));
        }
        return connections;
    }
}
