package com.canvaslink.render;

import com.canvaslink.canvasComposition.CanvasSnapshot;
import com.canvaslink.canvasComposition.PanePair;
import com.canvaslink.canvasComposition.PaneView;
import com.canvaslink.mapping.Connection;
import com.canvaslink.pane.FitGeometry;
import com.canvaslink.pane.PaneRect;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;

import java.util.List;
import java.util.Map;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Composes the canvas into a BGR {@link Mat}: each displayed image pasted at its floored fit offset,
 * pane outlines, then connection lines. Stronger matches are drawn thicker and brighter.
 */
public class MatCanvasRenderer implements CanvasRenderer<Mat> {
    private static final Scalar BACKGROUND = new Scalar(0, 0, 0, 0);
    private static final Scalar OUTLINE = new Scalar(80, 80, 80, 0);
    // BGR
    private static final double[][] PAIR_COLOURS = {
            {0, 255, 0}, {0, 200, 255}, {255, 128, 0}, {255, 0, 255}, {0, 0, 255}, {255, 255, 0}
    };
    private static final int EMPHASISED_RANKS = 10;

    private final DecorativeOverlay overlay;
    private final int decorativePoints;

    public MatCanvasRenderer() {
        this(null, 0);
    }

    public MatCanvasRenderer(DecorativeOverlay overlay, int decorativePoints) {
        this.overlay = overlay;
        this.decorativePoints = (overlay == null) ? 0 : decorativePoints;
    }

    @Override
    public Mat render(CanvasSnapshot snapshot) {
        Mat canvas = new Mat(snapshot.getHeight(), snapshot.getWidth(), CV_8UC3, BACKGROUND);

        for (PaneView pane : snapshot.getPanes()) {
            if (pane.hasImage()) {
                paste(canvas, pane.getImage().mat(), pane.getFit());
            }
            PaneRect r = pane.getRect();
            rectangle(canvas, new Point((int) r.getX0(), (int) r.getY0()),
                    new Point((int) r.getX1() - 1, (int) r.getY1() - 1), OUTLINE, 1, LINE_8, 0);
        }

        int pairIndex = 0;
        for (Map.Entry<PanePair, List<Connection>> entry : snapshot.getConnections().entrySet()) {
            double[] colour = PAIR_COLOURS[pairIndex++ % PAIR_COLOURS.length];
            List<Connection> ranked = entry.getValue();
            for (int rank = 0; rank < ranked.size(); rank++) {
                drawConnection(canvas, ranked.get(rank), colour, rank, ranked.size());
            }
        }

        if (decorativePoints > 0) {
            drawDecorations(canvas, snapshot);
        }
        return canvas;
    }

    private static void paste(Mat canvas, Mat image, FitGeometry fit) {
        int x = fit.pixelOffsetX();
        int y = fit.pixelOffsetY();
        int w = Math.min(image.cols(), canvas.cols() - x);
        int h = Math.min(image.rows(), canvas.rows() - y);
        if (w <= 0 || h <= 0 || x < 0 || y < 0) return;

        Mat bgr = image;
        if (image.channels() == 1) {
            bgr = new Mat();
            cvtColor(image, bgr, COLOR_GRAY2BGR);
        } else if (image.channels() == 4) {
            bgr = new Mat();
            cvtColor(image, bgr, COLOR_BGRA2BGR);
        }
        Mat src = new Mat(bgr, new Rect(0, 0, w, h));
        Mat dst = new Mat(canvas, new Rect(x, y, w, h));
        src.copyTo(dst);
    }

    private static void drawConnection(Mat canvas, Connection c, double[] colour, int rank, int count) {
        // rank 0 at full brightness fading to 40% for the last one
        double fade = (count <= 1) ? 1.0 : 1.0 - 0.6 * rank / (count - 1);
        Scalar scalar = new Scalar(colour[0] * fade, colour[1] * fade, colour[2] * fade, 0);
        int thickness = rank < EMPHASISED_RANKS ? 2 : 1;
        line(canvas, toPoint(c.getA().getX(), c.getA().getY()), toPoint(c.getB().getX(), c.getB().getY()),
                scalar, thickness, LINE_AA, 0);
        circle(canvas, toPoint(c.getA().getX(), c.getA().getY()), 3, scalar, 1, LINE_AA, 0);
        circle(canvas, toPoint(c.getB().getX(), c.getB().getY()), 3, scalar, 1, LINE_AA, 0);
    }

    // fresh circles per render, see DecorativeOverlay
    private void drawDecorations(Mat canvas, CanvasSnapshot snapshot) {
        List<PaneView> panes = snapshot.getPanes();
        PaneView feed = panes.get(0);
        if (!feed.hasImage()) return;
        for (PaneView capture : panes.subList(1, panes.size())) {
            if (!capture.hasImage()) continue;
            List<CircleFeature> from = overlay.randomCircles(feed.getRect(), decorativePoints);
            List<CircleFeature> to = overlay.randomCircles(capture.getRect(), decorativePoints);
            for (CircleFeature[] pair : overlay.pairPositionally(from, to)) {
                Scalar colour = new Scalar(pair[0].getBlue(), pair[0].getGreen(), pair[0].getRed(), 0);
                circle(canvas, new Point(pair[0].getX(), pair[0].getY()), pair[0].getRadius(), colour, 1, LINE_AA, 0);
                circle(canvas, new Point(pair[1].getX(), pair[1].getY()), pair[1].getRadius(), colour, 1, LINE_AA, 0);
                line(canvas, new Point(pair[0].getX(), pair[0].getY()), new Point(pair[1].getX(), pair[1].getY()),
                        colour, 1, LINE_AA, 0);
            }
        }
    }

    private static Point toPoint(double x, double y) {
        return new Point((int) Math.round(x), (int) Math.round(y));
    }
}
