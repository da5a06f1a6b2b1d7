package com.canvaslink.pane;

import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.ImageScaler;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Fixed region of the canvas holding at most one image.
 * <p>
 * {@code image} is the fit-scaled raster that is displayed and matched, {@code sourceImage} the capture
 * it was produced from. Both live in one immutable {@link Content} together with {@code fit}, swapped
 * through a single volatile reference, so a reader on another thread sees all three from the same
 * assignment or none of them.
 */
public class Pane {
    @Getter
    private final String id;
    @Getter
    private final PaneRect rect;
    private volatile Content content;

    /** Image, displayed raster and geometry of one assignment. */
    @Getter
    @AllArgsConstructor
    public static class Content {
        private final CanvasImage sourceImage;
        private final CanvasImage image;
        private final FitGeometry fit;
    }

    public Pane(String id, PaneRect rect) {
        this.id = id;
        this.rect = rect;
    }

    /**
     * Replaces the pane content with {@code capture}, resized to fit the rect.
     * Nothing is changed when the fit or the resize fails.
     */
    public FitGeometry assign(CanvasImage capture, ImageScaler scaler) {
        FitGeometry newFit = FitGeometryEngine.fit(rect, capture.getWidth(), capture.getHeight());
        CanvasImage scaled = scaler.scale(capture, newFit.rasterWidth(), newFit.rasterHeight());
        this.content = new Content(capture, scaled, newFit);
        return newFit;
    }

    /** Current content, or null while the pane is empty. Read once to get a consistent triple. */
    public Content content() {
        return content;
    }

    public boolean hasImage() {
        return content != null;
    }

    public CanvasImage getSourceImage() {
        Content c = content;
        return c == null ? null : c.getSourceImage();
    }

    public CanvasImage getImage() {
        Content c = content;
        return c == null ? null : c.getImage();
    }

    public FitGeometry getFit() {
        Content c = content;
        return c == null ? null : c.getFit();
    }

    /** Factor from source-capture pixels to displayed pixels along x, or 1 for an empty pane. */
    public double displayScaleX() {
        Content c = content;
        if (c == null) return 1.0;
        return (double) c.getImage().getWidth() / c.getSourceImage().getWidth();
    }

    public double displayScaleY() {
        Content c = content;
        if (c == null) return 1.0;
        return (double) c.getImage().getHeight() / c.getSourceImage().getHeight();
    }

    @Override
    public String toString() {
        Content c = content;
        return "Pane[" + id + " " + rect + (c != null ? " " + c.getFit() : " empty") + "]";
    }
}
