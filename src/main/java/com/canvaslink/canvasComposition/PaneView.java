package com.canvaslink.canvasComposition;

import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.pane.FitGeometry;
import com.canvaslink.pane.Pane;
import com.canvaslink.pane.PaneRect;
import lombok.Getter;

/**
 * Read-only copy of a pane's state at snapshot time. Image and fit always come from the same assignment.
 */
@Getter
public class PaneView {
    private final String id;
    private final PaneRect rect;
    private final CanvasImage image;
    private final FitGeometry fit;

    PaneView(Pane pane) {
        this.id = pane.getId();
        this.rect = pane.getRect();
        Pane.Content content = pane.content();
        this.image = content == null ? null : content.getImage();
        this.fit = content == null ? null : content.getFit();
    }

    public boolean hasImage() {
        return image != null;
    }
}
