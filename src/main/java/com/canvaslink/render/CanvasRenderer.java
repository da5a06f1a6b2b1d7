package com.canvaslink.render;

import com.canvaslink.canvasComposition.CanvasSnapshot;

/**
 * Turns a canvas snapshot into something displayable.
 *
 * @param <T> output raster type
 */
public interface CanvasRenderer<T> {

    T render(CanvasSnapshot snapshot);
}
