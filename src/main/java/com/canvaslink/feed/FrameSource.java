package com.canvaslink.feed;

import com.canvaslink.imageOperator.CanvasImage;

import java.util.Optional;

/**
 * Pull-model source of feed frames.
 */
public interface FrameSource extends AutoCloseable {

    /** The next frame, or empty when none is available right now. */
    Optional<CanvasImage> grab();

    @Override
    void close();
}
