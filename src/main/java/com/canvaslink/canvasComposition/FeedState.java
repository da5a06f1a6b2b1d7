package com.canvaslink.canvasComposition;

/** Once streaming, the feed pane never goes back to uninitialized. */
public enum FeedState {
    UNINITIALIZED,
    STREAMING
}
