package com.canvaslink.canvasComposition;

/**
 * Which pane pairs get connection lines.
 */
public enum PairingPolicy {
    /** The feed pane against each populated capture pane. */
    FEED_TO_CAPTURES,
    /** Every pair of panes holding an image, captures included. */
    ALL_PAIRS
}
