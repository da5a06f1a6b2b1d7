package com.canvaslink.canvasComposition;

/**
 * Which raster of a pane is handed to the correspondence engine.
 */
public enum MatchResolution {
    /** The fit-scaled image shown in the pane; points map by translation only. */
    DISPLAY,
    /** The capture as received; points are scaled down to the displayed raster before translation. */
    SOURCE
}
