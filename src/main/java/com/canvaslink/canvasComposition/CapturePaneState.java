package com.canvaslink.canvasComposition;

public enum CapturePaneState {
    EMPTY,
    POPULATED
}
