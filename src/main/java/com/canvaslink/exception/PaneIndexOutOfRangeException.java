package com.canvaslink.exception;

public class PaneIndexOutOfRangeException extends IndexOutOfBoundsException {

    public PaneIndexOutOfRangeException(int index, int paneCount) {
        super("Capture pane index " + index + " is outside 0.." + (paneCount - 1));
    }
}
