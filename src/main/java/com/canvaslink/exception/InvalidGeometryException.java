package com.canvaslink.exception;

/**
 * Raised when a pane rectangle or an image has a zero or negative width or height.
 */
public class InvalidGeometryException extends RuntimeException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
