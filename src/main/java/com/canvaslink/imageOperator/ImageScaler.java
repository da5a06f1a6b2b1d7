package com.canvaslink.imageOperator;

public interface ImageScaler {

    CanvasImage scale(CanvasImage image, int width, int height);
}
