package com.canvaslink.render;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A coloured circle in canvas coordinates. Colour channels are in BGR order.
 */
@Getter
@AllArgsConstructor
public class CircleFeature {
    private final int x;
    private final int y;
    private final int radius;
    private final int blue;
    private final int green;
    private final int red;
}
