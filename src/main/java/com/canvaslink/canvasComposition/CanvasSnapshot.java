package com.canvaslink.canvasComposition;

import com.canvaslink.mapping.Connection;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything a renderer needs, in canvas-global pixels: the panes in canvas order (feed first) and the
 * connections of every pane pair.
 */
@Getter
@AllArgsConstructor
public class CanvasSnapshot {
    private final int width;
    private final int height;
    private final List<PaneView> panes;
    private final Map<PanePair, List<Connection>> connections;

    public List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>();
        connections.values().forEach(all::addAll);
        return all;
    }
}
