package com.canvaslink.canvasComposition;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.exception.InvalidGeometryException;
import com.canvaslink.exception.PaneIndexOutOfRangeException;
import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.ImageScaler;
import com.canvaslink.mapping.Connection;
import com.canvaslink.mapping.CoordinateMapper;
import com.canvaslink.matchAndTransform.CorrespondenceEngine;
import com.canvaslink.matchAndTransform.FeatureMatch;
import com.canvaslink.pane.Pane;
import com.canvaslink.pane.PaneRect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Owns the feed pane, the capture panes and the connections between them.
 * <p>
 * Every image change runs one transition: the changed pane is fitted, each pane paired with it is matched
 * against it, and the connection map is replaced by a new immutable map in which the changed pane's pairs
 * hold only fresh results. Pairs not involving the changed pane are carried over untouched.
 * <p>
 * Transitions are not thread safe; callers serialise them. Readers may call {@link #getConnections()} or
 * {@link #snapshot()} concurrently: each pane view holds an image with its own fit and the connection map
 * is always complete, though panes and connections in one snapshot may come from adjacent transitions.
 */
public class Canvas {
    private static final Logger logger = LoggerFactory.getLogger(Canvas.class);

    public static final String FEED_PANE_ID = "feed";

    private final CanvasLayout layout;
    private final Pane feedPane;
    private final List<Pane> capturePanes;
    private final CorrespondenceEngine engine;
    private final ImageScaler scaler;
    private final PairingPolicy pairingPolicy;
    private final MatchResolution matchResolution;

    private FeedState feedState = FeedState.UNINITIALIZED;
    private volatile Map<PanePair, List<Connection>> connections = Collections.emptyMap();

    public Canvas(CanvasLayout layout, CorrespondenceEngine engine, ImageScaler scaler,
                  PairingPolicy pairingPolicy, MatchResolution matchResolution) {
        this.layout = layout;
        this.engine = engine;
        this.scaler = scaler;
        this.pairingPolicy = pairingPolicy;
        this.matchResolution = matchResolution;
        this.feedPane = new Pane(FEED_PANE_ID, layout.getFeedRect());
        List<Pane> captures = new ArrayList<>();
        List<PaneRect> rects = layout.getCaptureRects();
        for (int i = 0; i < rects.size(); i++) {
            captures.add(new Pane(capturePaneId(i), rects.get(i)));
        }
        this.capturePanes = Collections.unmodifiableList(captures);
    }

    public static String capturePaneId(int index) {
        return "capture-" + index;
    }

    /**
     * Shows a new feed frame and rebuilds the connections of the feed pane.
     *
     * @throws InvalidGeometryException if the frame has no area; the feed pane is left unchanged
     */
    public TransitionReport updateFeed(CanvasImage frame) {
        feedPane.assign(frame, scaler);
        if (feedState == FeedState.UNINITIALIZED) {
            logger.info("Feed streaming, first frame {}x{}", frame.getWidth(), frame.getHeight());
            feedState = FeedState.STREAMING;
        }
        return recompute(feedPane);
    }

    /**
     * Replaces the image of capture pane {@code index} and rebuilds its connections.
     *
     * @throws PaneIndexOutOfRangeException if {@code index} is not a capture pane; nothing changes
     * @throws InvalidGeometryException     if the image has no area; the pane is left unchanged
     */
    public TransitionReport capture(int index, CanvasImage image) {
        checkCaptureIndex(index);
        Pane pane = capturePanes.get(index);
        pane.assign(image, scaler);
        logger.debug("Captured {}x{} into {} -> {}", image.getWidth(), image.getHeight(), pane.getId(), pane.getFit());
        return recompute(pane);
    }

    private TransitionReport recompute(Pane changed) {
        Map<PanePair, List<Connection>> previous = connections;
        Map<PanePair, List<Connection>> next = new TreeMap<>();
        for (Map.Entry<PanePair, List<Connection>> entry : previous.entrySet()) {
            if (!entry.getKey().involves(changed.getId())) {
                next.put(entry.getKey(), entry.getValue());
            }
        }

        List<PanePair> updated = new ArrayList<>();
        List<PairFailure> failures = new ArrayList<>();
        for (Pane partner : partnersOf(changed)) {
            Pane first = order(changed) < order(partner) ? changed : partner;
            Pane second = (first == changed) ? partner : changed;
            PanePair pair = new PanePair(first.getId(), order(first), second.getId(), order(second));
            try {
                List<Connection> pairConnections = connect(first, second);
                next.put(pair, Collections.unmodifiableList(pairConnections));
                updated.add(pair);
            } catch (DetectorUnavailableException | InvalidGeometryException e) {
                logger.warn("No connections for {}: {}", pair, e.getMessage());
                failures.add(new PairFailure(pair, e));
            }
        }

        connections = Collections.unmodifiableMap(next);
        return new TransitionReport(changed.getId(), updated, failures);
    }

    private List<Connection> connect(Pane first, Pane second) {
        if (matchResolution == MatchResolution.SOURCE) {
            List<FeatureMatch> matches = engine.match(first.getSourceImage(), second.getSourceImage());
            return CoordinateMapper.toGlobal(first, second, matches,
                    first.displayScaleX(), first.displayScaleY(),
                    second.displayScaleX(), second.displayScaleY());
        }
        List<FeatureMatch> matches = engine.match(first.getImage(), second.getImage());
        return CoordinateMapper.toGlobal(first, second, matches);
    }

    private List<Pane> partnersOf(Pane changed) {
        List<Pane> partners = new ArrayList<>();
        if (changed == feedPane) {
            for (Pane capture : capturePanes) {
                if (capture.hasImage()) partners.add(capture);
            }
            return partners;
        }
        if (feedState == FeedState.STREAMING) {
            partners.add(feedPane);
        }
        if (pairingPolicy == PairingPolicy.ALL_PAIRS) {
            for (Pane capture : capturePanes) {
                if (capture != changed && capture.hasImage()) partners.add(capture);
            }
        }
        return partners;
    }

    private int order(Pane pane) {
        return pane == feedPane ? 0 : capturePanes.indexOf(pane) + 1;
    }

    public FeedState getFeedState() {
        return feedState;
    }

    /**
     * @throws PaneIndexOutOfRangeException if {@code index} is not a capture pane
     */
    public void checkCaptureIndex(int index) {
        if (index < 0 || index >= capturePanes.size()) {
            throw new PaneIndexOutOfRangeException(index, capturePanes.size());
        }
    }

    public CapturePaneState getCaptureState(int index) {
        checkCaptureIndex(index);
        return capturePanes.get(index).hasImage() ? CapturePaneState.POPULATED : CapturePaneState.EMPTY;
    }

    public int getCapturePaneCount() {
        return capturePanes.size();
    }

    /** The latest frame as received, before fitting; null until the feed streams. */
    public CanvasImage getLatestFeedFrame() {
        return feedPane.getSourceImage();
    }

    public Map<PanePair, List<Connection>> getConnectionsByPair() {
        return connections;
    }

    public List<Connection> getConnections() {
        List<Connection> all = new ArrayList<>();
        connections.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    public CanvasSnapshot snapshot() {
        List<PaneView> views = new ArrayList<>();
        views.add(new PaneView(feedPane));
        for (Pane capture : capturePanes) {
            views.add(new PaneView(capture));
        }
        return new CanvasSnapshot(layout.getWidth(), layout.getHeight(),
                Collections.unmodifiableList(views), connections);
    }
}
