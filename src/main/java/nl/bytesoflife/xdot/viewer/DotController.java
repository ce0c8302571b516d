package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.layout.AnnotatedLayout;
import nl.bytesoflife.xdot.layout.LayoutEngine;
import nl.bytesoflife.xdot.model.graph.ElementHandle;
import nl.bytesoflife.xdot.model.graph.Graph;
import nl.bytesoflife.xdot.model.graph.Jump;
import nl.bytesoflife.xdot.model.graph.Url;
import nl.bytesoflife.xdot.model.pen.Rgba;
import nl.bytesoflife.xdot.parser.GraphParseException;
import nl.bytesoflife.xdot.parser.XDotLoader;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import nl.bytesoflife.xdot.viewer.animation.Animation;
import nl.bytesoflife.xdot.viewer.animation.AnimationTimer;
import nl.bytesoflife.xdot.viewer.animation.NoAnimation;
import nl.bytesoflife.xdot.viewer.animation.ZoomToAnimation;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.LongSupplier;

/**
 * Interaction state of a graph view: the loaded graph, the viewport, the highlighted
 * elements, the current drag action and the running animation.
 *
 * <p>Toolkit independent. The hosting widget forwards pointer, scroll and key events and
 * draws through {@link #draw(DrawingSurface)}; everything runs on the UI thread.
 */
public class DotController {

    private static final Logger log = LoggerFactory.getLogger(DotController.class);

    static final double CLICK_FUZZ = 4;
    static final long CLICK_TIMEOUT_MILLIS = 1000;

    private final Viewport viewport = new Viewport();
    private final AnimationTimer animationTimer;
    private final LongSupplier clock;
    private final List<DotViewerListener> listeners = new CopyOnWriteArrayList<>();

    private Graph graph = new Graph();
    private Set<ElementHandle> highlight = Set.of();
    private DragAction dragAction = new NullAction(this);
    private Animation animation = new NoAnimation(this);
    private CursorKind cursor = CursorKind.ARROW;

    private boolean pressed;
    private long pressTime;
    private double pressX;
    private double pressY;

    private CompletableFuture<AnnotatedLayout> pendingLayout;

    public DotController(AnimationTimer animationTimer) {
        this(animationTimer, System::currentTimeMillis);
    }

    public DotController(AnimationTimer animationTimer, LongSupplier clock) {
        this.animationTimer = animationTimer;
        this.clock = clock;
    }

    public void addListener(DotViewerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DotViewerListener listener) {
        listeners.remove(listener);
    }

    public Graph getGraph() {
        return graph;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public AnimationTimer getAnimationTimer() {
        return animationTimer;
    }

    public long currentTimeMillis() {
        return clock.getAsLong();
    }

    public Set<ElementHandle> getHighlight() {
        return highlight;
    }

    public DragAction getDragAction() {
        return dragAction;
    }

    public Animation getAnimation() {
        return animation;
    }

    public CursorKind getCursor() {
        return cursor;
    }

    /**
     * Replace the graph and fit it into the window.
     */
    public void setGraph(Graph graph) {
        viewport.zoomToFit(graph.getWidth(), graph.getHeight());
        animation.stop();
        dragAction.abort();
        dragAction = new NullAction(this);
        this.graph = graph;
        this.highlight = Set.of();
        log.debug("Showing {} at {}", graph, viewport);
        for (DotViewerListener listener : listeners) {
            listener.graphLoaded(graph);
        }
        requestRepaint();
    }

    /**
     * Lay out {@code source} and show the result. A load still in progress is cancelled.
     * Completion is handled on {@code uiExecutor}; on failure the current graph stays
     * and listeners get {@code loadFailed}.
     */
    public CompletableFuture<Graph> load(LayoutEngine engine, String source, Executor uiExecutor) {
        CompletableFuture<AnnotatedLayout> previous = pendingLayout;
        pendingLayout = null;
        if (previous != null) {
            log.debug("Cancelling previous layout");
            previous.cancel(true);
        }
        CompletableFuture<AnnotatedLayout> layoutFuture = engine.layout(source);
        pendingLayout = layoutFuture;

        CompletableFuture<Graph> result = new CompletableFuture<>();
        layoutFuture.whenCompleteAsync((layout, error) -> {
            if (layoutFuture != pendingLayout) {
                result.cancel(false);
                return;
            }
            pendingLayout = null;
            if (error != null) {
                loadFailed(unwrap(error), result);
                return;
            }
            try {
                Graph loaded = new XDotLoader().load(layout);
                setGraph(loaded);
                result.complete(loaded);
            } catch (GraphParseException | RuntimeException e) {
                loadFailed(e, result);
            }
        }, uiExecutor);
        return result;
    }

    private void loadFailed(Throwable error, CompletableFuture<Graph> result) {
        log.warn("Failed to load graph: {}", error.getMessage());
        for (DotViewerListener listener : listeners) {
            listener.loadFailed(error);
        }
        result.completeExceptionally(error);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    public void setSize(int width, int height) {
        boolean firstSize = viewport.getWidth() == 0 || viewport.getHeight() == 0;
        viewport.setSize(width, height);
        if (firstSize && width > 0 && height > 0) {
            viewport.zoomToFit(graph.getWidth(), graph.getHeight());
        }
        requestRepaint();
    }

    public void draw(DrawingSurface surface) {
        surface.paint(Rgba.WHITE);
        surface.save();
        viewport.applyTo(surface);
        graph.draw(surface, highlight, viewport.visibleEnvelope());
        surface.restore();
        dragAction.draw(surface);
    }

    public void onButtonPress(PointerEvent event) {
        animation.stop();
        dragAction.abort();
        dragAction = createDragAction(event);
        dragAction.onButtonPress(event);
        pressed = true;
        pressTime = clock.getAsLong();
        pressX = event.x();
        pressY = event.y();
    }

    public void onMotion(PointerEvent event) {
        dragAction.onMotion(event);
    }

    /**
     * @return true when the release was consumed
     */
    public boolean onButtonRelease(PointerEvent event) {
        dragAction.onButtonRelease(event);
        dragAction = new NullAction(this);
        if (event.button() == 1 && isClick(event)) {
            pressed = false;
            Url url = getUrl(event.x(), event.y());
            if (url != null) {
                log.debug("Clicked {}", url.url());
                for (DotViewerListener listener : listeners) {
                    listener.urlClicked(url.url(), event);
                }
            } else {
                Jump jump = getJump(event.x(), event.y());
                if (jump != null) {
                    setHighlight(jump.highlight());
                    animateTo(jump.x(), jump.y());
                }
            }
            return true;
        }
        pressed = false;
        return event.button() == 1 || event.button() == 2;
    }

    /**
     * A release counts as a click when it comes soon after the press and close to where it happened.
     */
    public boolean isClick(PointerEvent release) {
        if (!pressed) {
            return false;
        }
        double distance = Math.hypot(pressX - release.x(), pressY - release.y());
        return clock.getAsLong() < pressTime + CLICK_TIMEOUT_MILLIS && distance < CLICK_FUZZ;
    }

    /**
     * Negative rotation (wheel up) zooms in.
     */
    public boolean onScroll(double wheelRotation) {
        if (wheelRotation < 0) {
            viewport.zoomIn();
        } else if (wheelRotation > 0) {
            viewport.zoomOut();
        } else {
            return false;
        }
        requestRepaint();
        return true;
    }

    public boolean onKey(KeyCommand command) {
        switch (command) {
            case PAN_LEFT -> viewport.pan(Viewport.Direction.LEFT);
            case PAN_RIGHT -> viewport.pan(Viewport.Direction.RIGHT);
            case PAN_UP -> viewport.pan(Viewport.Direction.UP);
            case PAN_DOWN -> viewport.pan(Viewport.Direction.DOWN);
            case ZOOM_IN -> viewport.zoomIn();
            case ZOOM_OUT -> viewport.zoomOut();
            case ZOOM_100 -> viewport.zoom100();
            case ZOOM_FIT -> viewport.zoomToFit(graph.getWidth(), graph.getHeight());
            case ABORT -> {
                dragAction.abort();
                dragAction = new NullAction(this);
            }
            case RELOAD -> {
                for (DotViewerListener listener : listeners) {
                    listener.reloadRequested();
                }
            }
        }
        requestRepaint();
        return true;
    }

    public void animateTo(double x, double y) {
        animation.stop();
        animation = new ZoomToAnimation(this, x, y);
        animation.start();
    }

    /**
     * Called by an animation when it stops; only the current animation is replaced.
     */
    public void animationStopped(Animation stopped) {
        if (animation == stopped) {
            animation = new NoAnimation(this);
        }
    }

    public Url getUrl(double windowX, double windowY) {
        Coordinate point = viewport.windowToGraph(windowX, windowY);
        return graph.getUrl(point.x, point.y);
    }

    public Jump getJump(double windowX, double windowY) {
        Coordinate point = viewport.windowToGraph(windowX, windowY);
        return graph.getJump(point.x, point.y);
    }

    public void setHighlight(Set<ElementHandle> items) {
        Set<ElementHandle> next = items == null ? Set.of() : items;
        if (!highlight.equals(next)) {
            highlight = next;
            requestRepaint();
        }
    }

    public void setCursor(CursorKind cursor) {
        if (this.cursor != cursor) {
            this.cursor = cursor;
            for (DotViewerListener listener : listeners) {
                listener.cursorChanged(cursor);
            }
        }
    }

    public void requestRepaint() {
        for (DotViewerListener listener : listeners) {
            listener.repaintRequested();
        }
    }

    private DragAction createDragAction(PointerEvent event) {
        if (event.button() == 1 || event.button() == 2) {
            if (event.control()) {
                return new ZoomAction(this);
            } else if (event.shift()) {
                return new ZoomAreaAction(this);
            }
            return new PanAction(this);
        }
        return new NullAction(this);
    }
}
