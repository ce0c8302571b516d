package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.layout.AnnotatedLayout;
import nl.bytesoflife.xdot.layout.XDotFileLayoutEngine;
import nl.bytesoflife.xdot.model.graph.Graph;
import nl.bytesoflife.xdot.model.graph.Node;
import nl.bytesoflife.xdot.renderer.RecordingSurface;
import nl.bytesoflife.xdot.viewer.animation.Animation;
import nl.bytesoflife.xdot.viewer.animation.ManualAnimationTimer;
import nl.bytesoflife.xdot.viewer.animation.NoAnimation;
import nl.bytesoflife.xdot.viewer.animation.ZoomToAnimation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DotControllerTest {

    private static final double EPS = 1e-9;

    private final ManualAnimationTimer timer = new ManualAnimationTimer();
    private final AtomicLong clock = new AtomicLong();
    private final DotController controller = new DotController(timer, clock::get);
    private final RecordingListener listener = new RecordingListener();

    private Graph graph;

    private static class RecordingListener implements DotViewerListener {
        final List<String> urls = new ArrayList<>();
        final List<CursorKind> cursors = new ArrayList<>();
        final List<Graph> loaded = new ArrayList<>();
        final List<Throwable> failures = new ArrayList<>();
        int repaints;
        int reloads;

        @Override
        public void urlClicked(String url, PointerEvent event) {
            urls.add(url);
        }

        @Override
        public void cursorChanged(CursorKind cursor) {
            cursors.add(cursor);
        }

        @Override
        public void repaintRequested() {
            repaints++;
        }

        @Override
        public void graphLoaded(Graph graph) {
            loaded.add(graph);
        }

        @Override
        public void loadFailed(Throwable error) {
            failures.add(error);
        }

        @Override
        public void reloadRequested() {
            reloads++;
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        controller.addListener(listener);
        controller.setSize(800, 600);
        String xdot = Files.readString(Path.of("src/test/resources/graphs/hello.xdot"));
        graph = controller.load(new XDotFileLayoutEngine(), xdot, Runnable::run).join();
    }

    private Node node(String name) {
        return graph.getNodes().stream().filter(n -> n.getName().equals(name)).findFirst().orElseThrow();
    }

    private Coordinate windowPointOf(Node node) {
        return controller.getViewport().graphToWindow(node.getX(), node.getY());
    }

    private void click(Coordinate point) {
        controller.onButtonPress(PointerEvent.button(point.x, point.y, 1));
        controller.onButtonRelease(PointerEvent.button(point.x, point.y, 1));
    }

    @Test
    void loadFitsTheGraph() {
        assertSame(graph, controller.getGraph());
        assertEquals(List.of(graph), listener.loaded);
        Viewport viewport = controller.getViewport();
        assertEquals(27, viewport.getX(), EPS);
        assertEquals(58, viewport.getY(), EPS);
        assertEquals(Math.min(776 / 54.0, 576 / 116.0), viewport.getZoomRatio(), EPS);
    }

    @Test
    void clickDiscrimination() {
        clock.set(0);
        controller.onButtonPress(PointerEvent.button(100, 100, 1));

        clock.set(500);
        assertTrue(controller.isClick(PointerEvent.button(102, 101, 1)));

        clock.set(200);
        assertFalse(controller.isClick(PointerEvent.button(110, 100, 1)));

        clock.set(1000);
        assertFalse(controller.isClick(PointerEvent.button(100, 100, 1)));
    }

    @Test
    void releaseWithoutPressIsNotAClick() {
        assertFalse(controller.isClick(PointerEvent.button(100, 100, 1)));
    }

    @Test
    void panFollowsThePointer() {
        Viewport viewport = controller.getViewport();
        double zoom = viewport.getZoomRatio();

        controller.onButtonPress(PointerEvent.button(100, 100, 1));
        assertInstanceOf(PanAction.class, controller.getDragAction());
        assertEquals(CursorKind.MOVE, controller.getCursor());

        controller.onMotion(PointerEvent.at(150, 120));
        assertEquals(27 - 50 / zoom, viewport.getX(), EPS);
        assertEquals(58 - 20 / zoom, viewport.getY(), EPS);

        controller.onButtonRelease(PointerEvent.button(150, 120, 1));
        assertEquals(CursorKind.ARROW, controller.getCursor());
        assertInstanceOf(NullAction.class, controller.getDragAction());
    }

    @Test
    void middleButtonPansToo() {
        controller.onButtonPress(PointerEvent.button(100, 100, 2));
        assertInstanceOf(PanAction.class, controller.getDragAction());
        assertTrue(controller.onButtonRelease(PointerEvent.button(100, 100, 2)));
    }

    @Test
    void otherButtonsDoNothing() {
        controller.onButtonPress(PointerEvent.button(100, 100, 3));
        assertInstanceOf(NullAction.class, controller.getDragAction());
        assertFalse(controller.onButtonRelease(PointerEvent.button(100, 100, 3)));
    }

    @Test
    void controlDragZooms() {
        double zoom = controller.getViewport().getZoomRatio();

        controller.onButtonPress(new PointerEvent(100, 100, 1, false, true));
        assertInstanceOf(ZoomAction.class, controller.getDragAction());
        controller.onMotion(PointerEvent.at(90, 95));

        assertEquals(zoom * Math.pow(1.005, 15), controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void shiftDragZoomsToTheSelectedArea() {
        Viewport viewport = controller.getViewport();
        double zoom = viewport.getZoomRatio();
        Coordinate center = viewport.windowToGraph(200, 150);

        controller.onButtonPress(new PointerEvent(0, 0, 1, true, false));
        assertInstanceOf(ZoomAreaAction.class, controller.getDragAction());
        controller.onMotion(PointerEvent.at(400, 300));

        RecordingSurface surface = new RecordingSurface();
        controller.draw(surface);
        assertTrue(surface.getPaints().stream().anyMatch(p -> p.color().equals(ZoomAreaAction.BAND_FILL)));

        clock.set(2000);
        controller.onButtonRelease(new PointerEvent(400, 300, 1, true, false));
        assertEquals(2 * zoom, viewport.getZoomRatio(), EPS);
        assertEquals(center.x, viewport.getX(), EPS);
        assertEquals(center.y, viewport.getY(), EPS);
    }

    @Test
    void escapeAbortsTheDrag() {
        double zoom = controller.getViewport().getZoomRatio();

        controller.onButtonPress(new PointerEvent(0, 0, 1, true, false));
        controller.onMotion(PointerEvent.at(400, 300));
        assertTrue(controller.onKey(KeyCommand.ABORT));
        assertInstanceOf(NullAction.class, controller.getDragAction());

        controller.onButtonRelease(new PointerEvent(400, 300, 1, true, false));
        assertEquals(zoom, controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void hoverHighlightsWhatAClickWouldActivate() {
        Node b = node("b");
        Coordinate point = windowPointOf(b);

        controller.onMotion(PointerEvent.at(point.x, point.y));
        assertEquals(Set.of(b.getHandle()), controller.getHighlight());
        assertEquals(CursorKind.HAND, controller.getCursor());

        controller.onMotion(PointerEvent.at(5, 5));
        assertEquals(Set.of(), controller.getHighlight());
        assertEquals(CursorKind.ARROW, controller.getCursor());
    }

    @Test
    void clickOnUrlNotifiesListeners() {
        click(windowPointOf(node("b")));

        assertEquals(List.of("http://example.com/b"), listener.urls);
        assertInstanceOf(NoAnimation.class, controller.getAnimation());
    }

    @Test
    void clickOnNodeAnimatesToIt() {
        Node a = node("a");
        clock.set(1000);
        click(windowPointOf(a));

        assertTrue(listener.urls.isEmpty());
        assertEquals(Set.of(a.getHandle()), controller.getHighlight());
        assertInstanceOf(ZoomToAnimation.class, controller.getAnimation());
        assertEquals(1, timer.activeCount());
        assertEquals(30, timer.lastPeriodMillis());

        double zoom = controller.getViewport().getZoomRatio();
        clock.set(1300);
        timer.fire();
        assertEquals(27, controller.getViewport().getX(), EPS);
        assertEquals((58 + 18) / 2.0, controller.getViewport().getY(), EPS);
        assertTrue(controller.getViewport().getZoomRatio() < zoom);

        clock.set(1600);
        timer.fire();
        assertEquals(18, controller.getViewport().getY(), EPS);
        assertEquals(zoom, controller.getViewport().getZoomRatio(), EPS);
        assertInstanceOf(NoAnimation.class, controller.getAnimation());
        assertEquals(0, timer.activeCount());
    }

    @Test
    void pressStopsTheAnimation() {
        controller.animateTo(27, 18);
        assertEquals(1, timer.activeCount());

        controller.onButtonPress(PointerEvent.button(0, 0, 1));
        assertInstanceOf(NoAnimation.class, controller.getAnimation());
        assertEquals(0, timer.activeCount());
    }

    @Test
    void newAnimationReplacesTheRunningOne() {
        controller.animateTo(27, 18);
        Animation first = controller.getAnimation();
        controller.animateTo(27, 98);
        Animation second = controller.getAnimation();

        assertNotSame(first, second);
        assertEquals(1, timer.activeCount());
        first.stop();
        assertSame(second, controller.getAnimation());
    }

    @Test
    void slowReleaseIsNotAClick() {
        Coordinate point = windowPointOf(node("b"));
        clock.set(0);
        controller.onButtonPress(PointerEvent.button(point.x, point.y, 1));
        clock.set(1500);
        controller.onButtonRelease(PointerEvent.button(point.x, point.y, 1));

        assertTrue(listener.urls.isEmpty());
    }

    @Test
    void scrollZooms() {
        double zoom = controller.getViewport().getZoomRatio();

        assertTrue(controller.onScroll(-1));
        assertEquals(zoom * 1.25, controller.getViewport().getZoomRatio(), EPS);
        assertTrue(controller.onScroll(1));
        assertEquals(zoom, controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void keyboardNavigation() {
        Viewport viewport = controller.getViewport();

        controller.onKey(KeyCommand.ZOOM_100);
        assertEquals(1, viewport.getZoomRatio(), EPS);
        controller.onKey(KeyCommand.PAN_RIGHT);
        controller.onKey(KeyCommand.PAN_DOWN);
        assertEquals(127, viewport.getX(), EPS);
        assertEquals(158, viewport.getY(), EPS);
        controller.onKey(KeyCommand.ZOOM_IN);
        assertEquals(1.25, viewport.getZoomRatio(), EPS);

        controller.onKey(KeyCommand.ZOOM_FIT);
        assertEquals(27, viewport.getX(), EPS);
        assertEquals(58, viewport.getY(), EPS);
    }

    @Test
    void reloadKeyAsksTheShell() {
        controller.onKey(KeyCommand.RELOAD);
        assertEquals(1, listener.reloads);
    }

    @Test
    void failedLoadKeepsTheCurrentGraph() {
        CompletableFuture<Graph> result = controller.load(new XDotFileLayoutEngine(),
                "digraph { a [pos=\"1,1\"] }", Runnable::run);

        assertTrue(result.isCompletedExceptionally());
        assertSame(graph, controller.getGraph());
        assertEquals(1, listener.failures.size());
    }

    @Test
    void overflowingBoundingBoxKeepsTheCurrentGraph() {
        double zoom = controller.getViewport().getZoomRatio();
        CompletableFuture<Graph> result = controller.load(new XDotFileLayoutEngine(),
                "digraph { bb=\"0,0,1e400,10\"; a [pos=\"5,5\", _draw_=\"e 5 5 2 2 \"] }", Runnable::run);

        assertTrue(result.isCompletedExceptionally());
        assertSame(graph, controller.getGraph());
        assertEquals(List.of(graph), listener.loaded);
        assertEquals(1, listener.failures.size());
        assertEquals(zoom, controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void longZoomDragStopsAtTheMaximumZoom() {
        controller.onButtonPress(new PointerEvent(100, 100, 1, false, true));
        controller.onMotion(new PointerEvent(100, -1e6, 1, false, true));
        controller.onButtonRelease(new PointerEvent(100, -1e6, 1, false, true));

        assertEquals(Viewport.MAX_ZOOM_RATIO, controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void scrollingOutStopsAtTheMinimumZoom() {
        for (int i = 0; i < 1000; i++) {
            assertTrue(controller.onScroll(1));
        }

        assertEquals(Viewport.MIN_ZOOM_RATIO, controller.getViewport().getZoomRatio(), EPS);
    }

    @Test
    void syntaxErrorIsReported() {
        controller.load(new XDotFileLayoutEngine(), "digraph {", Runnable::run);

        assertSame(graph, controller.getGraph());
        assertEquals(1, listener.failures.size());
    }

    @Test
    void newerLoadSupersedesAPendingOne() {
        CompletableFuture<AnnotatedLayout> slow = new CompletableFuture<>();
        CompletableFuture<Graph> first = controller.load(source -> slow, "ignored", Runnable::run);
        CompletableFuture<Graph> second = controller.load(new XDotFileLayoutEngine(),
                "digraph { bb=\"0,0,10,10\"; a [pos=\"5,5\", width=1, height=1, _draw_=\"e 5 5 2 2 \"] }",
                Runnable::run);

        assertTrue(slow.isCancelled());
        assertTrue(first.isCancelled());
        assertEquals(1, second.join().getNodes().size());
        assertTrue(listener.failures.isEmpty());
    }

    @Test
    void drawPaintsBackgroundThenGraph() {
        RecordingSurface surface = new RecordingSurface();
        controller.draw(surface);

        List<String> operations = surface.getOperations();
        assertEquals("paint", operations.get(0));
        assertEquals("save", operations.get(1));
        assertEquals("translate", operations.get(2));
        assertEquals("restore", operations.get(operations.size() - 1));
        assertEquals(2, surface.getTexts().size());
    }
}
