package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.renderer.RecordingSurface;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViewportTest {

    private static final double EPS = 1e-9;

    private final Viewport viewport = new Viewport(800, 600);

    @Test
    void zoomToFitUsesTheTighterAxis() {
        viewport.zoomToFit(1000, 500);

        assertEquals(0.776, viewport.getZoomRatio(), EPS);
        assertEquals(500, viewport.getX(), EPS);
        assertEquals(250, viewport.getY(), EPS);
    }

    @Test
    void windowAndGraphCoordinatesAreInverse() {
        viewport.setFocus(120, -40);
        viewport.setZoomRatio(2.5);

        Coordinate graph = viewport.windowToGraph(10, 590);
        Coordinate window = viewport.graphToWindow(graph.x, graph.y);
        assertEquals(10, window.x, EPS);
        assertEquals(590, window.y, EPS);
    }

    @Test
    void windowCenterIsTheFocus() {
        viewport.setFocus(30, 70);
        viewport.setZoomRatio(3);

        Coordinate center = viewport.windowToGraph(400, 300);
        assertEquals(30, center.x, EPS);
        assertEquals(70, center.y, EPS);
        assertEquals(30 + 100 / 3.0, viewport.windowToGraph(500, 300).x, EPS);
    }

    @Test
    void zoomToArea() {
        viewport.zoomToArea(100, 100, 300, 200);

        assertEquals(Math.min(800 / 200.0, 600 / 100.0), viewport.getZoomRatio(), EPS);
        assertEquals(200, viewport.getX(), EPS);
        assertEquals(150, viewport.getY(), EPS);
    }

    @Test
    void zoomToAreaWithCornersSwapped() {
        viewport.zoomToArea(300, 200, 100, 100);

        assertEquals(4, viewport.getZoomRatio(), EPS);
    }

    @Test
    void degenerateAreaIsIgnored() {
        viewport.setFocus(5, 5);
        viewport.zoomToArea(10, 10, 10, 10);

        assertEquals(1, viewport.getZoomRatio(), EPS);
        assertEquals(5, viewport.getX(), EPS);
    }

    @Test
    void flatAreaUsesTheOtherAxis() {
        viewport.zoomToArea(0, 50, 400, 50);

        assertEquals(2, viewport.getZoomRatio(), EPS);
        assertEquals(200, viewport.getX(), EPS);
        assertEquals(50, viewport.getY(), EPS);
    }

    @Test
    void zoomSteps() {
        viewport.zoomIn();
        assertEquals(1.25, viewport.getZoomRatio(), EPS);
        viewport.zoomOut();
        viewport.zoomOut();
        assertEquals(0.8, viewport.getZoomRatio(), EPS);
        viewport.zoom100();
        assertEquals(1, viewport.getZoomRatio(), EPS);
    }

    @Test
    void panMovesAFixedNumberOfPixels() {
        viewport.setZoomRatio(2);
        viewport.pan(Viewport.Direction.RIGHT);
        viewport.pan(Viewport.Direction.UP);

        assertEquals(50, viewport.getX(), EPS);
        assertEquals(-50, viewport.getY(), EPS);
    }

    @Test
    void zoomMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> viewport.setZoomRatio(0));
        assertThrows(IllegalArgumentException.class, () -> viewport.setZoomRatio(Double.NaN));
    }

    @Test
    void zoomStepsAreClamped() {
        viewport.setZoomRatio(Viewport.MAX_ZOOM_RATIO);
        viewport.zoomIn();
        assertEquals(Viewport.MAX_ZOOM_RATIO, viewport.getZoomRatio(), EPS);

        viewport.setZoomRatio(Viewport.MIN_ZOOM_RATIO);
        viewport.zoomOut();
        assertEquals(Viewport.MIN_ZOOM_RATIO, viewport.getZoomRatio(), EPS);
    }

    @Test
    void zoomToIgnoresNaN() {
        viewport.setZoomRatio(2);
        viewport.zoomTo(Double.NaN);
        assertEquals(2, viewport.getZoomRatio(), EPS);

        viewport.zoomTo(Double.POSITIVE_INFINITY);
        assertEquals(Viewport.MAX_ZOOM_RATIO, viewport.getZoomRatio(), EPS);
    }

    @Test
    void fittingAHugeGraphStopsAtTheMinimumZoom() {
        viewport.zoomToFit(1e300, 1e300);
        assertEquals(Viewport.MIN_ZOOM_RATIO, viewport.getZoomRatio(), EPS);
    }

    @Test
    void visibleEnvelope() {
        viewport.setFocus(100, 100);
        viewport.setZoomRatio(2);

        assertEquals(new Envelope(-100, 300, -50, 250), viewport.visibleEnvelope());
    }

    @Test
    void renderingTransform() {
        RecordingSurface surface = new RecordingSurface();
        viewport.setFocus(10, 20);
        viewport.setZoomRatio(2);
        viewport.applyTo(surface);

        assertEquals(List.of("translate(400.00, 300.00)", "scale(2.00, 2.00)", "translate(-10.00, -20.00)"),
                surface.getCalls());
    }
}
