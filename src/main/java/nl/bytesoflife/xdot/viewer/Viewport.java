package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Maps between window pixels and graph coordinates.
 *
 * <p>The focus point is shown at the center of the window; one graph unit spans
 * {@code zoomRatio} pixels.
 */
public class Viewport {

    public static final double ZOOM_INCREMENT = 1.25;
    public static final double ZOOM_TO_FIT_MARGIN = 12;
    public static final double POS_INCREMENT = 100;
    public static final double MIN_ZOOM_RATIO = 1e-5;
    public static final double MAX_ZOOM_RATIO = 1e5;

    public enum Direction {
        LEFT(-1, 0), RIGHT(1, 0), UP(0, -1), DOWN(0, 1);

        private final int dx;
        private final int dy;

        Direction(int dx, int dy) {
            this.dx = dx;
            this.dy = dy;
        }
    }

    private double x;
    private double y;
    private double zoomRatio = 1.0;
    private int width;
    private int height;

    public Viewport() {
    }

    public Viewport(int width, int height) {
        setSize(width, height);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZoomRatio() {
        return zoomRatio;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public void setSize(int width, int height) {
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
    }

    public void setFocus(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setZoomRatio(double zoomRatio) {
        if (!(zoomRatio > 0) || Double.isInfinite(zoomRatio)) {
            throw new IllegalArgumentException("Zoom ratio must be positive and finite: " + zoomRatio);
        }
        this.zoomRatio = zoomRatio;
    }

    /**
     * Zoom requested by user input or derived from graph geometry: clamped to
     * [{@link #MIN_ZOOM_RATIO}, {@link #MAX_ZOOM_RATIO}], NaN leaves the zoom unchanged.
     */
    public void zoomTo(double zoomRatio) {
        if (Double.isNaN(zoomRatio)) {
            return;
        }
        this.zoomRatio = Math.max(MIN_ZOOM_RATIO, Math.min(MAX_ZOOM_RATIO, zoomRatio));
    }

    public Coordinate windowToGraph(double wx, double wy) {
        return new Coordinate(
                (wx - 0.5 * width) / zoomRatio + x,
                (wy - 0.5 * height) / zoomRatio + y);
    }

    public Coordinate graphToWindow(double gx, double gy) {
        return new Coordinate(
                (gx - x) * zoomRatio + 0.5 * width,
                (gy - y) * zoomRatio + 0.5 * height);
    }

    /**
     * Center the graph and pick the largest zoom at which it fits inside the window minus a margin.
     */
    public void zoomToFit(double graphWidth, double graphHeight) {
        double availableWidth = width - 2 * ZOOM_TO_FIT_MARGIN;
        double availableHeight = height - 2 * ZOOM_TO_FIT_MARGIN;
        setFocus(graphWidth / 2, graphHeight / 2);
        if (availableWidth <= 0 || availableHeight <= 0 || graphWidth <= 0 || graphHeight <= 0) {
            return;
        }
        zoomTo(Math.min(availableWidth / graphWidth, availableHeight / graphHeight));
    }

    /**
     * Fit the rectangle spanned by two graph points. A rectangle with no area on either axis is ignored.
     */
    public void zoomToArea(double x1, double y1, double x2, double y2) {
        double areaWidth = Math.abs(x1 - x2);
        double areaHeight = Math.abs(y1 - y2);
        if (areaWidth == 0 && areaHeight == 0) {
            return;
        }
        double ratio;
        if (areaWidth == 0) {
            ratio = height / areaHeight;
        } else if (areaHeight == 0) {
            ratio = width / areaWidth;
        } else {
            ratio = Math.min(width / areaWidth, height / areaHeight);
        }
        if (ratio > 0) {
            zoomTo(ratio);
        }
        setFocus((x1 + x2) / 2, (y1 + y2) / 2);
    }

    public void zoomIn() {
        zoomTo(zoomRatio * ZOOM_INCREMENT);
    }

    public void zoomOut() {
        zoomTo(zoomRatio / ZOOM_INCREMENT);
    }

    public void zoom100() {
        setZoomRatio(1.0);
    }

    /**
     * Move the focus by a fixed number of pixels, independent of the zoom.
     */
    public void pan(Direction direction) {
        x += direction.dx * POS_INCREMENT / zoomRatio;
        y += direction.dy * POS_INCREMENT / zoomRatio;
    }

    /**
     * Move the focus by a pixel delta.
     */
    public void panBy(double dxPixels, double dyPixels) {
        x += dxPixels / zoomRatio;
        y += dyPixels / zoomRatio;
    }

    public void applyTo(DrawingSurface surface) {
        surface.translate(0.5 * width, 0.5 * height);
        surface.scale(zoomRatio, zoomRatio);
        surface.translate(-x, -y);
    }

    /**
     * Graph-space rectangle covered by the window.
     */
    public Envelope visibleEnvelope() {
        Coordinate topLeft = windowToGraph(0, 0);
        Coordinate bottomRight = windowToGraph(width, height);
        return new Envelope(topLeft.x, bottomRight.x, topLeft.y, bottomRight.y);
    }

    @Override
    public String toString() {
        return String.format("Viewport[focus=(%.1f, %.1f), zoom=%.3f, %dx%d]", x, y, zoomRatio, width, height);
    }
}
