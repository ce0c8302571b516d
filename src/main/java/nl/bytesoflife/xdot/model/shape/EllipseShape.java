package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned ellipse given by its center and its two radii.
 */
public final class EllipseShape extends StyledShape {

    // Control point distance for a quarter circle approximated by one cubic Bezier
    private static final double KAPPA = 0.5522847498307936;

    private final double x0;
    private final double y0;
    private final double w;
    private final double h;
    private final boolean filled;

    public EllipseShape(Pen pen, double x0, double y0, double w, double h, boolean filled) {
        super(pen);
        this.x0 = x0;
        this.y0 = y0;
        this.w = w;
        this.h = h;
        this.filled = filled;
    }

    public double getCenterX() {
        return x0;
    }

    public double getCenterY() {
        return y0;
    }

    public double getRadiusX() {
        return w;
    }

    public double getRadiusY() {
        return h;
    }

    public boolean isFilled() {
        return filled;
    }

    @Override
    public void draw(DrawingSurface surface, boolean highlight) {
        double kx = KAPPA * w;
        double ky = KAPPA * h;
        surface.moveTo(x0 + w, y0);
        surface.curveTo(x0 + w, y0 + ky, x0 + kx, y0 + h, x0, y0 + h);
        surface.curveTo(x0 - kx, y0 + h, x0 - w, y0 + ky, x0 - w, y0);
        surface.curveTo(x0 - w, y0 - ky, x0 - kx, y0 - h, x0, y0 - h);
        surface.curveTo(x0 + kx, y0 - h, x0 + w, y0 - ky, x0 + w, y0);
        surface.closePath();

        Pen current = selectPen(highlight);
        if (filled) {
            surface.fill(current.fillColor());
        } else {
            surface.stroke(current.color(), current.lineWidth(), current.dash());
        }
    }

    @Override
    public Envelope getEnvelope() {
        return new Envelope(x0 - Math.abs(w), x0 + Math.abs(w), y0 - Math.abs(h), y0 + Math.abs(h));
    }

    @Override
    public String toString() {
        return String.format("EllipseShape[%.2f,%.2f r=%.2fx%.2f%s]", x0, y0, w, h, filled ? ", filled" : "");
    }
}
