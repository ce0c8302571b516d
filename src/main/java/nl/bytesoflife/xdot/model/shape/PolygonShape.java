package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Closed polygon, either filled or outlined.
 */
public final class PolygonShape extends StyledShape {

    private final List<Coordinate> points;
    private final boolean filled;

    public PolygonShape(Pen pen, List<Coordinate> points, boolean filled) {
        super(pen);
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Polygon needs at least one point");
        }
        this.points = points.stream().map(Coordinate::new).toList();
        this.filled = filled;
    }

    public List<Coordinate> getPoints() {
        return points;
    }

    public boolean isFilled() {
        return filled;
    }

    @Override
    public void draw(DrawingSurface surface, boolean highlight) {
        Coordinate last = points.get(points.size() - 1);
        surface.moveTo(last.x, last.y);
        for (Coordinate point : points) {
            surface.lineTo(point.x, point.y);
        }
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
        Envelope envelope = new Envelope();
        for (Coordinate point : points) {
            envelope.expandToInclude(point);
        }
        return envelope;
    }

    @Override
    public String toString() {
        return "PolygonShape[" + points.size() + " points" + (filled ? ", filled" : "") + "]";
    }
}
