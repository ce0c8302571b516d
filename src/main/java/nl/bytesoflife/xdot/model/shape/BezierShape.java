package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Open piecewise cubic Bezier curve: a start point followed by three points per segment.
 */
public final class BezierShape extends StyledShape {

    private final List<Coordinate> points;

    public BezierShape(Pen pen, List<Coordinate> points) {
        super(pen);
        if (points.size() < 4 || points.size() % 3 != 1) {
            throw new IllegalArgumentException(
                    "Bezier point count must be 1 + 3k, got " + points.size());
        }
        this.points = points.stream().map(Coordinate::new).toList();
    }

    public List<Coordinate> getPoints() {
        return points;
    }

    public int getSegmentCount() {
        return (points.size() - 1) / 3;
    }

    @Override
    public void draw(DrawingSurface surface, boolean highlight) {
        Coordinate start = points.get(0);
        surface.moveTo(start.x, start.y);
        for (int i = 1; i < points.size(); i += 3) {
            Coordinate c1 = points.get(i);
            Coordinate c2 = points.get(i + 1);
            Coordinate end = points.get(i + 2);
            surface.curveTo(c1.x, c1.y, c2.x, c2.y, end.x, end.y);
        }

        Pen current = selectPen(highlight);
        surface.stroke(current.color(), current.lineWidth(), current.dash());
    }

    @Override
    public Envelope getEnvelope() {
        // The control polygon contains the curve
        Envelope envelope = new Envelope();
        for (Coordinate point : points) {
            envelope.expandToInclude(point);
        }
        return envelope;
    }

    @Override
    public String toString() {
        return "BezierShape[" + getSegmentCount() + " segments]";
    }
}
