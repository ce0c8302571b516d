package nl.bytesoflife.xdot.model.graph;

import nl.bytesoflife.xdot.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Set;

/**
 * A laid out edge. Its polyline runs from the tail (near the source) to the head.
 */
public class Edge extends Element {

    /** Distance from an end point, in graph units, that still counts as a hit. */
    public static final double RADIUS = 10;

    private final Node source;
    private final Node destination;
    private final List<Coordinate> points;

    public Edge(ElementHandle handle, Node source, Node destination, List<Coordinate> points,
                List<? extends Shape> shapes) {
        super(handle, shapes);
        this.source = source;
        this.destination = destination;
        this.points = points.stream().map(Coordinate::new).toList();
    }

    public Node getSource() {
        return source;
    }

    public Node getDestination() {
        return destination;
    }

    public List<Coordinate> getPoints() {
        return points;
    }

    /**
     * Clicking near the tail jumps to the destination, clicking near the head jumps back to the source.
     */
    @Override
    public Jump getJump(double x, double y) {
        if (points.isEmpty()) {
            return null;
        }
        if (squareDistance(x, y, points.get(0)) <= RADIUS * RADIUS) {
            return new Jump(this, destination.getX(), destination.getY(),
                    Set.of(getHandle(), destination.getHandle()));
        }
        if (squareDistance(x, y, points.get(points.size() - 1)) <= RADIUS * RADIUS) {
            return new Jump(this, source.getX(), source.getY(),
                    Set.of(getHandle(), source.getHandle()));
        }
        return null;
    }

    static double squareDistance(double x, double y, Coordinate point) {
        double dx = point.x - x;
        double dy = point.y - y;
        return dx * dx + dy * dy;
    }

    @Override
    public String toString() {
        return "Edge[" + source.getName() + " -> " + destination.getName() + ", "
                + getShapes().size() + " shapes]";
    }
}
