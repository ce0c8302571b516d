package nl.bytesoflife.xdot.model.graph;

import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.model.shape.BezierShape;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EdgeTest {

    private final Node source = new Node(new ElementHandle(0), "src", 0, 0, 20, 20, List.of(), null);
    private final Node destination = new Node(new ElementHandle(1), "dst", 0, 200, 20, 20, List.of(), null);
    private final List<Coordinate> points = List.of(
            new Coordinate(0, 10), new Coordinate(0, 70), new Coordinate(0, 130), new Coordinate(0, 190));
    private final Edge edge = new Edge(new ElementHandle(2), source, destination, points,
            List.of(new BezierShape(Pen.DEFAULT, points)));

    @Test
    void nearTailJumpsToDestination() {
        Jump jump = edge.getJump(3, 14);

        assertNotNull(jump);
        assertSame(edge, jump.item());
        assertEquals(0, jump.x());
        assertEquals(200, jump.y());
        assertEquals(Set.of(edge.getHandle(), destination.getHandle()), jump.highlight());
    }

    @Test
    void nearHeadJumpsToSource() {
        Jump jump = edge.getJump(0, 185);

        assertNotNull(jump);
        assertEquals(0, jump.y());
        assertEquals(Set.of(edge.getHandle(), source.getHandle()), jump.highlight());
    }

    @Test
    void radiusIsInclusive() {
        assertNotNull(edge.getJump(6, 18));
        assertNull(edge.getJump(6, 18.1));
    }

    @Test
    void middleOfTheEdgeIsNotAJump() {
        assertNull(edge.getJump(0, 100));
    }

    @Test
    void edgeHasNoUrl() {
        assertNull(edge.getUrl(0, 10));
    }

    @Test
    void edgeWithoutPoints() {
        Edge empty = new Edge(new ElementHandle(3), source, destination, List.of(), List.of());
        assertNull(empty.getJump(0, 0));
    }
}
