package nl.bytesoflife.xdot.model.graph;

import nl.bytesoflife.xdot.model.shape.CompoundShape;
import nl.bytesoflife.xdot.model.shape.Shape;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * A graph element that can be drawn and hit-tested: a node or an edge.
 */
public abstract class Element {

    private final ElementHandle handle;
    private final CompoundShape shapes;

    protected Element(ElementHandle handle, List<? extends Shape> shapes) {
        this.handle = handle;
        this.shapes = new CompoundShape(shapes);
    }

    public ElementHandle getHandle() {
        return handle;
    }

    public List<Shape> getShapes() {
        return shapes.getShapes();
    }

    public void draw(DrawingSurface surface, boolean highlight) {
        shapes.draw(surface, highlight);
    }

    public Envelope getEnvelope() {
        return shapes.getEnvelope();
    }

    /**
     * Clickable link at the given graph-space point, or null.
     */
    public Url getUrl(double x, double y) {
        return null;
    }

    /**
     * Navigation target at the given graph-space point, or null.
     */
    public Jump getJump(double x, double y) {
        return null;
    }
}
