package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Ordered group of shapes drawn back to front.
 */
public final class CompoundShape extends Shape {

    private final List<Shape> shapes;

    public CompoundShape(List<? extends Shape> shapes) {
        this.shapes = List.copyOf(shapes);
    }

    public List<Shape> getShapes() {
        return shapes;
    }

    public boolean isEmpty() {
        return shapes.isEmpty();
    }

    public int size() {
        return shapes.size();
    }

    @Override
    public void draw(DrawingSurface surface, boolean highlight) {
        for (Shape shape : shapes) {
            shape.draw(surface, highlight);
        }
    }

    @Override
    public Envelope getEnvelope() {
        Envelope envelope = new Envelope();
        for (Shape shape : shapes) {
            envelope.expandToInclude(shape.getEnvelope());
        }
        return envelope;
    }
}
