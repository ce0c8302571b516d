package nl.bytesoflife.xdot.model.graph;

import nl.bytesoflife.xdot.model.shape.Shape;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * A laid out node: center, size and the shapes that draw it.
 */
public class Node extends Element {

    private final String name;
    private final double x;
    private final double y;
    private final Envelope bounds;
    private final String url;

    public Node(ElementHandle handle, String name, double x, double y, double width, double height,
                List<? extends Shape> shapes, String url) {
        super(handle, shapes);
        this.name = name;
        this.x = x;
        this.y = y;
        this.bounds = new Envelope(x - 0.5 * width, x + 0.5 * width, y - 0.5 * height, y + 0.5 * height);
        this.url = url;
    }

    public String getName() {
        return name;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getX1() {
        return bounds.getMinX();
    }

    public double getY1() {
        return bounds.getMinY();
    }

    public double getX2() {
        return bounds.getMaxX();
    }

    public double getY2() {
        return bounds.getMaxY();
    }

    public String getUrl() {
        return url;
    }

    public Envelope getBounds() {
        return new Envelope(bounds);
    }

    /**
     * Inclusive bounds test.
     */
    public boolean isInside(double px, double py) {
        return bounds.contains(px, py);
    }

    @Override
    public Url getUrl(double px, double py) {
        if (url == null) {
            return null;
        }
        if (isInside(px, py)) {
            return new Url(this, url);
        }
        return null;
    }

    @Override
    public Jump getJump(double px, double py) {
        if (isInside(px, py)) {
            return new Jump(this, x, y);
        }
        return null;
    }

    @Override
    public Envelope getEnvelope() {
        Envelope envelope = super.getEnvelope();
        envelope.expandToInclude(bounds);
        return envelope;
    }

    @Override
    public String toString() {
        return String.format("Node[%s at %.2f,%.2f, %d shapes]", name, x, y, getShapes().size());
    }
}
