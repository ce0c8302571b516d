package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Envelope;

/**
 * Base class for the drawing primitives produced by the xdot interpreter.
 */
public abstract sealed class Shape permits StyledShape, CompoundShape {

    /**
     * Draw this shape, using the highlighted pen variant when {@code highlight} is set.
     */
    public abstract void draw(DrawingSurface surface, boolean highlight);

    /**
     * Approximate extent of this shape in canvas coordinates.
     */
    public abstract Envelope getEnvelope();
}
