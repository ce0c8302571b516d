package nl.bytesoflife.xdot.parser;

import org.locationtech.jts.geom.Coordinate;

/**
 * Maps layout coordinates (origin bottom-left, y up) to canvas coordinates (origin top-left, y down).
 */
@FunctionalInterface
public interface CoordinateTransform {

    Coordinate transform(double x, double y);

    CoordinateTransform IDENTITY = Coordinate::new;

    /**
     * Transform that moves the bounding box minimum to the origin and flips the y axis.
     */
    static CoordinateTransform forBoundingBox(double xmin, double ymax) {
        double xoffset = -xmin;
        double yoffset = -ymax;
        double xscale = 1.0;
        double yscale = -1.0;
        return (x, y) -> new Coordinate((x + xoffset) * xscale, (y + yoffset) * yscale);
    }
}
