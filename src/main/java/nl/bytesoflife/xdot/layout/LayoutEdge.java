package nl.bytesoflife.xdot.layout;

import java.util.Map;

/**
 * An edge of an annotated layout, referencing its end points by node name.
 */
public record LayoutEdge(String source, String destination, Map<String, String> attributes) {

    public LayoutEdge {
        attributes = Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    /** Spline control points as space separated {@code "x,y"} entries, optionally with {@code s,} / {@code e,} end markers. */
    public String pos() {
        return attributes.get("pos");
    }
}
