package nl.bytesoflife.xdot.layout;

import java.util.Map;

/**
 * A node of an annotated layout with its raw DOT attributes.
 */
public record LayoutNode(String name, Map<String, String> attributes) {

    public LayoutNode {
        attributes = Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    /** Center as {@code "x,y"} in layout coordinates, or null when the node was not positioned. */
    public String pos() {
        return attributes.get("pos");
    }

    /** Width in inches. */
    public String width() {
        return attributes.get("width");
    }

    /** Height in inches. */
    public String height() {
        return attributes.get("height");
    }

    public String url() {
        String url = attributes.get("URL");
        return url != null ? url : attributes.get("href");
    }
}
