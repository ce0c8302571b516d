package nl.bytesoflife.xdot.layout;

import java.util.Map;

/**
 * A subgraph with the graph attributes that were set explicitly inside it.
 */
public record LayoutSubgraph(String name, Map<String, String> attributes) {

    public LayoutSubgraph {
        attributes = Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
