package nl.bytesoflife.xdot.layout;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Output of the layout engine: a graph whose nodes and edges carry positions and
 * xdot drawing attributes.
 */
public class AnnotatedLayout {

    public static final String DRAW = "_draw_";
    public static final String LABEL_DRAW = "_ldraw_";
    public static final String HEAD_DRAW = "_hdraw_";
    public static final String TAIL_DRAW = "_tdraw_";
    public static final String HEAD_LABEL_DRAW = "_hldraw_";
    public static final String TAIL_LABEL_DRAW = "_tldraw_";

    /** Node drawing attributes in draw order. */
    public static final List<String> NODE_DRAW_ATTRIBUTES = List.of(DRAW, LABEL_DRAW);

    /** Edge drawing attributes in draw order. */
    public static final List<String> EDGE_DRAW_ATTRIBUTES = List.of(
            DRAW, LABEL_DRAW, HEAD_DRAW, TAIL_DRAW, HEAD_LABEL_DRAW, TAIL_LABEL_DRAW);

    private final String name;
    private final boolean directed;
    private final Map<String, String> graphAttributes;
    private final List<LayoutSubgraph> subgraphs;
    private final List<LayoutNode> nodes;
    private final List<LayoutEdge> edges;

    public AnnotatedLayout(String name, boolean directed, Map<String, String> graphAttributes,
                           List<LayoutSubgraph> subgraphs, List<LayoutNode> nodes, List<LayoutEdge> edges) {
        this.name = name;
        this.directed = directed;
        this.graphAttributes = Collections.unmodifiableMap(graphAttributes);
        this.subgraphs = List.copyOf(subgraphs);
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public String getName() {
        return name;
    }

    public boolean isDirected() {
        return directed;
    }

    /**
     * Bounding box {@code "xmin,ymin,xmax,ymax"}, or null when the layout did not resolve positions.
     */
    public String getBoundingBox() {
        return graphAttributes.get("bb");
    }

    public String getGraphAttribute(String key) {
        return graphAttributes.get(key);
    }

    public Map<String, String> getGraphAttributes() {
        return graphAttributes;
    }

    public List<LayoutSubgraph> getSubgraphs() {
        return subgraphs;
    }

    public List<LayoutNode> getNodes() {
        return nodes;
    }

    public List<LayoutEdge> getEdges() {
        return edges;
    }

    @Override
    public String toString() {
        return "AnnotatedLayout[" + name + ", " + nodes.size() + " nodes, " + edges.size() + " edges]";
    }
}
