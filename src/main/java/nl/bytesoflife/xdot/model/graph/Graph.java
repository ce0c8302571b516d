package nl.bytesoflife.xdot.model.graph;

import nl.bytesoflife.xdot.model.shape.CompoundShape;
import nl.bytesoflife.xdot.model.shape.Shape;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Set;

/**
 * A fully laid out graph in canvas coordinates: the origin is the top-left corner
 * of its bounding box and y grows downwards.
 */
public class Graph {

    private final double width;
    private final double height;
    private final CompoundShape background;
    private final List<Node> nodes;
    private final List<Edge> edges;

    private final ElementIndex<Node> nodeIndex = new ElementIndex<>();
    private final ElementIndex<Edge> edgeEndIndex = new ElementIndex<>();
    private final ElementIndex<Element> drawIndex = new ElementIndex<>();

    public Graph() {
        this(1, 1, List.of(), List.of(), List.of());
    }

    public Graph(double width, double height, List<? extends Shape> background, List<Node> nodes, List<Edge> edges) {
        this.width = width;
        this.height = height;
        this.background = new CompoundShape(background);
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        for (Node node : this.nodes) {
            nodeIndex.insert(node, node.getBounds());
        }
        for (Edge edge : this.edges) {
            List<Coordinate> points = edge.getPoints();
            if (points.isEmpty()) continue;
            Envelope ends = new Envelope(points.get(0));
            ends.expandToInclude(points.get(points.size() - 1));
            ends.expandBy(Edge.RADIUS);
            edgeEndIndex.insert(edge, ends);
        }
        // Edges are drawn before nodes
        for (Edge edge : this.edges) {
            drawIndex.insert(edge, edge.getEnvelope());
        }
        for (Node node : this.nodes) {
            drawIndex.insert(node, node.getEnvelope());
        }
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public List<Shape> getBackground() {
        return background.getShapes();
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty() && background.isEmpty();
    }

    /**
     * First node, in insertion order, with a URL under the point; null if none.
     */
    public Url getUrl(double x, double y) {
        for (Node node : nodeIndex.query(x, y)) {
            Url url = node.getUrl(x, y);
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    /**
     * Edge end points take precedence over nodes; within each group the first match wins.
     */
    public Jump getJump(double x, double y) {
        for (Edge edge : edgeEndIndex.query(x, y)) {
            Jump jump = edge.getJump(x, y);
            if (jump != null) {
                return jump;
            }
        }
        for (Node node : nodeIndex.query(x, y)) {
            Jump jump = node.getJump(x, y);
            if (jump != null) {
                return jump;
            }
        }
        return null;
    }

    public void draw(DrawingSurface surface, Set<ElementHandle> highlight) {
        draw(surface, highlight, null);
    }

    /**
     * Draw the background, then edges, then nodes. When {@code visible} is given,
     * elements entirely outside it are skipped.
     */
    public void draw(DrawingSurface surface, Set<ElementHandle> highlight, Envelope visible) {
        background.draw(surface, false);

        if (visible == null) {
            for (Edge edge : edges) {
                edge.draw(surface, highlight.contains(edge.getHandle()));
            }
            for (Node node : nodes) {
                node.draw(surface, highlight.contains(node.getHandle()));
            }
            return;
        }
        for (Element element : drawIndex.query(visible)) {
            element.draw(surface, highlight.contains(element.getHandle()));
        }
    }

    @Override
    public String toString() {
        return String.format("Graph[%.0fx%.0f, %d nodes, %d edges]", width, height, nodes.size(), edges.size());
    }
}
