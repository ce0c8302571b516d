package nl.bytesoflife.xdot.parser;

import nl.bytesoflife.xdot.layout.AnnotatedLayout;
import nl.bytesoflife.xdot.layout.LayoutEdge;
import nl.bytesoflife.xdot.layout.LayoutNode;
import nl.bytesoflife.xdot.layout.LayoutSubgraph;
import nl.bytesoflife.xdot.lexer.DotLexer;
import nl.bytesoflife.xdot.model.graph.Edge;
import nl.bytesoflife.xdot.model.graph.ElementHandle;
import nl.bytesoflife.xdot.model.graph.Graph;
import nl.bytesoflife.xdot.model.graph.Node;
import nl.bytesoflife.xdot.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Graph} from the annotated output of the layout engine.
 *
 * <p>Layout coordinates have their origin at the bottom-left with y pointing up;
 * the graph is built in canvas coordinates with the bounding box minimum at the
 * origin and y pointing down.
 */
public class XDotLoader {

    private static final Logger log = LoggerFactory.getLogger(XDotLoader.class);

    private static final double POINTS_PER_INCH = 72.0;

    private final ParseDiagnostics diagnostics;

    public XDotLoader(ParseDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public XDotLoader() {
        this(new ParseDiagnostics());
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Parse xdot text and build the graph.
     */
    public Graph load(String xdotCode) throws GraphParseException {
        AnnotatedLayout layout;
        try {
            layout = new DotParser().parse(xdotCode);
        } catch (DotParser.ParseException e) {
            throw new GraphParseException("Invalid xdot document: " + e.getMessage(), e);
        }
        return load(layout);
    }

    public Graph load(AnnotatedLayout layout) throws GraphParseException {
        long startTime = System.currentTimeMillis();

        String bb = layout.getBoundingBox();
        if (bb == null) {
            throw new GraphParseException("Layout has no bounding box; positions were not resolved");
        }
        double[] box = parseNumbers(bb, 4, "bounding box");
        double xmin = box[0];
        double ymin = box[1];
        double xmax = box[2];
        double ymax = box[3];

        CoordinateTransform transform = CoordinateTransform.forBoundingBox(xmin, ymax);
        XDotAttrParser attrParser = new XDotAttrParser(transform, diagnostics);

        List<Shape> background = new ArrayList<>();
        for (String attr : AnnotatedLayout.NODE_DRAW_ATTRIBUTES) {
            String code = layout.getGraphAttribute(attr);
            if (code != null) {
                background.addAll(attrParser.parse(code));
            }
        }
        for (LayoutSubgraph subgraph : layout.getSubgraphs()) {
            for (String attr : AnnotatedLayout.NODE_DRAW_ATTRIBUTES) {
                String code = subgraph.attribute(attr);
                if (code != null) {
                    background.addAll(attrParser.parse(code));
                }
            }
        }

        int nextHandle = 0;
        List<Node> nodes = new ArrayList<>();
        Map<String, Node> nodeByName = new HashMap<>();

        for (LayoutNode layoutNode : layout.getNodes()) {
            if (layoutNode.pos() == null) {
                log.debug("Skipping node {} without position", layoutNode.name());
                continue;
            }
            double[] pos = parseNumbers(layoutNode.pos(), 2, "position of node " + layoutNode.name());
            Coordinate center = transform.transform(pos[0], pos[1]);
            double w = parseInches(layoutNode.width(), "width of node " + layoutNode.name());
            double h = parseInches(layoutNode.height(), "height of node " + layoutNode.name());

            List<Shape> shapes = new ArrayList<>();
            for (String attr : AnnotatedLayout.NODE_DRAW_ATTRIBUTES) {
                String code = layoutNode.attribute(attr);
                if (code != null) {
                    shapes.addAll(attrParser.parse(code));
                }
            }

            Node node = new Node(new ElementHandle(nextHandle++), layoutNode.name(), center.x, center.y,
                    w, h, shapes, DotLexer.unescapeQuotes(layoutNode.url()));
            // Invisible nodes can still be edge end points
            nodeByName.put(layoutNode.name(), node);
            if (!shapes.isEmpty()) {
                nodes.add(node);
            }
        }

        List<Edge> edges = new ArrayList<>();
        for (LayoutEdge layoutEdge : layout.getEdges()) {
            if (layoutEdge.pos() == null) {
                log.debug("Skipping edge {} -> {} without position", layoutEdge.source(), layoutEdge.destination());
                continue;
            }
            List<Coordinate> points = parseEdgePos(layoutEdge.pos(), transform);

            List<Shape> shapes = new ArrayList<>();
            for (String attr : AnnotatedLayout.EDGE_DRAW_ATTRIBUTES) {
                String code = layoutEdge.attribute(attr);
                if (code != null) {
                    shapes.addAll(attrParser.parse(code));
                }
            }
            if (shapes.isEmpty()) {
                continue;
            }

            Node source = resolve(nodeByName, layoutEdge.source());
            Node destination = resolve(nodeByName, layoutEdge.destination());
            edges.add(new Edge(new ElementHandle(nextHandle++), source, destination, points, shapes));
        }

        Graph graph = new Graph(xmax - xmin, ymax - ymin, background, nodes, edges);
        log.info("Loaded {} in {}ms ({} warnings)", graph, System.currentTimeMillis() - startTime,
                diagnostics.size());
        return graph;
    }

    private static Node resolve(Map<String, Node> nodeByName, String name) {
        Node node = nodeByName.get(name);
        if (node == null) {
            throw new InconsistentLayoutException("Edge refers to node '" + name + "' which has no layout");
        }
        return node;
    }

    /**
     * Edge positions are space separated {@code x,y} pairs; the optional {@code s,x,y}
     * and {@code e,x,y} end markers are skipped.
     */
    static List<Coordinate> parseEdgePos(String pos, CoordinateTransform transform) throws GraphParseException {
        List<Coordinate> points = new ArrayList<>();
        for (String entry : pos.trim().split("\\s+")) {
            String[] fields = entry.split(",");
            if (fields.length != 2) {
                continue;
            }
            String what = "edge position '" + entry + "'";
            points.add(transform.transform(parseFinite(fields[0], what), parseFinite(fields[1], what)));
        }
        return points;
    }

    private static double parseInches(String value, String what) throws GraphParseException {
        if (value == null) {
            return 0.0;
        }
        return parseFinite(value, what) * POINTS_PER_INCH;
    }

    private static double[] parseNumbers(String value, int count, String what) throws GraphParseException {
        String[] fields = value.trim().split("\\s*,\\s*");
        if (fields.length < count) {
            throw new GraphParseException("Invalid " + what + ": '" + value + "'");
        }
        double[] numbers = new double[count];
        for (int i = 0; i < count; i++) {
            numbers[i] = parseFinite(fields[i], what);
        }
        return numbers;
    }

    /**
     * Overflowing values such as {@code 1e400} and the literals {@code NaN}/{@code Infinity}
     * are rejected along with malformed numbers.
     */
    private static double parseFinite(String value, String what) throws GraphParseException {
        double number;
        try {
            number = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new GraphParseException("Invalid " + what + ": '" + value + "'", e);
        }
        if (!Double.isFinite(number)) {
            throw new GraphParseException("Invalid " + what + ": '" + value + "' is not finite");
        }
        return number;
    }
}
