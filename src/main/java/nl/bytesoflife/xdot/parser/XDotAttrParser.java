package nl.bytesoflife.xdot.parser;

import nl.bytesoflife.xdot.model.pen.NamedColors;
import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.model.pen.Rgba;
import nl.bytesoflife.xdot.model.shape.BezierShape;
import nl.bytesoflife.xdot.model.shape.EllipseShape;
import nl.bytesoflife.xdot.model.shape.Justification;
import nl.bytesoflife.xdot.model.shape.PolygonShape;
import nl.bytesoflife.xdot.model.shape.Shape;
import nl.bytesoflife.xdot.model.shape.TextShape;
import org.locationtech.jts.geom.Coordinate;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Interpreter for xdot drawing attributes ({@code _draw_}, {@code _ldraw_}, ...).
 *
 * <p>A directive string is a sequence of operations, each a one letter code followed
 * by its operands. The current pen is threaded through the whole string and copied
 * into every shape produced, so shapes keep the style that was active when they were
 * emitted. Shapes are returned in draw order.
 *
 * <p>Length-prefixed strings count UTF-8 bytes, so the directive is interpreted as bytes.
 *
 * @see <a href="https://graphviz.org/docs/outputs/canon/#xdot">xdot format</a>
 */
public class XDotAttrParser {

    private static final String SET_LINE_WIDTH = "setlinewidth(";
    private static final List<Double> DASHED = List.of(6.0);

    private final CoordinateTransform transform;
    private final ParseDiagnostics diagnostics;

    private byte[] buf;
    private int pos;

    public XDotAttrParser(CoordinateTransform transform, ParseDiagnostics diagnostics) {
        this.transform = transform;
        this.diagnostics = diagnostics;
    }

    public XDotAttrParser(CoordinateTransform transform) {
        this(transform, new ParseDiagnostics());
    }

    /**
     * Interpret one directive string. Interpretation stops at the first unknown or
     * malformed operation; the shapes produced before it are returned.
     */
    public List<Shape> parse(String code) {
        this.buf = unescape(code).getBytes(StandardCharsets.UTF_8);
        this.pos = 0;
        skipWhitespace();

        List<Shape> shapes = new ArrayList<>();
        Pen pen = Pen.DEFAULT;

        while (pos < buf.length) {
            String op = readCode();
            try {
                switch (op) {
                    case "c" -> pen = pen.withColor(readColor(pen.color()));
                    case "C" -> pen = pen.withFillColor(readColor(pen.fillColor()));
                    case "S" -> pen = applyStyle(pen, readText());
                    case "F" -> {
                        double size = readNumber();
                        pen = pen.withFont(size, readText());
                    }
                    case "T" -> {
                        Coordinate p = readPoint();
                        Justification j = Justification.fromCode((int) readNumber());
                        double w = readNumber();
                        String t = readText();
                        shapes.add(new TextShape(pen, p.x, p.y, j, w, t));
                    }
                    case "E" -> {
                        Coordinate p = readPoint();
                        double w = readNumber();
                        double h = readNumber();
                        // filled shape with an outline
                        shapes.add(new EllipseShape(pen, p.x, p.y, w, h, true));
                        shapes.add(new EllipseShape(pen, p.x, p.y, w, h, false));
                    }
                    case "e" -> {
                        Coordinate p = readPoint();
                        double w = readNumber();
                        double h = readNumber();
                        shapes.add(new EllipseShape(pen, p.x, p.y, w, h, false));
                    }
                    case "B" -> shapes.add(new BezierShape(pen, readPolygon()));
                    case "P" -> {
                        List<Coordinate> points = readPolygon();
                        shapes.add(new PolygonShape(pen, points, true));
                        shapes.add(new PolygonShape(pen, points, false));
                    }
                    case "p" -> shapes.add(new PolygonShape(pen, readPolygon(), false));
                    default -> {
                        diagnostics.warn("unknown xdot opcode '" + op + "'");
                        return shapes;
                    }
                }
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                // NumberFormatException is an IllegalArgumentException
                diagnostics.warn("malformed xdot operation '" + op + "': " + e.getMessage());
                return shapes;
            }
        }
        return shapes;
    }

    static String unescape(String code) {
        return code.replace("\\\"", "\"").replace("\\n", "\n");
    }

    private Pen applyStyle(Pen pen, String style) {
        if (style.startsWith(SET_LINE_WIDTH)) {
            int end = style.indexOf(')', SET_LINE_WIDTH.length());
            String width = end < 0
                    ? style.substring(SET_LINE_WIDTH.length())
                    : style.substring(SET_LINE_WIDTH.length(), end);
            return pen.withLineWidth(Double.parseDouble(width.trim()));
        } else if (style.equals("solid")) {
            return pen.withDash(List.of());
        } else if (style.equals("dashed")) {
            return pen.withDash(DASHED);
        }
        return pen;
    }

    /**
     * Read up to the next space and skip the whitespace after it.
     */
    private String readCode() {
        int end = pos;
        while (end < buf.length && buf[end] != ' ') {
            end++;
        }
        String code = new String(buf, pos, end - pos, StandardCharsets.UTF_8);
        pos = Math.min(end + 1, buf.length);
        skipWhitespace();
        return code;
    }

    /**
     * Integer or decimal; newer Graphviz releases write fractional coordinates.
     */
    private double readNumber() {
        return Double.parseDouble(readCode());
    }

    private Coordinate readPoint() {
        double x = readNumber();
        double y = readNumber();
        return transform.transform(x, y);
    }

    /**
     * Length-prefixed string: {@code N -text} where text is exactly N bytes.
     */
    private String readText() {
        int length = (int) readNumber();
        int dash = indexOf((byte) '-', pos);
        if (dash < 0) {
            throw new IllegalArgumentException("missing '-' before string");
        }
        int start = dash + 1;
        if (length < 0 || start + length > buf.length) {
            throw new IllegalArgumentException("string of " + length + " bytes runs past the end");
        }
        pos = start + length;
        String text = new String(buf, start, length, StandardCharsets.UTF_8);
        skipWhitespace();
        return text;
    }

    private List<Coordinate> readPolygon() {
        int count = (int) readNumber();
        // each point takes at least four bytes ("x y ")
        if (count < 0 || count > (buf.length - pos) / 4 + 1) {
            throw new IllegalArgumentException("point count " + count + " runs past the end");
        }
        List<Coordinate> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(readPoint());
        }
        return points;
    }

    /**
     * Parse a color operand. Falls back to {@code fallback} with a warning when a
     * name is not known.
     *
     * @see <a href="https://graphviz.org/docs/attr-types/color/">color attribute type</a>
     */
    private Rgba readColor(Rgba fallback) {
        String c = readText();
        Rgba color = parseColor(c);
        if (color == null) {
            diagnostics.warn("unknown color '" + c + "'");
            return fallback;
        }
        return color;
    }

    /**
     * @return the color, or null when it is not recognised
     */
    static Rgba parseColor(String c) {
        if (c.isEmpty()) {
            return null;
        }
        char first = c.charAt(0);
        if (first == '#') {
            return parseHex(c);
        } else if (Character.isDigit(first) || first == '.') {
            // "H,S,V" or "H S V" or "H, S, V"
            String[] hsv = c.replace(',', ' ').trim().split("\\s+");
            if (hsv.length != 3) {
                return null;
            }
            try {
                return Rgba.fromHsv(Double.parseDouble(hsv[0]), Double.parseDouble(hsv[1]),
                        Double.parseDouble(hsv[2]));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return NamedColors.lookup(c);
    }

    private static Rgba parseHex(String c) {
        if (c.length() < 7) {
            return null;
        }
        try {
            double r = hexByte(c, 1);
            double g = hexByte(c, 3);
            double b = hexByte(c, 5);
            double a = 1.0;
            if (c.length() >= 9) {
                try {
                    a = hexByte(c, 7);
                } catch (NumberFormatException e) {
                    a = 1.0;
                }
            }
            return new Rgba(r, g, b, a);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double hexByte(String c, int offset) {
        return Integer.parseInt(c.substring(offset, offset + 2), 16) / 255.0;
    }

    private int indexOf(byte value, int from) {
        for (int i = from; i < buf.length; i++) {
            if (buf[i] == value) return i;
        }
        return -1;
    }

    private void skipWhitespace() {
        while (pos < buf.length && isSpace(buf[pos])) {
            pos++;
        }
    }

    private static boolean isSpace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0b;
    }
}
