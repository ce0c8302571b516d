package nl.bytesoflife.xdot.renderer;

import nl.bytesoflife.xdot.model.pen.Rgba;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.font.FontRenderContext;
import java.awt.font.TextLayout;
import java.awt.geom.AffineTransform;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link DrawingSurface} on top of a Java2D graphics context.
 */
public class Graphics2DSurface implements DrawingSurface {

    // PostScript names emitted by Graphviz mapped to Java logical fonts
    private static final Map<String, String> FONT_FAMILIES = Map.of(
            "times", Font.SERIF,
            "times-roman", Font.SERIF,
            "times new roman", Font.SERIF,
            "helvetica", Font.SANS_SERIF,
            "arial", Font.SANS_SERIF,
            "sans", Font.SANS_SERIF,
            "courier", Font.MONOSPACED,
            "courier new", Font.MONOSPACED,
            "monospace", Font.MONOSPACED
    );

    private final Graphics2D g2;
    private final Deque<SavedState> saved = new ArrayDeque<>();
    private final Map<String, Font> fonts = new HashMap<>();
    private Path2D.Double path = new Path2D.Double(Path2D.WIND_NON_ZERO);

    public Graphics2DSurface(Graphics2D g2) {
        this.g2 = g2;
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g2.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        g2.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
    }

    @Override
    public void save() {
        saved.push(new SavedState(g2.getTransform(), g2.getClip()));
    }

    @Override
    public void restore() {
        SavedState state = saved.pop();
        g2.setTransform(state.transform());
        g2.setClip(state.clip());
    }

    @Override
    public void translate(double dx, double dy) {
        g2.translate(dx, dy);
    }

    @Override
    public void scale(double sx, double sy) {
        g2.scale(sx, sy);
    }

    @Override
    public void clipRect(double x, double y, double width, double height) {
        g2.clip(new Rectangle2D.Double(x, y, width, height));
    }

    @Override
    public void paint(Rgba color) {
        Shape clip = g2.getClip();
        g2.setColor(toColor(color));
        if (clip != null) {
            g2.fill(clip);
        } else {
            Rectangle2D bounds = g2.getDeviceConfiguration().getBounds();
            AffineTransform saved = g2.getTransform();
            g2.setTransform(new AffineTransform());
            g2.fill(bounds);
            g2.setTransform(saved);
        }
    }

    @Override
    public void moveTo(double x, double y) {
        path.moveTo(x, y);
    }

    @Override
    public void lineTo(double x, double y) {
        path.lineTo(x, y);
    }

    @Override
    public void curveTo(double x1, double y1, double x2, double y2, double x3, double y3) {
        path.curveTo(x1, y1, x2, y2, x3, y3);
    }

    @Override
    public void closePath() {
        path.closePath();
    }

    @Override
    public void fill(Rgba color) {
        g2.setColor(toColor(color));
        g2.fill(path);
        path = new Path2D.Double(Path2D.WIND_NON_ZERO);
    }

    @Override
    public void stroke(Rgba color, double lineWidth, List<Double> dash) {
        g2.setColor(toColor(color));
        g2.setStroke(createStroke(lineWidth, dash));
        g2.draw(path);
        path = new Path2D.Double(Path2D.WIND_NON_ZERO);
    }

    @Override
    public TextExtent measureText(String text, String fontName, double fontSize) {
        if (text.isEmpty()) {
            return new TextExtent(0, 0);
        }
        TextLayout layout = new TextLayout(text, font(fontName, fontSize), fontRenderContext());
        double height = layout.getAscent() + layout.getDescent() + layout.getLeading();
        return new TextExtent(layout.getAdvance(), height);
    }

    @Override
    public void drawText(String text, double x, double y, String fontName, double fontSize,
                         double scale, Rgba color) {
        if (text.isEmpty()) return;
        TextLayout layout = new TextLayout(text, font(fontName, fontSize), fontRenderContext());
        AffineTransform saved = g2.getTransform();
        g2.translate(x, y);
        g2.scale(scale, scale);
        g2.setColor(toColor(color));
        layout.draw(g2, 0f, layout.getAscent());
        g2.setTransform(saved);
    }

    private FontRenderContext fontRenderContext() {
        // Measure in user space so text scales with the viewport like every other shape
        return new FontRenderContext(null, true, true);
    }

    private Font font(String fontName, double fontSize) {
        String key = fontName + "@" + fontSize;
        return fonts.computeIfAbsent(key, k -> {
            String family = FONT_FAMILIES.getOrDefault(fontName.toLowerCase(Locale.ROOT), fontName);
            int style = Font.PLAIN;
            String lower = fontName.toLowerCase(Locale.ROOT);
            if (lower.contains("bold")) style |= Font.BOLD;
            if (lower.contains("italic") || lower.contains("oblique")) style |= Font.ITALIC;
            return new Font(family, style, 1).deriveFont((float) fontSize);
        });
    }

    static BasicStroke createStroke(double lineWidth, List<Double> dash) {
        if (dash.isEmpty()) {
            return new BasicStroke((float) lineWidth, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER);
        }
        float[] pattern = new float[dash.size()];
        for (int i = 0; i < pattern.length; i++) {
            pattern[i] = dash.get(i).floatValue();
        }
        return new BasicStroke((float) lineWidth, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
                10f, pattern, 0f);
    }

    static Color toColor(Rgba color) {
        return new Color(channel(color.red()), channel(color.green()), channel(color.blue()),
                channel(color.alpha()));
    }

    private static float channel(double value) {
        return (float) Math.max(0.0, Math.min(1.0, value));
    }

    private record SavedState(AffineTransform transform, Shape clip) {
    }
}
