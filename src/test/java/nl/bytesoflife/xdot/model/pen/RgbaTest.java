package nl.bytesoflife.xdot.model.pen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RgbaTest {

    private static final double EPS = 1e-9;

    @Test
    void hsvPrimaries() {
        assertEquals(Rgba.opaque(1, 0, 0), Rgba.fromHsv(0, 1, 1));
        assertRgb(0, 1, 0, Rgba.fromHsv(1.0 / 3, 1, 1));
        assertRgb(0, 0, 1, Rgba.fromHsv(2.0 / 3, 1, 1));
    }

    @Test
    void hueWrapsAround() {
        assertRgb(1, 0, 0, Rgba.fromHsv(1.0, 1, 1));
    }

    @Test
    void zeroSaturationIsGray() {
        assertEquals(Rgba.opaque(0.5, 0.5, 0.5), Rgba.fromHsv(0.7, 0, 0.5));
    }

    @Test
    void highlightedPen() {
        Pen pen = Pen.DEFAULT.withLineWidth(3).highlighted();
        assertEquals(new Rgba(1, 0, 0, 1), pen.color());
        assertEquals(new Rgba(1, 0.8, 0.8, 1), pen.fillColor());
        assertEquals(3, pen.lineWidth(), EPS);
    }

    private static void assertRgb(double r, double g, double b, Rgba actual) {
        assertEquals(r, actual.red(), EPS);
        assertEquals(g, actual.green(), EPS);
        assertEquals(b, actual.blue(), EPS);
        assertEquals(1.0, actual.alpha(), EPS);
    }
}
