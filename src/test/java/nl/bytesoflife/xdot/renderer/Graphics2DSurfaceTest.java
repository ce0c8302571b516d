package nl.bytesoflife.xdot.renderer;

import nl.bytesoflife.xdot.model.pen.Rgba;
import org.junit.jupiter.api.Test;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Graphics2DSurfaceTest {

    private final BufferedImage image = new BufferedImage(40, 40, BufferedImage.TYPE_INT_ARGB);

    private Graphics2DSurface surface(Graphics2D g2) {
        return new Graphics2DSurface(g2);
    }

    @Test
    void fillUsesTheTransform() {
        Graphics2D g2 = image.createGraphics();
        Graphics2DSurface surface = surface(g2);
        surface.paint(Rgba.WHITE);
        surface.save();
        surface.translate(20, 20);
        surface.scale(2, 2);
        surface.moveTo(0, 0);
        surface.lineTo(5, 0);
        surface.lineTo(5, 5);
        surface.lineTo(0, 5);
        surface.closePath();
        surface.fill(Rgba.opaque(1, 0, 0));
        surface.restore();
        g2.dispose();

        assertEquals(0xffff0000, image.getRGB(25, 25));
        assertEquals(0xffffffff, image.getRGB(15, 15));
        assertEquals(0xffffffff, image.getRGB(35, 35));
    }

    @Test
    void restoreUndoesClip() {
        Graphics2D g2 = image.createGraphics();
        Graphics2DSurface surface = surface(g2);
        surface.save();
        surface.clipRect(0, 0, 10, 10);
        surface.paint(Rgba.BLACK);
        surface.restore();
        g2.dispose();

        assertEquals(0xff000000, image.getRGB(5, 5));
        assertEquals(0, image.getRGB(20, 20));
    }

    @Test
    void solidAndDashedStrokes() {
        BasicStroke solid = Graphics2DSurface.createStroke(2, List.of());
        assertEquals(2f, solid.getLineWidth());
        assertNull(solid.getDashArray());

        BasicStroke dashed = Graphics2DSurface.createStroke(1, List.of(6.0));
        assertArrayEquals(new float[]{6f}, dashed.getDashArray());
    }

    @Test
    void colorChannelsAreClamped() {
        Color color = Graphics2DSurface.toColor(new Rgba(1.5, 0, -1, 0.5));
        assertEquals(255, color.getRed());
        assertEquals(0, color.getBlue());
        assertEquals(128, color.getAlpha());
    }
}
