package nl.bytesoflife.xdot.ui;

import nl.bytesoflife.xdot.renderer.Graphics2DSurface;
import nl.bytesoflife.xdot.viewer.CursorKind;
import nl.bytesoflife.xdot.viewer.DotController;
import nl.bytesoflife.xdot.viewer.DotViewerListener;
import nl.bytesoflife.xdot.viewer.KeyCommand;
import nl.bytesoflife.xdot.viewer.PointerEvent;
import nl.bytesoflife.xdot.viewer.animation.SwingAnimationTimer;

import javax.swing.JComponent;
import java.awt.Cursor;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.InputEvent;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.event.MouseWheelEvent;

/**
 * Swing component showing a graph. Translates AWT input into {@link DotController} calls.
 */
public class DotWidget extends JComponent {

    private final DotController controller = new DotController(new SwingAnimationTimer());

    public DotWidget() {
        setFocusable(true);
        setOpaque(true);
        setPreferredSize(new Dimension(512, 512));

        controller.addListener(new DotViewerListener() {
            @Override
            public void cursorChanged(CursorKind cursor) {
                setCursor(toAwtCursor(cursor));
            }

            @Override
            public void repaintRequested() {
                repaint();
            }
        });

        MouseAdapter mouse = new MouseAdapter() {
            @Override
            public void mousePressed(MouseEvent e) {
                requestFocusInWindow();
                controller.onButtonPress(toPointerEvent(e));
            }

            @Override
            public void mouseReleased(MouseEvent e) {
                controller.onButtonRelease(toPointerEvent(e));
            }

            @Override
            public void mouseMoved(MouseEvent e) {
                controller.onMotion(toPointerEvent(e));
            }

            @Override
            public void mouseDragged(MouseEvent e) {
                controller.onMotion(toPointerEvent(e));
            }

            @Override
            public void mouseWheelMoved(MouseWheelEvent e) {
                controller.onScroll(e.getWheelRotation());
            }
        };
        addMouseListener(mouse);
        addMouseMotionListener(mouse);
        addMouseWheelListener(mouse);

        addKeyListener(new KeyAdapter() {
            @Override
            public void keyPressed(KeyEvent e) {
                KeyCommand command = toKeyCommand(e);
                if (command != null && controller.onKey(command)) {
                    e.consume();
                }
            }
        });

        addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                controller.setSize(getWidth(), getHeight());
            }
        });
    }

    public DotController getController() {
        return controller;
    }

    @Override
    protected void paintComponent(Graphics g) {
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            controller.draw(new Graphics2DSurface(g2));
        } finally {
            g2.dispose();
        }
    }

    static PointerEvent toPointerEvent(MouseEvent e) {
        int button;
        if (e.getID() == MouseEvent.MOUSE_MOVED || e.getID() == MouseEvent.MOUSE_DRAGGED) {
            button = 0;
        } else {
            button = switch (e.getButton()) {
                case MouseEvent.BUTTON1 -> 1;
                case MouseEvent.BUTTON2 -> 2;
                case MouseEvent.BUTTON3 -> 3;
                default -> 0;
            };
        }
        int modifiers = e.getModifiersEx();
        return new PointerEvent(e.getX(), e.getY(), button,
                (modifiers & InputEvent.SHIFT_DOWN_MASK) != 0,
                (modifiers & InputEvent.CTRL_DOWN_MASK) != 0);
    }

    static KeyCommand toKeyCommand(KeyEvent e) {
        switch (e.getKeyCode()) {
            case KeyEvent.VK_LEFT:
                return KeyCommand.PAN_LEFT;
            case KeyEvent.VK_RIGHT:
                return KeyCommand.PAN_RIGHT;
            case KeyEvent.VK_UP:
                return KeyCommand.PAN_UP;
            case KeyEvent.VK_DOWN:
                return KeyCommand.PAN_DOWN;
            case KeyEvent.VK_PAGE_UP:
            case KeyEvent.VK_PLUS:
            case KeyEvent.VK_ADD:
            case KeyEvent.VK_EQUALS:
                return KeyCommand.ZOOM_IN;
            case KeyEvent.VK_PAGE_DOWN:
            case KeyEvent.VK_MINUS:
            case KeyEvent.VK_SUBTRACT:
                return KeyCommand.ZOOM_OUT;
            case KeyEvent.VK_1:
                return KeyCommand.ZOOM_100;
            case KeyEvent.VK_F:
                return KeyCommand.ZOOM_FIT;
            case KeyEvent.VK_ESCAPE:
                return KeyCommand.ABORT;
            case KeyEvent.VK_R:
                return KeyCommand.RELOAD;
            default:
                return null;
        }
    }

    private static Cursor toAwtCursor(CursorKind cursor) {
        return switch (cursor) {
            case HAND -> Cursor.getPredefinedCursor(Cursor.HAND_CURSOR);
            case MOVE -> Cursor.getPredefinedCursor(Cursor.MOVE_CURSOR);
            case ARROW -> Cursor.getDefaultCursor();
        };
    }
}
