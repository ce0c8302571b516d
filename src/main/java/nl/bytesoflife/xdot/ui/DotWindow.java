package nl.bytesoflife.xdot.ui;

import nl.bytesoflife.xdot.layout.GraphvizLayoutEngine;
import nl.bytesoflife.xdot.layout.LayoutEngine;
import nl.bytesoflife.xdot.layout.XDotFileLayoutEngine;
import nl.bytesoflife.xdot.model.graph.Graph;
import nl.bytesoflife.xdot.viewer.DotController;
import nl.bytesoflife.xdot.viewer.DotViewerListener;
import nl.bytesoflife.xdot.viewer.KeyCommand;
import nl.bytesoflife.xdot.viewer.PointerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JButton;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JOptionPane;
import javax.swing.JToolBar;
import javax.swing.SwingUtilities;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Top level window: a toolbar above a {@link DotWidget}.
 */
public class DotWindow extends JFrame {

    private static final Logger log = LoggerFactory.getLogger(DotWindow.class);

    private static final String TITLE = "Dot Viewer";

    private final ViewerOptions options;
    private final DotWidget widget = new DotWidget();
    private final LayoutEngine graphviz;
    private final LayoutEngine xdotFiles = new XDotFileLayoutEngine();

    private Path currentFile;
    private String currentName = "<stdin>";

    public DotWindow(ViewerOptions options) {
        super(TITLE);
        this.options = options;
        this.graphviz = new GraphvizLayoutEngine(options.getLayoutProgram(), options.getLayoutTimeout());

        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setSize(options.getWindowWidth(), options.getWindowHeight());

        getContentPane().setLayout(new BorderLayout());
        getContentPane().add(createToolBar(), BorderLayout.NORTH);
        getContentPane().add(widget, BorderLayout.CENTER);

        DotController controller = widget.getController();
        controller.addListener(new DotViewerListener() {
            @Override
            public void urlClicked(String url, PointerEvent event) {
                openUrl(url);
            }

            @Override
            public void graphLoaded(Graph graph) {
                setTitle(currentName + " - " + TITLE);
            }

            @Override
            public void loadFailed(Throwable error) {
                showError("Could not load " + currentName + ", is it a valid dot file?\n\n" + error.getMessage());
            }

            @Override
            public void reloadRequested() {
                reload();
            }
        });
    }

    private JToolBar createToolBar() {
        DotController controller = widget.getController();
        JToolBar toolBar = new JToolBar();
        toolBar.setFloatable(false);
        toolBar.add(button("Open", "Open a dot or xdot file", this::chooseFile));
        toolBar.add(button("Reload", "Read the current file again", this::reload));
        toolBar.addSeparator();
        toolBar.add(button("Zoom In", "Zoom in", () -> controller.onKey(KeyCommand.ZOOM_IN)));
        toolBar.add(button("Zoom Out", "Zoom out", () -> controller.onKey(KeyCommand.ZOOM_OUT)));
        toolBar.add(button("Fit", "Zoom to fit the window", () -> controller.onKey(KeyCommand.ZOOM_FIT)));
        toolBar.add(button("100%", "Actual size", () -> controller.onKey(KeyCommand.ZOOM_100)));
        return toolBar;
    }

    private JButton button(String text, String tooltip, Runnable action) {
        JButton button = new JButton(text);
        button.setToolTipText(tooltip);
        button.setFocusable(false);
        button.addActionListener(e -> {
            action.run();
            widget.requestFocusInWindow();
        });
        return button;
    }

    public DotWidget getWidget() {
        return widget;
    }

    /**
     * Show DOT source. Files ending in {@code .xdot} are expected to be laid out already.
     */
    public void showSource(String source, String name) {
        currentName = name;
        LayoutEngine engine = name.toLowerCase().endsWith(".xdot") ? xdotFiles : graphviz;
        log.info("Loading {} with {}", name, engine == xdotFiles ? "xdot reader" : options.getLayoutProgram());
        widget.getController().load(engine, source, SwingUtilities::invokeLater);
    }

    public void openFile(Path file) {
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            currentFile = file;
            showSource(source, file.getFileName().toString());
        } catch (IOException e) {
            log.warn("Failed to read {}", file, e);
            showError("Could not read " + file + ": " + e.getMessage());
        }
    }

    private void reload() {
        if (currentFile != null) {
            openFile(currentFile);
        }
    }

    private void chooseFile() {
        JFileChooser chooser = new JFileChooser(currentFile != null ? currentFile.toAbsolutePath().getParent().toFile() : null);
        chooser.setFileFilter(new FileNameExtensionFilter("Graphviz files", "dot", "gv", "xdot"));
        if (chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            openFile(chooser.getSelectedFile().toPath());
        }
    }

    private void openUrl(String url) {
        log.info("Clicked URL {}", url);
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            return;
        }
        try {
            Desktop.getDesktop().browse(new URI(url));
        } catch (IOException | URISyntaxException e) {
            log.warn("Cannot open {}: {}", url, e.getMessage());
            showError("Cannot open " + url + ": " + e.getMessage());
        }
    }

    private void showError(String message) {
        JOptionPane.showMessageDialog(this, message, TITLE, JOptionPane.ERROR_MESSAGE);
    }
}
