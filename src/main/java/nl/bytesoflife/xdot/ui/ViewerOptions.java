package nl.bytesoflife.xdot.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Viewer settings. Defaults come from system properties and can be overridden from the command line.
 */
public class ViewerOptions {

    private static final Logger log = LoggerFactory.getLogger(ViewerOptions.class);

    public static final String LAYOUT_PROGRAM_PROPERTY = "xdot.layout.program";
    public static final String LAYOUT_TIMEOUT_PROPERTY = "xdot.layout.timeoutSeconds";
    public static final String WINDOW_WIDTH_PROPERTY = "xdot.window.width";
    public static final String WINDOW_HEIGHT_PROPERTY = "xdot.window.height";

    private String layoutProgram = "dot";
    private Duration layoutTimeout = Duration.ofSeconds(60);
    private int windowWidth = 512;
    private int windowHeight = 512;

    public static ViewerOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static ViewerOptions fromProperties(Properties properties) {
        ViewerOptions options = new ViewerOptions();
        String program = properties.getProperty(LAYOUT_PROGRAM_PROPERTY);
        if (program != null && !program.isBlank()) {
            options.withLayoutProgram(program.trim());
        }
        options.withLayoutTimeout(Duration.ofSeconds(
                intProperty(properties, LAYOUT_TIMEOUT_PROPERTY, (int) options.layoutTimeout.toSeconds())));
        options.withWindowSize(
                intProperty(properties, WINDOW_WIDTH_PROPERTY, options.windowWidth),
                intProperty(properties, WINDOW_HEIGHT_PROPERTY, options.windowHeight));
        return options;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number", key, value);
            return defaultValue;
        }
        log.warn("Ignoring {}={}: must be positive", key, value);
        return defaultValue;
    }

    public ViewerOptions withLayoutProgram(String layoutProgram) {
        this.layoutProgram = layoutProgram;
        return this;
    }

    public ViewerOptions withLayoutTimeout(Duration layoutTimeout) {
        this.layoutTimeout = layoutTimeout;
        return this;
    }

    public ViewerOptions withWindowSize(int width, int height) {
        this.windowWidth = width;
        this.windowHeight = height;
        return this;
    }

    public String getLayoutProgram() {
        return layoutProgram;
    }

    public Duration getLayoutTimeout() {
        return layoutTimeout;
    }

    public int getWindowWidth() {
        return windowWidth;
    }

    public int getWindowHeight() {
        return windowHeight;
    }

    @Override
    public String toString() {
        return "ViewerOptions[program=" + layoutProgram + ", timeout=" + layoutTimeout.toSeconds()
                + "s, window=" + windowWidth + "x" + windowHeight + "]";
    }
}
