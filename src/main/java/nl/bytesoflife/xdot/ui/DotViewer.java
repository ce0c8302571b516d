package nl.bytesoflife.xdot.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Command line entry point: {@code xdot-viewer [-f program] [-t seconds] [file | -]}.
 */
public class DotViewer {

    private static final Logger log = LoggerFactory.getLogger(DotViewer.class);

    public static void main(String[] args) throws IOException {
        ViewerOptions options = ViewerOptions.fromSystemProperties();
        String input = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ((arg.equals("-f") || arg.equals("--filter")) && i + 1 < args.length) {
                options.withLayoutProgram(args[++i]);
            } else if ((arg.equals("-t") || arg.equals("--timeout")) && i + 1 < args.length) {
                String value = args[++i];
                try {
                    options.withLayoutTimeout(parseTimeout(value));
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    System.exit(2);
                }
            } else if (arg.equals("-h") || arg.equals("--help")) {
                System.out.println("Usage: xdot-viewer [-f program] [-t seconds] [file | -]");
                return;
            } else if (input == null) {
                input = arg;
            } else {
                System.err.println("Unexpected argument: " + arg);
                System.exit(2);
            }
        }
        log.debug("Starting with {}", options);

        String stdinSource = "-".equals(input)
                ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
                : null;
        Path file = input != null && stdinSource == null ? Paths.get(input) : null;

        SwingUtilities.invokeLater(() -> {
            DotWindow window = new DotWindow(options);
            window.setVisible(true);
            if (stdinSource != null) {
                window.showSource(stdinSource, "<stdin>");
            } else if (file != null) {
                window.openFile(file);
            }
        });
    }

    /**
     * Timeout in whole seconds, which must be positive.
     */
    static Duration parseTimeout(String value) {
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeout: " + value, e);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("Invalid timeout: " + value);
        }
        return Duration.ofSeconds(seconds);
    }
}
