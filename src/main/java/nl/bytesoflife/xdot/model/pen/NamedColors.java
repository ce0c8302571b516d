package nl.bytesoflife.xdot.model.pen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup table for the color names Graphviz accepts (the X11 scheme).
 * Backed by the {@code x11-colors.txt} resource.
 */
public final class NamedColors {

    private static final Logger log = LoggerFactory.getLogger(NamedColors.class);

    private static final String RESOURCE = "/x11-colors.txt";

    // gray0..gray100 and grey0..grey100
    private static final Pattern GRAY_LEVEL = Pattern.compile("gr[ae]y(\\d{1,3})");

    // Optional scheme prefix such as /x11/red or /svg/red
    private static final Pattern SCHEME = Pattern.compile("^/([a-z0-9]*)/(.+)$");

    private static final Map<String, Rgba> COLORS = load();

    private NamedColors() {
    }

    /**
     * Resolve a color name. Case and embedded spaces are ignored.
     *
     * @return the color, or null when the name is unknown
     */
    public static Rgba lookup(String name) {
        if (name == null) return null;
        String key = name.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (key.isEmpty()) return null;

        Matcher schemeMatcher = SCHEME.matcher(key);
        if (schemeMatcher.matches()) {
            String scheme = schemeMatcher.group(1);
            if (!scheme.isEmpty() && !scheme.equals("x11") && !scheme.equals("svg")) {
                return null;
            }
            key = schemeMatcher.group(2);
        }

        if (key.equals("transparent") || key.equals("none")) {
            return Rgba.TRANSPARENT;
        }

        Matcher grayMatcher = GRAY_LEVEL.matcher(key);
        if (grayMatcher.matches()) {
            int level = Integer.parseInt(grayMatcher.group(1));
            if (level > 100) return null;
            double value = Math.round(level * 2.55) / 255.0;
            return Rgba.opaque(value, value, value);
        }

        return COLORS.get(key);
    }

    public static int size() {
        return COLORS.size();
    }

    private static Map<String, Rgba> load() {
        Map<String, Rgba> colors = new HashMap<>();
        try (InputStream in = NamedColors.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing color table resource " + RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;

                String[] fields = line.split("\\s+");
                if (fields.length != 2 || !fields[1].startsWith("#") || fields[1].length() != 7) {
                    log.warn("Ignoring malformed color table entry: {}", line);
                    continue;
                }
                int rgb = Integer.parseInt(fields[1].substring(1), 16);
                colors.put(fields[0], Rgba.opaque(
                        ((rgb >> 16) & 0xff) / 255.0,
                        ((rgb >> 8) & 0xff) / 255.0,
                        (rgb & 0xff) / 255.0));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read color table " + RESOURCE, e);
        }
        log.debug("Loaded {} named colors", colors.size());
        return Collections.unmodifiableMap(colors);
    }
}
