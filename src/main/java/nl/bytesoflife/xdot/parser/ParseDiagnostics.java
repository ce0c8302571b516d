package nl.bytesoflife.xdot.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the recoverable problems found while interpreting drawing attributes.
 * Every warning is also logged.
 */
public class ParseDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(ParseDiagnostics.class);

    private final List<String> warnings = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int size() {
        return warnings.size();
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
