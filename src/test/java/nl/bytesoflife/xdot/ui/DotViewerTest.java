package nl.bytesoflife.xdot.ui;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DotViewerTest {

    @Test
    void timeoutInSeconds() {
        assertEquals(Duration.ofSeconds(30), DotViewer.parseTimeout("30"));
        assertEquals(Duration.ofSeconds(5), DotViewer.parseTimeout(" 5 "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "", "0", "-4", "1.5"})
    void invalidTimeout(String value) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DotViewer.parseTimeout(value));
        assertTrue(e.getMessage().startsWith("Invalid timeout"));
    }
}
