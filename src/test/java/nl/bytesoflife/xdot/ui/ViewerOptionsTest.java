package nl.bytesoflife.xdot.ui;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ViewerOptionsTest {

    @Test
    void defaults() {
        ViewerOptions options = ViewerOptions.fromProperties(new Properties());

        assertEquals("dot", options.getLayoutProgram());
        assertEquals(Duration.ofSeconds(60), options.getLayoutTimeout());
        assertEquals(512, options.getWindowWidth());
        assertEquals(512, options.getWindowHeight());
    }

    @Test
    void readFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ViewerOptions.LAYOUT_PROGRAM_PROPERTY, "neato");
        properties.setProperty(ViewerOptions.LAYOUT_TIMEOUT_PROPERTY, "5");
        properties.setProperty(ViewerOptions.WINDOW_WIDTH_PROPERTY, "1024");
        properties.setProperty(ViewerOptions.WINDOW_HEIGHT_PROPERTY, "768");

        ViewerOptions options = ViewerOptions.fromProperties(properties);

        assertEquals("neato", options.getLayoutProgram());
        assertEquals(Duration.ofSeconds(5), options.getLayoutTimeout());
        assertEquals(1024, options.getWindowWidth());
        assertEquals(768, options.getWindowHeight());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(ViewerOptions.WINDOW_WIDTH_PROPERTY, "wide");
        properties.setProperty(ViewerOptions.WINDOW_HEIGHT_PROPERTY, "-3");

        ViewerOptions options = ViewerOptions.fromProperties(properties);

        assertEquals(512, options.getWindowWidth());
        assertEquals(512, options.getWindowHeight());
    }

    @Test
    void commandLineOverrides() {
        ViewerOptions options = ViewerOptions.fromProperties(new Properties())
                .withLayoutProgram("fdp")
                .withWindowSize(640, 480);

        assertEquals("fdp", options.getLayoutProgram());
        assertEquals(640, options.getWindowWidth());
    }
}
