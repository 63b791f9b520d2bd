package org.retroscript.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsErrorsWarningsAndInfo() {
        assertThat(LogLevelHighlightConverter.colorize(Level.ERROR, "ERROR"))
                .isEqualTo(LogLevelHighlightConverter.ANSI_RED + "ERROR" + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(LogLevelHighlightConverter.colorize(Level.WARN, "WARN"))
                .startsWith(LogLevelHighlightConverter.ANSI_YELLOW);
        assertThat(LogLevelHighlightConverter.colorize(Level.INFO, "INFO"))
                .startsWith(LogLevelHighlightConverter.ANSI_BLUE);
    }

    @Test
    void leavesDebugUncolored() {
        assertThat(LogLevelHighlightConverter.colorize(Level.DEBUG, "DEBUG")).isEqualTo("DEBUG");
        assertThat(LogLevelHighlightConverter.colorize(Level.TRACE, "TRACE")).isEqualTo("TRACE");
    }
}
