package org.retroscript.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level of console log lines. Registered as
 * {@code levelColor} in {@code logback.xml} and used by the color console appender.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Blue</li>
 *   <li>DEBUG/TRACE - Default</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    /** Restores the terminal's default color. */
    static final String ANSI_RESET = "\u001B[0m";
    /** Color for ERROR. */
    static final String ANSI_RED = "\u001B[31m";
    /** Color for WARN. */
    static final String ANSI_YELLOW = "\u001B[33m";
    /** Color for INFO. */
    static final String ANSI_BLUE = "\u001B[34m";

    /**
     * Wraps the output of the child converters in the color of the event's level.
     *
     * @param event the log event being formatted.
     * @param in    the already formatted text of the child converters.
     * @return the colored text.
     */
    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorize(event.getLevel(), in);
    }

    /**
     * Wraps text in the ANSI color of a level.
     *
     * @param level the log level deciding the color.
     * @param text  the text to color.
     * @return the text between a color code and a reset, or unchanged for DEBUG and TRACE.
     */
    static String colorize(Level level, String text) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED + text + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + text + ANSI_RESET;
            case Level.INFO_INT -> ANSI_BLUE + text + ANSI_RESET;
            default -> text;
        };
    }
}
