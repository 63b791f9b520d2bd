package org.retroscript.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reading of script files shared by the subcommands.
 */
final class ScriptFileSupport {

    private ScriptFileSupport() {
    }

    /**
     * Reads a script, reporting a failure on {@code err}.
     *
     * @return the text, or {@code null} if the file could not be read
     */
    static String read(Path file, PrintWriter err) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("File not found: " + file);
        } catch (IOException e) {
            err.println("Failed to read " + file + ": " + e.getMessage());
        }
        return null;
    }
}
