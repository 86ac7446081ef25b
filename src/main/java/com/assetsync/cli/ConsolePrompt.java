package com.assetsync.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Line-oriented terminal prompt shared by the interactive conflict resolver and the
 * continuation gate. Tests pass a reader over scripted input.
 */
public class ConsolePrompt {

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsolePrompt(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    public void println(String line) {
        out.println(line);
    }

    /**
     * Prints the question and reads one trimmed line.
     *
     * @return the answer, or empty when input is exhausted
     */
    public Optional<String> ask(String question) {
        out.print(question);
        out.flush();
        try {
            String line = reader.readLine();
            return line == null ? Optional.empty() : Optional.of(line.trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
