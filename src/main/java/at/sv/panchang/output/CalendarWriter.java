package at.sv.panchang.output;

import at.sv.panchang.event.EventSet;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public interface CalendarWriter {

    String write(EventSet events);

    /**
     * Writes the events as UTF-8, creating missing parent directories.
     */
    default void write(EventSet events, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, write(events), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write calendar to " + file, e);
        }
    }
}
