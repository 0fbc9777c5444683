package at.sv.lights.persistence;

import at.sv.lights.EventLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per line.
 */
public final class JsonLinesEventLog implements EventLog {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesEventLog(Path file) {
        this.file = file;
        this.mapper = JsonMappers.create();
    }

    @Override
    public synchronized void append(EventLogEntry entry) {
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to event log '" + file + "'", e);
        }
    }
}
