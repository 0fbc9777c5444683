package at.sv.lights.persistence;

import at.sv.lights.ScheduleDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads schedule definitions from a JSON array file. The file is re-read on every call, so edits take effect
 * with the next reconciliation. {@link #updateLastApplied} rewrites the file via a temporary file.
 */
@Slf4j
public final class JsonFileScheduleRepository implements ScheduleRepository {

    private static final TypeReference<List<ScheduleDefinition>> DEFINITIONS = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileScheduleRepository(Path file) {
        this.file = file;
        this.mapper = JsonMappers.create();
    }

    @Override
    public synchronized List<ScheduleDefinition> listActiveSchedules() {
        return readAll().stream()
                        .filter(ScheduleDefinition::active)
                        .toList();
    }

    @Override
    public synchronized void updateLastApplied(long scheduleId, Instant timestamp) {
        List<ScheduleDefinition> definitions = new ArrayList<>(readAll());
        boolean found = false;
        for (int i = 0; i < definitions.size(); i++) {
            ScheduleDefinition definition = definitions.get(i);
            if (definition.id() == scheduleId) {
                definitions.set(i, definition.toBuilder().lastAppliedAt(timestamp).build());
                found = true;
            }
        }
        if (!found) {
            log.warn("Schedule {} no longer exists, not updating last applied timestamp", scheduleId);
            return;
        }
        writeAll(definitions);
    }

    private List<ScheduleDefinition> readAll() {
        if (Files.notExists(file)) {
            log.warn("Schedule file '{}' does not exist", file);
            return List.of();
        }
        try {
            return mapper.readValue(file.toFile(), DEFINITIONS);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schedule file '" + file + "'", e);
        }
    }

    private void writeAll(List<ScheduleDefinition> definitions) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), definitions);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write schedule file '" + file + "'", e);
        }
    }
}
