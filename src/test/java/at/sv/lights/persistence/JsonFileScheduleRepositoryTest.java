package at.sv.lights.persistence;

import at.sv.lights.ScheduleDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileScheduleRepositoryTest {

    @TempDir
    Path tempDir;

    private Path file;
    private JsonFileScheduleRepository repository;

    @BeforeEach
    void setUp() throws IOException {
        file = tempDir.resolve("schedules.json");
        try (InputStream in = getClass().getResourceAsStream("/schedules.json")) {
            Files.copy(in, file);
        }
        repository = new JsonFileScheduleRepository(file);
    }

    @Test
    void listActiveSchedules_returnsOnlyActiveDefinitions() {
        List<ScheduleDefinition> schedules = repository.listActiveSchedules();

        assertThat(schedules).extracting(ScheduleDefinition::id).containsExactly(1L, 2L);
        ScheduleDefinition first = schedules.get(0);
        assertThat(first.channelId()).isZero();
        assertThat(first.onHour()).isEqualTo(5);
        assertThat(first.onMinute()).isEqualTo(30);
        assertThat(first.offHour()).isEqualTo(7);
        assertThat(first.offMinute()).isEqualTo(30);
        assertThat(first.lastAppliedAt()).isNull();
        assertThat(schedules.get(1).lastAppliedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void updateLastApplied_persistsTimestamp_keepsOtherDefinitions() throws IOException {
        Instant timestamp = Instant.parse("2024-03-01T11:00:00Z");

        repository.updateLastApplied(1, timestamp);

        assertThat(new JsonFileScheduleRepository(file).listActiveSchedules().get(0).lastAppliedAt()).isEqualTo(timestamp);
        assertThat(Files.readString(file)).contains("\"id\" : 3");
    }

    @Test
    void updateLastApplied_unknownSchedule_leavesFileUntouched() throws IOException {
        String before = Files.readString(file);

        repository.updateLastApplied(42, Instant.now());

        assertThat(Files.readString(file)).isEqualTo(before);
    }

    @Test
    void listActiveSchedules_fileMissing_returnsEmptyList() {
        repository = new JsonFileScheduleRepository(tempDir.resolve("missing.json"));

        assertThat(repository.listActiveSchedules()).isEmpty();
    }

    @Test
    void listActiveSchedules_invalidJson_throwsUncheckedIOException() throws IOException {
        Files.writeString(file, "[{\"id\": 1,");

        assertThatThrownBy(() -> repository.listActiveSchedules()).isInstanceOf(UncheckedIOException.class);
    }
}
