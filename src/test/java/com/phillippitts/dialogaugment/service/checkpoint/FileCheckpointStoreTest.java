package com.phillippitts.dialogaugment.service.checkpoint;

import com.phillippitts.dialogaugment.domain.Checkpoint;
import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.exception.InitializationException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path dir;

    private FileCheckpointStore store(Path file) {
        return new FileCheckpointStore(file, 3, Duration.ZERO, CLOCK);
    }

    @Test
    void missingFileLoadsEmpty() {
        FileCheckpointStore store = store(dir.resolve("checkpoint.json"));

        Checkpoint cp = store.load();

        assertThat(cp.size()).isZero();
        assertThat(store.current()).isSameAs(cp);
    }

    @Test
    void commitPersistsAndReloads() {
        Path file = dir.resolve("out/checkpoint.json");
        FileCheckpointStore store = store(file);
        store.load();

        store.commit("dialogues_002.json");
        store.commitAll(List.of("dialogues_001.json", "dialogues_002.json"));

        Checkpoint reloaded = store(file).load();
        assertThat(reloaded.completedShards()).containsExactly("dialogues_001.json", "dialogues_002.json");
        assertThat(reloaded.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void writtenFileHasVersionAndLeavesNoTempFiles() throws IOException {
        Path file = dir.resolve("checkpoint.json");
        FileCheckpointStore store = store(file);
        store.load();

        store.commit("a.json");

        JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        assertThat(json.getInt("version")).isEqualTo(Checkpoint.VERSION);
        assertThat(json.getJSONArray("completedShards").toList()).containsExactly("a.json");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("checkpoint.json");
        }
    }

    @Test
    void commitOfKnownShardDoesNotRewrite() throws IOException {
        Path file = dir.resolve("checkpoint.json");
        FileCheckpointStore store = store(file);
        store.load();
        store.commit("a.json");
        Files.delete(file);

        store.commit("a.json");

        assertThat(file).doesNotExist();
    }

    @Test
    void legacyArrayFormatIsAccepted() throws IOException {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "[\"dialogues_001.json\", \"dialogues_004.json\"]");

        Checkpoint cp = store(file).load();

        assertThat(cp.completedShards()).containsExactly("dialogues_001.json", "dialogues_004.json");
        assertThat(cp.updatedAt()).isNull();
    }

    @Test
    void corruptCheckpointFailsInitialization() throws IOException {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{\"completedShards\": ");

        assertThatThrownBy(() -> store(file).load())
                .isInstanceOf(InitializationException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void newerVersionFailsInitialization() throws IOException {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{\"version\": 2, \"completedShards\": []}");

        assertThatThrownBy(() -> store(file).load())
                .isInstanceOf(InitializationException.class)
                .hasMessageContaining("unsupported version 2");
    }

    @Test
    void unreadableCheckpointFailsInitialization() throws IOException {
        Path file = Files.createDirectory(dir.resolve("checkpoint.json"));

        assertThatThrownBy(() -> store(file).load())
                .isInstanceOf(InitializationException.class)
                .hasMessageContaining("Cannot read checkpoint");
    }

    @Test
    void persistentWriteFailureRaisesAfterRetries() throws IOException {
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");
        FileCheckpointStore store = store(blocker.resolve("checkpoint.json"));
        store.load();

        assertThatThrownBy(() -> store.commit("a.json"))
                .isInstanceOf(CheckpointWriteException.class)
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> assertThat(((CheckpointWriteException) e).getCheckpointFile())
                        .isEqualTo(blocker.resolve("checkpoint.json")));
    }

    @Test
    void renderIsStableAndSorted() {
        Checkpoint cp = new Checkpoint(List.of("b.json", "a.json"), NOW);

        String json = FileCheckpointStore.render(cp);

        assertThat(json.indexOf("a.json")).isLessThan(json.indexOf("b.json"));
        assertThat(json).contains("2026-03-01T12:00:00Z");
    }
}
