package com.phillippitts.dialogaugment.service.checkpoint;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.config.properties.RetryProperties;
import com.phillippitts.dialogaugment.domain.Checkpoint;
import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.exception.InitializationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link CheckpointStore} backed by a JSON file.
 *
 * <p>Format:
 * <pre>
 * { "version": 1, "updatedAt": "2026-01-01T00:00:00Z", "completedShards": ["dialogues_001.json"] }
 * </pre>
 * A plain JSON array of shard ids is accepted on load.
 *
 * <p>Writes go to a temp file in the same directory which is then moved over the checkpoint
 * with {@link StandardCopyOption#ATOMIC_MOVE}, falling back to a replacing move where the file
 * system does not support atomic moves. A reader therefore sees either the old or the new
 * checkpoint, never a partial one. Failed writes are retried with a fixed pause through a
 * Spring Retry {@link RetryTemplate}.
 */
@Service
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LogManager.getLogger(FileCheckpointStore.class);

    static final String KEY_VERSION = "version";
    static final String KEY_UPDATED_AT = "updatedAt";
    static final String KEY_COMPLETED = "completedShards";
    private static final Duration DEFAULT_RETRY_PAUSE = Duration.ofMillis(200);

    private final Path file;
    private final int writeAttempts;
    private final RetryTemplate writeTemplate;
    private final Clock clock;
    private Checkpoint checkpoint = Checkpoint.empty();

    @Autowired
    public FileCheckpointStore(PipelineProperties pipeline, RetryProperties retry) {
        this(pipeline.checkpointPath(), retry.getCheckpointWriteAttempts(), DEFAULT_RETRY_PAUSE, Clock.systemUTC());
    }

    public FileCheckpointStore(Path file, int writeAttempts, Duration retryPause, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        if (writeAttempts < 1) {
            throw new IllegalArgumentException("writeAttempts must be >= 1");
        }
        this.writeAttempts = writeAttempts;
        this.writeTemplate = writeTemplate(writeAttempts, Objects.requireNonNull(retryPause, "retryPause"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private static RetryTemplate writeTemplate(int attempts, Duration pause) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(attempts,
                Map.<Class<? extends Throwable>, Boolean>of(IOException.class, true));
        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(pause.toMillis());
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOff);
        return template;
    }

    @Override
    public Checkpoint load() {
        if (!Files.exists(file)) {
            LOG.info("No checkpoint at {}; starting fresh", file);
            checkpoint = Checkpoint.empty();
            return checkpoint;
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InitializationException("Cannot read checkpoint " + file, e);
        }
        checkpoint = parse(json);
        LOG.info("Loaded checkpoint {}: {} completed shard(s)", file, checkpoint.size());
        return checkpoint;
    }

    Checkpoint parse(String json) {
        String trimmed = json.trim();
        try {
            if (trimmed.startsWith("[")) {
                return new Checkpoint(shardIds(new JSONArray(trimmed)), null);
            }
            JSONObject root = new JSONObject(trimmed);
            int version = root.optInt(KEY_VERSION, Checkpoint.VERSION);
            if (version > Checkpoint.VERSION) {
                throw new InitializationException("Checkpoint " + file + " has unsupported version " + version);
            }
            JSONArray completed = root.optJSONArray(KEY_COMPLETED);
            String updatedAt = root.optString(KEY_UPDATED_AT, "");
            return new Checkpoint(completed == null ? List.of() : shardIds(completed),
                    updatedAt.isEmpty() ? null : Instant.parse(updatedAt));
        } catch (JSONException | DateTimeParseException e) {
            throw new InitializationException("Checkpoint " + file + " is unreadable: " + e.getMessage(), e);
        }
    }

    private static List<String> shardIds(JSONArray array) {
        List<String> ids = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            ids.add(array.getString(i));
        }
        return ids;
    }

    @Override
    public void commit(String shardId) {
        commitAll(List.of(shardId));
    }

    @Override
    public void commitAll(Collection<String> shardIds) {
        Instant now = clock.instant();
        boolean changed = false;
        for (String shardId : shardIds) {
            changed |= checkpoint.markCompleted(shardId, now);
        }
        if (changed) {
            write();
            LOG.info("Checkpoint committed: {} (total {})", shardIds, checkpoint.size());
        }
    }

    @Override
    public void flush() {
        write();
    }

    @Override
    public Checkpoint current() {
        return checkpoint;
    }

    public Path file() {
        return file;
    }

    private void write() {
        String json = render(checkpoint);
        try {
            writeTemplate.execute(context -> {
                writeAttempt(json, context.getRetryCount() + 1);
                return null;
            });
        } catch (IOException e) {
            throw new CheckpointWriteException(file, e);
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckpointWriteException(file, e);
        }
    }

    private void writeAttempt(String json, int attempt) throws IOException {
        try {
            writeAtomically(json);
        } catch (IOException e) {
            LOG.warn("Checkpoint write attempt {}/{} failed: {}", attempt, writeAttempts, e.toString());
            throw e;
        }
    }

    static String render(Checkpoint checkpoint) {
        JSONObject root = new JSONObject();
        root.put(KEY_VERSION, Checkpoint.VERSION);
        if (checkpoint.updatedAt() != null) {
            root.put(KEY_UPDATED_AT, checkpoint.updatedAt().toString());
        }
        root.put(KEY_COMPLETED, new JSONArray(checkpoint.completedShards()));
        return root.toString(2);
    }

    private void writeAtomically(String json) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move unsupported for {}; using replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
