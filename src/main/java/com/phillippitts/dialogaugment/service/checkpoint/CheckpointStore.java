package com.phillippitts.dialogaugment.service.checkpoint;

import com.phillippitts.dialogaugment.domain.Checkpoint;
import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.exception.InitializationException;

import java.util.Collection;

/**
 * Durable set of completed shards.
 *
 * <p>Implementations persist on every commit; a commit that returns normally survives a crash.
 * Only the scheduler thread calls these methods.
 */
public interface CheckpointStore {

    /**
     * Reads the checkpoint, or returns an empty one if none exists yet.
     *
     * @throws InitializationException if a checkpoint exists but cannot be read
     */
    Checkpoint load();

    /**
     * Marks one shard completed and persists.
     *
     * @throws CheckpointWriteException if persisting fails after retrying
     */
    void commit(String shardId);

    /**
     * Marks several shards completed with a single write.
     *
     * @throws CheckpointWriteException if persisting fails after retrying
     */
    void commitAll(Collection<String> shardIds);

    /** Writes the current state again, e.g. at shutdown. */
    void flush();

    /** In-memory view of the last loaded or committed state. */
    Checkpoint current();
}
