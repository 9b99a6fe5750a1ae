package com.phillippitts.dialogaugment.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable record of which shards have been fully processed.
 *
 * <p>Not thread-safe: only the scheduler thread mutates it.
 */
public final class Checkpoint {

    /** Schema version written to disk. */
    public static final int VERSION = 1;

    private final Set<String> completedShards;
    private Instant updatedAt;

    public Checkpoint(Collection<String> completedShards, Instant updatedAt) {
        this.completedShards = new TreeSet<>(completedShards);
        this.updatedAt = updatedAt;
    }

    public static Checkpoint empty() {
        return new Checkpoint(Set.of(), null);
    }

    public boolean isCompleted(String shardId) {
        return completedShards.contains(shardId);
    }

    /**
     * Marks a shard complete.
     *
     * @return true if the shard was not already complete
     */
    public boolean markCompleted(String shardId, Instant at) {
        boolean added = completedShards.add(shardId);
        if (added) {
            updatedAt = at;
        }
        return added;
    }

    public Set<String> completedShards() {
        return Collections.unmodifiableSet(completedShards);
    }

    /** Last modification time, or null for a checkpoint that was never written. */
    public Instant updatedAt() {
        return updatedAt;
    }

    public int size() {
        return completedShards.size();
    }
}
