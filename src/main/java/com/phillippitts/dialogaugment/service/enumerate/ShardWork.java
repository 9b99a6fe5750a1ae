package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.domain.WorkUnit;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything the enumerator produced for one shard.
 *
 * @param shardId        shard file name
 * @param source         shard file
 * @param document       parsed document, null when decoding failed
 * @param units          admitted work units in sequence order
 * @param skipped        turns of admitted groups that failed validation, and groups without id
 * @param groupsAdmitted groups counted against the budget
 * @param truncated      true if the budget refused a group of this shard
 * @param decodeError    reason the shard could not be decoded, otherwise null
 */
public record ShardWork(
        String shardId,
        Path source,
        ShardDocument document,
        List<WorkUnit> units,
        List<SkippedTurn> skipped,
        int groupsAdmitted,
        boolean truncated,
        String decodeError
) {

    /**
     * A turn or group that produced no work unit.
     *
     * @param sequenceIndex sequence index of the turn, or -1 for a whole group
     * @param groupId       group id, may be null
     * @param reason        why it was skipped
     */
    public record SkippedTurn(int sequenceIndex, String groupId, String reason) {
    }

    public ShardWork {
        Objects.requireNonNull(shardId, "shardId");
        units = List.copyOf(units);
        skipped = List.copyOf(skipped);
    }

    static ShardWork decodeFailed(String shardId, Path source, String reason) {
        return new ShardWork(shardId, source, null, List.of(), List.of(), 0, false, reason);
    }

    public boolean isDecodeFailed() {
        return decodeError != null;
    }

    /**
     * True if the shard may be checkpointed once all its units are terminal: it was decoded
     * and fully enumerated.
     */
    public boolean isCommittable() {
        return !isDecodeFailed() && !truncated;
    }
}
