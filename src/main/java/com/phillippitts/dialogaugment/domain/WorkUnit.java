package com.phillippitts.dialogaugment.domain;

import java.util.Objects;

/**
 * One utterance awaiting transformation.
 *
 * @param shardId       source document the unit came from (shard file name)
 * @param sequenceIndex zero-based position of the turn within its shard, counting every turn
 *                      in document order so indexes stay stable when some turns are invalid
 * @param turnIndex     zero-based position of the turn within its group
 * @param groupId       dialogue the unit belongs to
 * @param payload       trimmed utterance text
 * @param tag           speaker role, carried through to the artifact name
 */
public record WorkUnit(
        String shardId,
        int sequenceIndex,
        int turnIndex,
        String groupId,
        String payload,
        String tag
) {
    public WorkUnit {
        Objects.requireNonNull(shardId, "shardId");
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(payload, "payload");
        if (payload.isBlank()) {
            throw new IllegalArgumentException("payload must not be blank");
        }
        if (sequenceIndex < 0 || turnIndex < 0) {
            throw new IllegalArgumentException("indexes must be >= 0");
        }
        tag = tag == null || tag.isBlank() ? "UNKNOWN" : tag;
    }

    /**
     * Returns a compact identifier for logs, e.g. {@code dialogues_003.json#4}.
     */
    public String describe() {
        return shardId + "#" + sequenceIndex;
    }
}
