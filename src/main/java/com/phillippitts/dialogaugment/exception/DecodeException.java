package com.phillippitts.dialogaugment.exception;

/**
 * Thrown when a shard document cannot be parsed.
 * The shard is skipped and reported; the run continues with the next shard.
 */
public class DecodeException extends DialogAugmentException {

    private final String shardId;

    public DecodeException(String shardId, String reason) {
        super("Cannot decode shard " + shardId + ": " + reason);
        this.shardId = shardId;
    }

    public DecodeException(String shardId, String reason, Throwable cause) {
        super("Cannot decode shard " + shardId + ": " + reason, cause);
        this.shardId = shardId;
    }

    public String getShardId() {
        return shardId;
    }
}
