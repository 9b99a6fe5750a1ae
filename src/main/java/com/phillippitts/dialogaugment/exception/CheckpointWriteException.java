package com.phillippitts.dialogaugment.exception;

import java.nio.file.Path;

/**
 * Fatal error raised when the checkpoint cannot be persisted after retrying.
 * The run stops because it can no longer claim progress durably.
 */
public class CheckpointWriteException extends DialogAugmentException {

    private final Path checkpointFile;

    public CheckpointWriteException(Path checkpointFile, Throwable cause) {
        super("Failed to write checkpoint " + checkpointFile + ": "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.checkpointFile = checkpointFile;
    }

    public Path getCheckpointFile() {
        return checkpointFile;
    }
}
