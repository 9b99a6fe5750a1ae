package com.phillippitts.dialogaugment.domain;

/**
 * Lifecycle of an artifact. {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum ArtifactStatus {
    PENDING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
