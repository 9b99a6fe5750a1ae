package com.phillippitts.dialogaugment.domain;

import java.util.Objects;

/**
 * Terminal result of executing one work unit.
 *
 * @param unit          the unit that was processed
 * @param artifact      artifact (DONE or FAILED; PENDING when aborted)
 * @param kind          how the unit ended
 * @param attempts      transform invocations made (0 when an existing artifact was reused)
 * @param failureReason reason for {@link Kind#FAILED} and {@link Kind#ABORTED}, otherwise null
 */
public record UnitOutcome(
        WorkUnit unit,
        Artifact artifact,
        Kind kind,
        int attempts,
        String failureReason
) {

    public enum Kind {
        /** Transform ran and the artifact was published. */
        CREATED,
        /** Artifact already existed on durable storage; transform not invoked. */
        REUSED,
        /** Permanent failure or retry budget exhausted. */
        FAILED,
        /** Stopped because the run is shutting down; not a verdict on the unit. */
        ABORTED
    }

    public UnitOutcome {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(kind, "kind");
    }

    public static UnitOutcome created(WorkUnit unit, Artifact artifact, int attempts) {
        return new UnitOutcome(unit, artifact.withStatus(ArtifactStatus.DONE), Kind.CREATED, attempts, null);
    }

    public static UnitOutcome reused(WorkUnit unit, Artifact artifact) {
        return new UnitOutcome(unit, artifact.withStatus(ArtifactStatus.DONE), Kind.REUSED, 0, null);
    }

    public static UnitOutcome failed(WorkUnit unit, Artifact artifact, int attempts, String reason) {
        return new UnitOutcome(unit, artifact.withStatus(ArtifactStatus.FAILED), Kind.FAILED, attempts,
                reason == null ? "unknown" : reason);
    }

    public static UnitOutcome aborted(WorkUnit unit, Artifact artifact, int attempts, String reason) {
        return new UnitOutcome(unit, artifact.withStatus(ArtifactStatus.PENDING), Kind.ABORTED, attempts,
                reason == null ? "aborted" : reason);
    }

    public boolean isSuccess() {
        return kind == Kind.CREATED || kind == Kind.REUSED;
    }

    public boolean isAborted() {
        return kind == Kind.ABORTED;
    }
}
