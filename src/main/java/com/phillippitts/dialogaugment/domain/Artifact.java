package com.phillippitts.dialogaugment.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Output of a work unit, identified by its content id.
 *
 * @param contentId stable identity (also the file stem on durable storage)
 * @param path      location of the artifact file
 * @param status    lifecycle state
 */
public record Artifact(String contentId, Path path, ArtifactStatus status) {

    public Artifact {
        Objects.requireNonNull(contentId, "contentId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(status, "status");
    }

    public Artifact withStatus(ArtifactStatus newStatus) {
        return new Artifact(contentId, path, newStatus);
    }
}
