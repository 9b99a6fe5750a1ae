package com.phillippitts.dialogaugment.service.execution;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.Artifact;
import com.phillippitts.dialogaugment.domain.ArtifactStatus;
import com.phillippitts.dialogaugment.service.identity.ContentIdentityService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Artifact files under {@code <output-dir>/artifacts}.
 *
 * <p>A final artifact file only ever appears through {@link #publish(Path, Artifact)}, which moves
 * a completed temp file into place. Existence of the final file therefore means the transform
 * succeeded for that content id.
 */
@Component
public class ArtifactStore {

    private static final Logger LOG = LogManager.getLogger(ArtifactStore.class);

    static final String ARTIFACT_DIR = "artifacts";
    static final String TEMP_MARKER = ".part";

    private final Path root;

    @Autowired
    public ArtifactStore(PipelineProperties props) {
        this(props.outputPath().resolve(ARTIFACT_DIR));
    }

    public ArtifactStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    public Artifact resolve(String contentId, String extension) {
        return new Artifact(contentId, root.resolve(ContentIdentityService.artifactFileName(contentId, extension)),
                ArtifactStatus.PENDING);
    }

    public boolean exists(Artifact artifact) {
        return Files.isRegularFile(artifact.path());
    }

    /**
     * Creates an empty temp file next to the artifact, keeping its extension.
     */
    public Path newTempFile(Artifact artifact) throws IOException {
        Files.createDirectories(root);
        String name = artifact.path().getFileName().toString();
        int dot = name.lastIndexOf('.');
        String suffix = TEMP_MARKER + (dot >= 0 ? name.substring(dot) : "");
        return Files.createTempFile(root, "." + artifact.contentId() + "-", suffix);
    }

    /**
     * Moves a finished temp file to the artifact's final name.
     */
    public void publish(Path tempFile, Artifact artifact) throws IOException {
        try {
            Files.move(tempFile, artifact.path(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, artifact.path(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes a temp file left by a failed attempt. Failure is logged, not thrown.
     */
    public void discard(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", tempFile, e.toString());
        }
    }

    public String readText(Artifact artifact) throws IOException {
        return Files.readString(artifact.path(), StandardCharsets.UTF_8);
    }

    /**
     * Removes temp files left behind by an interrupted earlier run.
     *
     * @return number of files removed
     */
    public int purgeStaleTempFiles() {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> files = Files.list(root)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                String name = p.getFileName().toString();
                if (name.startsWith(".") && name.contains(TEMP_MARKER)) {
                    discard(p);
                    removed++;
                }
            }
        } catch (IOException e) {
            LOG.warn("Could not scan {} for stale temp files: {}", root, e.toString());
        }
        if (removed > 0) {
            LOG.info("Removed {} stale temp file(s) from {}", removed, root);
        }
        return removed;
    }
}
