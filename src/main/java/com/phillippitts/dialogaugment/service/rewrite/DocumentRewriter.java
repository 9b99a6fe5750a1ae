package com.phillippitts.dialogaugment.service.rewrite;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.UnitOutcome;
import com.phillippitts.dialogaugment.service.enumerate.ShardDocument;
import com.phillippitts.dialogaugment.service.enumerate.ShardWork;
import com.phillippitts.dialogaugment.service.execution.ArtifactStore;
import com.phillippitts.dialogaugment.service.transform.UtteranceTransform;
import com.phillippitts.dialogaugment.service.transform.UtteranceTransform.RewriteMode;
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
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Writes a copy of a completed shard with the transformed text of every successful unit
 * substituted back, for text transforms.
 *
 * <p>The copy lands in {@code <output-dir>/documents/<shard file>}. Turns whose unit failed or
 * was skipped keep their original content. The write is atomic (temp file then move).
 */
@Component
public class DocumentRewriter {

    private static final Logger LOG = LogManager.getLogger(DocumentRewriter.class);

    static final String DOCUMENT_DIR = "documents";

    private final Path documentDir;
    private final RewriteMode mode;
    private final String field;
    private final ArtifactStore store;

    @Autowired
    public DocumentRewriter(PipelineProperties props, UtteranceTransform transform, ArtifactStore store) {
        this(props.outputPath().resolve(DOCUMENT_DIR), transform.rewriteMode(), transform.rewriteField(), store);
    }

    public DocumentRewriter(Path documentDir, RewriteMode mode, String field, ArtifactStore store) {
        this.documentDir = Objects.requireNonNull(documentDir, "documentDir");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.field = Objects.requireNonNull(field, "field");
        this.store = Objects.requireNonNull(store, "store");
    }

    public boolean isEnabled() {
        return mode != RewriteMode.NONE;
    }

    /**
     * Rewrites a shard.
     *
     * @param work     the fully enumerated shard
     * @param outcomes terminal outcomes of all its units
     * @return the written document
     * @throws IOException if an artifact cannot be read or the document cannot be written
     */
    public Path rewrite(ShardWork work, Collection<UnitOutcome> outcomes) throws IOException {
        if (!isEnabled()) {
            throw new IllegalStateException("Rewriting disabled for mode " + mode);
        }
        ShardDocument document = Objects.requireNonNull(work.document(), "document");
        List<ShardDocument.Turn> turns = document.allTurns();
        int replaced = 0;
        for (UnitOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                continue;
            }
            String text = store.readText(outcome.artifact());
            ShardDocument.Turn turn = turns.get(outcome.unit().sequenceIndex());
            turn.node().put(field, text);
            replaced++;
        }

        Files.createDirectories(documentDir);
        Path target = documentDir.resolve(work.shardId());
        Path tmp = Files.createTempFile(documentDir, "." + work.shardId() + "-", ".tmp");
        try {
            Files.writeString(tmp, document.root().toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Rewrote {} ({} turn(s) updated, mode={}, field={})", target, replaced, mode, field);
        return target;
    }
}
