package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.WorkUnit;
import com.phillippitts.dialogaugment.exception.DecodeException;
import com.phillippitts.dialogaugment.exception.InitializationException;
import com.phillippitts.dialogaugment.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns a directory of shard documents into work units, one shard at a time.
 *
 * <p>Shards ({@code *.json}, sorted by file name) already in the completed set are skipped
 * without being read. For every other shard the groups are visited in document order:
 * <ul>
 *   <li>a group without {@code dialogue_id} is skipped</li>
 *   <li>turns failing {@link PayloadValidator} are recorded as skipped</li>
 *   <li>a group with at least one valid turn must be admitted by the {@link GroupBudget};
 *       if it is refused the shard is marked truncated and its enumeration stops</li>
 * </ul>
 * A shard that cannot be decoded is reported as such and enumeration moves on.
 */
@Service
public class WorkUnitEnumerator {

    private static final Logger LOG = LogManager.getLogger(WorkUnitEnumerator.class);

    static final String SHARD_SUFFIX = ".json";

    private final ShardDocumentParser parser;
    private final PayloadValidator validator;

    @Autowired
    public WorkUnitEnumerator(ShardDocumentParser parser, PipelineProperties props) {
        this(parser, new PayloadValidator(props.getMaxPayloadLength()));
    }

    WorkUnitEnumerator(ShardDocumentParser parser, PayloadValidator validator) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Lazily enumerates the pending shards of {@code inputDir}.
     *
     * <p>The returned iterator reads a shard only when {@link Iterator#next()} is called and
     * mutates {@code budget}; it must be consumed by a single thread.
     *
     * @throws InitializationException if the input directory cannot be listed
     */
    public Iterator<ShardWork> enumerate(Path inputDir, Set<String> completedShards, GroupBudget budget) {
        List<Path> pending = new ArrayList<>();
        for (Path shard : listShards(inputDir)) {
            String shardId = shard.getFileName().toString();
            if (completedShards.contains(shardId)) {
                LOG.debug("Shard {} already completed; skipping", shardId);
                continue;
            }
            pending.add(shard);
        }
        LOG.info("Found {} pending shard(s) in {} ({} already completed)",
                pending.size(), inputDir, completedShards.size());
        return new ShardIterator(pending, budget);
    }

    /**
     * Shard files of a directory in name order.
     */
    public List<Path> listShards(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new InitializationException("Input directory not found: " + inputDir.toAbsolutePath());
        }
        try (Stream<Path> files = Files.list(inputDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SHARD_SUFFIX))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new InitializationException("Cannot list input directory: " + inputDir, e);
        }
    }

    /**
     * Enumerates a single shard against the budget.
     */
    ShardWork enumerateShard(Path file, GroupBudget budget) {
        String shardId = file.getFileName().toString();
        ShardDocument document;
        try {
            document = parser.parse(file);
        } catch (DecodeException e) {
            LOG.error("Skipping shard {}: {}", shardId, e.getMessage());
            return ShardWork.decodeFailed(shardId, file, e.getMessage());
        }

        budget.startShard();
        OptionalInt hint = ShardFileNames.hint(shardId);
        List<WorkUnit> units = new ArrayList<>();
        List<ShardWork.SkippedTurn> skipped = new ArrayList<>();
        int admitted = 0;
        boolean truncated = false;

        for (ShardDocument.DialogueGroup group : document.groups()) {
            if (group.groupId() == null) {
                LOG.warn("Shard {}: group without {} skipped ({} turn(s))",
                        shardId, ShardDocument.GROUP_ID_FIELD, group.turns().size());
                skipped.add(new ShardWork.SkippedTurn(-1, null, "missing " + ShardDocument.GROUP_ID_FIELD));
                continue;
            }
            checkHint(shardId, hint, group.groupId());

            List<WorkUnit> groupUnits = new ArrayList<>();
            List<ShardWork.SkippedTurn> groupSkipped = new ArrayList<>();
            for (ShardDocument.Turn turn : group.turns()) {
                try {
                    String payload = validator.validate(turn.utterance());
                    groupUnits.add(new WorkUnit(shardId, turn.sequenceIndex(), turn.turnIndex(),
                            group.groupId(), payload, turn.speaker()));
                } catch (ValidationException e) {
                    groupSkipped.add(new ShardWork.SkippedTurn(turn.sequenceIndex(), group.groupId(), e.getReason()));
                }
            }
            skipped.addAll(groupSkipped);
            if (groupUnits.isEmpty()) {
                LOG.debug("Shard {}: group {} has no valid turns; not counted", shardId, group.groupId());
                continue;
            }
            if (!budget.tryAdmit()) {
                truncated = true;
                LOG.info("Shard {}: group budget of {} reached at group {}; shard truncated",
                        shardId, budget.maxGroups(), group.groupId());
                break;
            }
            admitted++;
            units.addAll(groupUnits);
        }

        LOG.info("Shard {}: {} unit(s) from {} group(s), {} skipped{}",
                shardId, units.size(), admitted, skipped.size(), truncated ? ", truncated" : "");
        return new ShardWork(shardId, file, document, units, skipped, admitted, truncated, null);
    }

    private static void checkHint(String shardId, OptionalInt hint, String groupId) {
        if (hint.isEmpty()) {
            return;
        }
        OptionalInt number = ShardFileNames.groupNumber(groupId);
        if (number.isPresent() && number.getAsInt() != hint.getAsInt()) {
            LOG.warn("Shard {}: group id {} does not match file number {}", shardId, groupId, hint.getAsInt());
        }
    }

    private final class ShardIterator implements Iterator<ShardWork> {

        private final Deque<Path> pending;
        private final GroupBudget budget;

        ShardIterator(Collection<Path> pending, GroupBudget budget) {
            this.pending = new ArrayDeque<>(pending);
            this.budget = Objects.requireNonNull(budget, "budget");
        }

        @Override
        public boolean hasNext() {
            if (!pending.isEmpty() && budget.stopsRun()) {
                LOG.info("Group budget exhausted; {} shard(s) left for a later run", pending.size());
                pending.clear();
            }
            return !pending.isEmpty();
        }

        @Override
        public ShardWork next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return enumerateShard(pending.removeFirst(), budget);
        }
    }
}
