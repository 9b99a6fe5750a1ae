package com.phillippitts.dialogaugment.service.enumerate;

import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed shard: the raw JSON tree plus its groups in document order.
 *
 * <p>The tree is kept so the shard can be rewritten with transformed text later; {@link Turn}
 * nodes are the live JSON objects of that tree.
 */
public final class ShardDocument {

    public static final String GROUP_ID_FIELD = "dialogue_id";
    public static final String TURNS_FIELD = "turns";
    public static final String SPEAKER_FIELD = "speaker";
    public static final String UTTERANCE_FIELD = "utterance";

    private final String shardId;
    private final Path source;
    private final JSONArray root;
    private final List<DialogueGroup> groups;

    ShardDocument(String shardId, Path source, JSONArray root, List<DialogueGroup> groups) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.source = source;
        this.root = Objects.requireNonNull(root, "root");
        this.groups = List.copyOf(groups);
    }

    public String shardId() {
        return shardId;
    }

    public Path source() {
        return source;
    }

    public JSONArray root() {
        return root;
    }

    public List<DialogueGroup> groups() {
        return groups;
    }

    /**
     * Every turn of the document in order, the position in this list being the turn's
     * sequence index.
     */
    public List<Turn> allTurns() {
        List<Turn> turns = new ArrayList<>();
        for (DialogueGroup group : groups) {
            turns.addAll(group.turns());
        }
        return Collections.unmodifiableList(turns);
    }

    /**
     * One dialogue.
     *
     * @param groupId {@code dialogue_id}, or null when missing
     * @param turns   turns in order
     */
    public record DialogueGroup(String groupId, List<Turn> turns) {
        public DialogueGroup {
            turns = List.copyOf(turns);
        }
    }

    /**
     * One turn.
     *
     * @param sequenceIndex position among all turns of the shard
     * @param turnIndex     position within the group
     * @param speaker       speaker role, may be null
     * @param utterance     raw utterance, may be null if missing or not a string
     * @param node          the JSON object of the turn in {@link #root()}
     */
    public record Turn(int sequenceIndex, int turnIndex, String speaker, String utterance, JSONObject node) {
    }
}
