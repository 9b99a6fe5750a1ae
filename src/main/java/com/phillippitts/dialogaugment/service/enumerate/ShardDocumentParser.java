package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.exception.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses shard documents: a JSON array of {@code {"dialogue_id", "turns": [{"speaker", "utterance"}]}}.
 *
 * <p>Only the structure the pipeline needs is checked. Entries that are not objects, and
 * turns lists that are missing, are tolerated and simply contribute no turns.
 */
@Component
public class ShardDocumentParser {

    private static final Logger LOG = LogManager.getLogger(ShardDocumentParser.class);

    /**
     * Reads and parses a shard file.
     *
     * @throws DecodeException if the file cannot be read or is not a JSON array
     */
    public ShardDocument parse(Path file) {
        String shardId = file.getFileName().toString();
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DecodeException(shardId, "unreadable: " + e.getMessage(), e);
        }
        return parse(shardId, file, json);
    }

    ShardDocument parse(String shardId, Path source, String json) {
        JSONArray root;
        try {
            root = new JSONArray(json);
        } catch (JSONException e) {
            throw new DecodeException(shardId, e.getMessage(), e);
        }

        List<ShardDocument.DialogueGroup> groups = new ArrayList<>();
        int sequence = 0;
        for (int g = 0; g < root.length(); g++) {
            JSONObject group = root.optJSONObject(g);
            if (group == null) {
                LOG.debug("Shard {} entry {} is not an object; ignored", shardId, g);
                continue;
            }
            String groupId = textOrNull(group, ShardDocument.GROUP_ID_FIELD);
            List<ShardDocument.Turn> turns = new ArrayList<>();
            JSONArray rawTurns = group.optJSONArray(ShardDocument.TURNS_FIELD);
            if (rawTurns != null) {
                for (int t = 0; t < rawTurns.length(); t++) {
                    JSONObject turn = rawTurns.optJSONObject(t);
                    if (turn == null) {
                        continue;
                    }
                    Object utterance = turn.opt(ShardDocument.UTTERANCE_FIELD);
                    turns.add(new ShardDocument.Turn(
                            sequence++,
                            turns.size(),
                            textOrNull(turn, ShardDocument.SPEAKER_FIELD),
                            utterance instanceof String s ? s : null,
                            turn));
                }
            }
            groups.add(new ShardDocument.DialogueGroup(groupId, turns));
        }
        return new ShardDocument(shardId, source, root, groups);
    }

    private static String textOrNull(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value == null || value == JSONObject.NULL) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
