package com.phillippitts.dialogaugment.testutil;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds shard documents for tests.
 */
public final class ShardFixtures {

    private ShardFixtures() {
    }

    /**
     * A dialogue whose turns alternate USER and SYSTEM speakers. A null utterance produces a
     * turn without the field.
     */
    public static JSONObject group(String dialogueId, String... utterances) {
        JSONArray turns = new JSONArray();
        for (int i = 0; i < utterances.length; i++) {
            JSONObject turn = new JSONObject().put("speaker", i % 2 == 0 ? "USER" : "SYSTEM");
            if (utterances[i] != null) {
                turn.put("utterance", utterances[i]);
            }
            turns.put(turn);
        }
        JSONObject group = new JSONObject().put("turns", turns);
        if (dialogueId != null) {
            group.put("dialogue_id", dialogueId);
        }
        return group;
    }

    public static Path write(Path dir, String shardName, JSONObject... groups) throws IOException {
        JSONArray root = new JSONArray();
        for (JSONObject g : groups) {
            root.put(g);
        }
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(shardName), root.toString(2), StandardCharsets.UTF_8);
    }

    public static Path writeRaw(Path dir, String shardName, String content) throws IOException {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(shardName), content, StandardCharsets.UTF_8);
    }
}
