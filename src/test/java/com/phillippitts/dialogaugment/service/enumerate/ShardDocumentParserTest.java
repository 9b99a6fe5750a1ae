package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.exception.DecodeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardDocumentParserTest {

    private final ShardDocumentParser parser = new ShardDocumentParser();

    @Test
    void sequenceIndexesSpanGroups() {
        String json = """
                [
                  {"dialogue_id": "1_0", "turns": [
                    {"speaker": "USER", "utterance": "Hi"},
                    {"speaker": "SYSTEM", "utterance": "Hello"}]},
                  {"turns": [{"speaker": "USER", "utterance": "orphan"}]},
                  {"dialogue_id": "1_1", "turns": [{"speaker": "USER"}]}
                ]
                """;

        ShardDocument doc = parser.parse("dialogues_001.json", null, json);

        assertThat(doc.groups()).hasSize(3);
        assertThat(doc.allTurns()).extracting(ShardDocument.Turn::sequenceIndex).containsExactly(0, 1, 2, 3);
        assertThat(doc.groups().get(1).groupId()).isNull();
        ShardDocument.Turn last = doc.groups().get(2).turns().get(0);
        assertThat(last.turnIndex()).isZero();
        assertThat(last.utterance()).isNull();
    }

    @Test
    void nonObjectEntriesAreIgnored() {
        ShardDocument doc = parser.parse("s.json", null,
                "[1, \"x\", {\"dialogue_id\": \"1_0\", \"turns\": [\"bad\", {\"utterance\": \"ok\"}]}]");

        assertThat(doc.groups()).hasSize(1);
        assertThat(doc.allTurns()).singleElement()
                .satisfies(t -> {
                    assertThat(t.utterance()).isEqualTo("ok");
                    assertThat(t.sequenceIndex()).isZero();
                });
    }

    @Test
    void nonStringUtteranceIsTreatedAsMissing() {
        ShardDocument doc = parser.parse("s.json", null,
                "[{\"dialogue_id\": 7, \"turns\": [{\"utterance\": 42}]}]");

        assertThat(doc.groups().get(0).groupId()).isEqualTo("7");
        assertThat(doc.allTurns().get(0).utterance()).isNull();
    }

    @Test
    void turnNodesAreLiveViewsOfTheTree() {
        ShardDocument doc = parser.parse("s.json", null,
                "[{\"dialogue_id\": \"1_0\", \"turns\": [{\"utterance\": \"a\"}]}]");

        doc.allTurns().get(0).node().put("utterance", "b");

        assertThat(doc.root().getJSONObject(0).getJSONArray("turns").getJSONObject(0).getString("utterance"))
                .isEqualTo("b");
    }

    @Test
    void malformedJsonRaisesDecodeException() {
        assertThatThrownBy(() -> parser.parse("bad.json", null, "{not an array"))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("bad.json");
    }

    @Test
    void unreadableFileRaisesDecodeException(@TempDir Path dir) {
        assertThatThrownBy(() -> parser.parse(dir.resolve("missing.json")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("unreadable");
    }
}
