package com.phillippitts.dialogaugment.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointTest {

    @Test
    void markCompletedIsIdempotent() {
        Checkpoint cp = Checkpoint.empty();
        Instant t1 = Instant.parse("2026-01-01T00:00:00Z");
        Instant t2 = Instant.parse("2026-01-02T00:00:00Z");

        assertThat(cp.markCompleted("dialogues_001.json", t1)).isTrue();
        assertThat(cp.markCompleted("dialogues_001.json", t2)).isFalse();

        assertThat(cp.size()).isEqualTo(1);
        assertThat(cp.updatedAt()).isEqualTo(t1);
        assertThat(cp.isCompleted("dialogues_001.json")).isTrue();
    }

    @Test
    void completedShardsAreSortedAndReadOnly() {
        Checkpoint cp = new Checkpoint(List.of("b.json", "a.json"), null);

        assertThat(cp.completedShards()).containsExactly("a.json", "b.json");
        assertThatThrownBy(() -> cp.completedShards().add("c.json"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
