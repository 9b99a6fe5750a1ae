package com.phillippitts.dialogaugment.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkUnitTest {

    @Test
    void blankTagDefaultsToUnknown() {
        WorkUnit unit = new WorkUnit("dialogues_003.json", 4, 1, "3_0", "Hello", " ");

        assertThat(unit.tag()).isEqualTo("UNKNOWN");
        assertThat(unit.describe()).isEqualTo("dialogues_003.json#4");
    }

    @Test
    void blankPayloadRejected() {
        assertThatThrownBy(() -> new WorkUnit("a.json", 0, 0, "1_0", "  ", "USER"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcomeFactoriesSetArtifactStatus() {
        WorkUnit unit = new WorkUnit("a.json", 0, 0, "1_0", "Hi", "USER");
        Artifact artifact = new Artifact("a_0_USER_abc", Path.of("a_0_USER_abc.txt"), ArtifactStatus.PENDING);

        assertThat(UnitOutcome.created(unit, artifact, 2).artifact().status()).isEqualTo(ArtifactStatus.DONE);
        assertThat(UnitOutcome.reused(unit, artifact).attempts()).isZero();
        UnitOutcome failed = UnitOutcome.failed(unit, artifact, 3, null);
        assertThat(failed.artifact().status()).isEqualTo(ArtifactStatus.FAILED);
        assertThat(failed.failureReason()).isEqualTo("unknown");
        assertThat(failed.isSuccess()).isFalse();
    }
}
