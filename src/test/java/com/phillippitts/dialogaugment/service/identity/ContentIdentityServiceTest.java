package com.phillippitts.dialogaugment.service.identity;

import com.phillippitts.dialogaugment.domain.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentIdentityServiceTest {

    private final ContentIdentityService identity =
            new ContentIdentityService(12, Map.of("transform", "synthesis", "model_name", "m1"));

    @Test
    void contentIdComposesShardSequenceTagAndHash() {
        String id = identity.contentId("I need a flight", "dialogues_003.json", 4, "USER");

        assertThat(id).matches("dialogues-003_4_USER_[0-9a-f]{12}");
    }

    @Test
    void identicalPayloadsShareHashPrefix() {
        String a = identity.contentId("Hello", "dialogues_001.json", 0, "USER");
        String b = identity.contentId("Hello", "dialogues_002.json", 7, "SYSTEM");

        assertThat(a.substring(a.lastIndexOf('_'))).isEqualTo(b.substring(b.lastIndexOf('_')));
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void hashIsDeterministicAcrossInstances() {
        ContentIdentityService other = new ContentIdentityService(12, Map.of("model_name", "m1", "transform", "synthesis"));

        assertThat(other.hash("Hello")).isEqualTo(identity.hash("Hello"));
    }

    @Test
    void parametersChangeTheHash() {
        ContentIdentityService otherModel = new ContentIdentityService(12, Map.of("transform", "synthesis", "model_name", "m2"));

        assertThat(otherModel.hash("Hello")).isNotEqualTo(identity.hash("Hello"));
        assertThat(identity.hash("Hello")).isNotEqualTo(identity.hash("Hello!"));
    }

    @Test
    void unsafeCharactersAreSanitized() {
        WorkUnit unit = new WorkUnit("dev set/x.y.json", 2, 0, "1_0", "Hi", "sys tem:1");

        String id = identity.contentId(unit);

        assertThat(id).startsWith("dev-set-x-y_2_sys-tem-1_");
        assertThat(id).doesNotContain(" ", "/", ":");
    }

    @Test
    void hashLengthIsConfigurable() {
        ContentIdentityService longer = new ContentIdentityService(20, Map.of());

        assertThat(longer.hash("Hi")).hasSize(20);
        assertThatThrownBy(() -> new ContentIdentityService(65, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void artifactFileNameAppendsExtension() {
        assertThat(ContentIdentityService.artifactFileName("a_0_USER_abc", "wav")).isEqualTo("a_0_USER_abc.wav");
    }
}
