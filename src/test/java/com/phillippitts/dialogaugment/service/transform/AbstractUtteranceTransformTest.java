package com.phillippitts.dialogaugment.service.transform;

import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.exception.TransformClosedException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import com.phillippitts.dialogaugment.testutil.FakeTransform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractUtteranceTransformTest {

    @TempDir
    Path dir;

    @Test
    void initializeRunsOnceUnderConcurrency() throws Exception {
        FakeTransform transform = new FakeTransform();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(transform::initialize));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(transform.initCalls()).isEqualTo(1);
        assertThat(transform.isHealthy()).isTrue();
    }

    @Test
    void failedInitializationCanBeRetried() {
        FakeTransform transform = new FakeTransform()
                .failInitialization(new TransientTransformException("busy", FakeTransform.NAME));

        assertThatThrownBy(transform::initialize).isInstanceOf(TransientTransformException.class);
        assertThat(transform.isHealthy()).isFalse();

        transform.initialize();
        assertThat(transform.isHealthy()).isTrue();
    }

    @Test
    void closedTransformRejectsUse() {
        FakeTransform transform = new FakeTransform();
        transform.initialize();

        transform.close();
        transform.close();

        assertThat(transform.isHealthy()).isFalse();
        assertThat(transform.isClosed()).isTrue();
        assertThatThrownBy(transform::initialize)
                .isInstanceOf(TransformClosedException.class)
                .hasMessageContaining("already closed");
        assertThatThrownBy(() -> transform.apply("x", dir.resolve("x.txt")))
                .isInstanceOf(TransformClosedException.class);
    }

    @Test
    void applyBeforeInitializeIsPermanentButNotClosed() {
        FakeTransform transform = new FakeTransform();

        assertThat(transform.isClosed()).isFalse();
        assertThatThrownBy(() -> transform.apply("x", dir.resolve("x.txt")))
                .isInstanceOf(PermanentTransformException.class)
                .isNotInstanceOf(TransformClosedException.class)
                .hasMessageContaining("not initialized");
    }
}
