package com.phillippitts.dialogaugment.testutil;

import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import com.phillippitts.dialogaugment.service.transform.AbstractUtteranceTransform;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory transform for pipeline tests.
 *
 * <p>Writes {@code "FAKE:" + payload} as a text artifact. Failures can be scripted per payload
 * and for initialization. Thread-safe.
 */
public class FakeTransform extends AbstractUtteranceTransform {

    public static final String NAME = "fake";

    private final Map<String, Deque<RuntimeException>> scripted = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callsByPayload = new ConcurrentHashMap<>();
    private final Deque<RuntimeException> initFailures = new ArrayDeque<>();
    private final AtomicInteger applyCalls = new AtomicInteger();
    private final AtomicInteger initCalls = new AtomicInteger();
    private final RewriteMode mode;
    private volatile long applyDelayMillis;
    private volatile String closeOnPayload;
    private volatile boolean failWhenClosing;

    public FakeTransform() {
        this(RewriteMode.NONE);
    }

    public FakeTransform(RewriteMode mode) {
        this.mode = mode;
    }

    /** Next {@code times} calls for {@code payload} fail transiently. */
    public FakeTransform failTransiently(String payload, int times) {
        Deque<RuntimeException> queue = scripted.computeIfAbsent(payload, p -> new ArrayDeque<>());
        synchronized (queue) {
            for (int i = 0; i < times; i++) {
                queue.add(new TransientTransformException("simulated outage", NAME));
            }
        }
        return this;
    }

    /** Next call for {@code payload} fails permanently. */
    public FakeTransform failPermanently(String payload) {
        Deque<RuntimeException> queue = scripted.computeIfAbsent(payload, p -> new ArrayDeque<>());
        synchronized (queue) {
            queue.add(new PermanentTransformException("simulated rejection", NAME));
        }
        return this;
    }

    public FakeTransform failInitialization(RuntimeException... failures) {
        synchronized (initFailures) {
            for (RuntimeException f : failures) {
                initFailures.add(f);
            }
        }
        return this;
    }

    /**
     * Closes this transform while applying {@code payload}, as a context shutdown would.
     *
     * @param fail whether that call then fails transiently (backend killed) or completes
     */
    public FakeTransform closeWhileApplying(String payload, boolean fail) {
        this.closeOnPayload = payload;
        this.failWhenClosing = fail;
        return this;
    }

    public FakeTransform withApplyDelay(long millis) {
        this.applyDelayMillis = millis;
        return this;
    }

    @Override
    protected void doInitialize() {
        initCalls.incrementAndGet();
        RuntimeException failure;
        synchronized (initFailures) {
            failure = initFailures.poll();
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void apply(String payload, Path target) {
        ensureInitialized();
        applyCalls.incrementAndGet();
        callsByPayload.computeIfAbsent(payload, p -> new AtomicInteger()).incrementAndGet();
        if (applyDelayMillis > 0) {
            try {
                Thread.sleep(applyDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (payload.equals(closeOnPayload)) {
            close();
            if (failWhenClosing) {
                throw new TransientTransformException("backend killed", NAME);
            }
        }
        Deque<RuntimeException> queue = scripted.get(payload);
        if (queue != null) {
            RuntimeException failure;
            synchronized (queue) {
                failure = queue.poll();
            }
            if (failure != null) {
                throw failure;
            }
        }
        try {
            Files.writeString(target, "FAKE:" + payload, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    protected void doClose() {
        // nothing to release
    }

    @Override
    public String getTransformName() {
        return NAME;
    }

    @Override
    public String artifactExtension() {
        return "txt";
    }

    @Override
    public Map<String, String> parameters() {
        return Map.of("transform", NAME);
    }

    @Override
    public RewriteMode rewriteMode() {
        return mode;
    }

    public int applyCalls() {
        return applyCalls.get();
    }

    public int initCalls() {
        return initCalls.get();
    }

    public int callsFor(String payload) {
        AtomicInteger count = callsByPayload.get(payload);
        return count == null ? 0 : count.get();
    }
}
