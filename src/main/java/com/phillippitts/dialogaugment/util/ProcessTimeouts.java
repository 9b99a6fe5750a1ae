package com.phillippitts.dialogaugment.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and stream gobbler management.
 *
 * <p>Used by {@link com.phillippitts.dialogaugment.service.transform.synthesis.SynthesisProcessManager}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Time for gobbler threads to flush buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemons. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
