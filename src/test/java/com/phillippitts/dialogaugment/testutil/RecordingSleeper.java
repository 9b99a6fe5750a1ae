package com.phillippitts.dialogaugment.testutil;

import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backoff sleeper that records requested delays instead of waiting.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private volatile boolean interruptNext;

    @Override
    public void sleep(long backOffPeriod) throws InterruptedException {
        delays.add(Duration.ofMillis(backOffPeriod));
        if (interruptNext) {
            interruptNext = false;
            throw new InterruptedException("test interrupt");
        }
    }

    public void interruptNextSleep() {
        this.interruptNext = true;
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
