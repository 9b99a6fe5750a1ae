package com.phillippitts.dialogaugment.service.pipeline;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.RunSummary;
import com.phillippitts.dialogaugment.service.scheduling.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pipeline once when the application starts.
 *
 * <p>A JVM shutdown hook (SIGINT/SIGTERM) requests cancellation and waits up to
 * {@code augment.pipeline.shutdown-grace} for the in-flight batch to drain and the checkpoint
 * to be flushed, then closes the application context. Spring's own shutdown hook is disabled
 * ({@code spring.main.register-shutdown-hook=false}) so the transform is not destroyed while
 * units are still running. Disable with {@code augment.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "augment.runner.enabled", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    private final PipelineDriver driver;
    private final PipelineProperties props;
    private final ConfigurableApplicationContext context;

    public PipelineRunner(PipelineDriver driver, PipelineProperties props, ConfigurableApplicationContext context) {
        this.driver = driver;
        this.props = props;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        CancellationToken cancel = new CancellationToken();
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> onShutdown(cancel, done), "augment-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunSummary summary = driver.run(cancel);
            if (summary.totalFailed() > 0) {
                LOG.warn("{} unit(s) failed; rerun to retry them", summary.totalFailed());
            }
            if (summary.totalAborted() > 0) {
                LOG.warn("{} unit(s) aborted by shutdown; their shards run again next time", summary.totalAborted());
            }
        } finally {
            done.countDown();
            removeHook(hook);
        }
    }

    /**
     * Cancels the run, waits for it to drain, and only then closes the context.
     */
    void onShutdown(CancellationToken cancel, CountDownLatch done) {
        try {
            awaitDrain(cancel, done);
        } finally {
            context.close();
        }
    }

    private void awaitDrain(CancellationToken cancel, CountDownLatch done) {
        if (done.getCount() == 0) {
            return;
        }
        if (cancel.cancel()) {
            LOG.warn("Shutdown requested; finishing in-flight batch (grace {} s)",
                    props.getShutdownGrace().toSeconds());
        }
        try {
            if (!done.await(props.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.error("Run did not drain within {} s; exiting with work in flight",
                        props.getShutdownGrace().toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down; hook stays registered");
        }
    }
}
