package com.phillippitts.dialogaugment.config;

import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.exception.InitializationException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Maps fatal pipeline errors to process exit codes. Unit failures never reach here.
 */
@Configuration
public class ExitCodeConfig {

    public static final int EXIT_INITIALIZATION_FAILED = 2;
    public static final int EXIT_CHECKPOINT_WRITE_FAILED = 3;

    @Bean
    public ExitCodeExceptionMapper pipelineExitCodeMapper() {
        return ExitCodeConfig::exitCodeFor;
    }

    static int exitCodeFor(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InitializationException) {
                return EXIT_INITIALIZATION_FAILED;
            }
            if (current instanceof CheckpointWriteException) {
                return EXIT_CHECKPOINT_WRITE_FAILED;
            }
            current = current.getCause();
        }
        return 1;
    }
}
