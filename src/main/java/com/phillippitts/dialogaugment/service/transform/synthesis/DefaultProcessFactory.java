package com.phillippitts.dialogaugment.service.transform.synthesis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // Both streams are gobbled separately
        pb.redirectErrorStream(false);
        Process process = pb.start();
        // The TTS tool takes its text from the command line, never from stdin
        process.getOutputStream().close();
        return process;
    }
}
