package com.phillippitts.dialogaugment.service.transform.synthesis;

import com.phillippitts.dialogaugment.config.transform.SynthesisConfig;
import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.service.transform.AbstractUtteranceTransform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Text-to-speech transform backed by an external TTS command line tool (Coqui TTS style).
 *
 * <p>Initialization validates that the configured binary exists and is executable; a missing
 * binary is a permanent failure. Each {@link #apply(String, Path)} starts one process through
 * {@link SynthesisProcessManager}; timeouts, non-zero exits and missing output are transient.
 *
 * <p><b>Privacy:</b> utterance text is never logged above DEBUG.
 *
 * @see SynthesisProcessManager
 * @see SynthesisConfig
 */
@Component
@ConditionalOnProperty(name = "augment.transform.type", havingValue = "synthesis", matchIfMissing = true)
public class SpeechSynthesisTransform extends AbstractUtteranceTransform {

    private static final Logger LOG = LogManager.getLogger(SpeechSynthesisTransform.class);

    public static final String NAME = "synthesis";
    public static final String EXTENSION = "wav";

    private final SynthesisConfig cfg;
    private final SynthesisProcessManager manager;
    private volatile Path binary;

    public SpeechSynthesisTransform(SynthesisConfig cfg, SynthesisProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    protected void doInitialize() {
        Path resolved = resolveBinary(cfg.binaryPath(), System.getenv("PATH"));
        if (!Files.isRegularFile(resolved)) {
            throw new PermanentTransformException("TTS binary not found: " + resolved
                    + " (configured as: " + cfg.binaryPath() + ")", NAME);
        }
        if (!Files.isExecutable(resolved)) {
            throw new PermanentTransformException("TTS binary not executable: " + resolved
                    + " (try: chmod +x '" + resolved + "')", NAME);
        }
        this.binary = resolved;
        LOG.info("Synthesis transform initialized: bin={}, model={}, timeout={}s, cuda={}",
                resolved, cfg.modelName(), cfg.timeoutSeconds(), cfg.useCuda());
    }

    @Override
    public void apply(String payload, Path target) {
        ensureInitialized();
        try {
            manager.synthesize(payload, target, binary, cfg);
        } catch (RuntimeException e) {
            throw wrapFailure(e);
        }
    }

    @Override
    protected void doClose() {
        manager.close();
        LOG.info("Synthesis transform closed");
    }

    @Override
    public String getTransformName() {
        return NAME;
    }

    @Override
    public String artifactExtension() {
        return EXTENSION;
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> params = new TreeMap<>();
        params.put("transform", NAME);
        params.put("model_name", cfg.modelName());
        return params;
    }

    /**
     * Resolves the configured binary. Paths containing a separator are resolved against the
     * working directory; bare command names are looked up on {@code pathEnv}.
     *
     * @return resolved path; may not exist if the lookup failed
     */
    static Path resolveBinary(String configured, String pathEnv) {
        Path path = Path.of(configured);
        if (path.isAbsolute()) {
            return path;
        }
        if (path.getNameCount() > 1 || pathEnv == null || pathEnv.isBlank()) {
            return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(configured);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }
}
