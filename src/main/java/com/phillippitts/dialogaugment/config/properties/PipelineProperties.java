package com.phillippitts.dialogaugment.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the batch pipeline.
 *
 * <p>Example application.properties:
 * <pre>
 * augment.pipeline.input-dir=data/dev
 * augment.pipeline.output-dir=data/dev_augmented
 * augment.pipeline.batch-size=32
 * augment.pipeline.max-groups=127
 * augment.pipeline.budget-scope=global
 * </pre>
 */
@ConfigurationProperties(prefix = "augment.pipeline")
@Validated
public class PipelineProperties {

    /** How the group budget is applied across shards. */
    public enum BudgetScope {
        /** One counter for the whole run; once exhausted no further shard is read. */
        GLOBAL,
        /** Counter resets for every shard, so each shard contributes at most max-groups groups. */
        PER_SHARD
    }

    /** Directory holding the sharded {@code *.json} dialogue documents. */
    @NotBlank(message = "Input directory must not be blank")
    private String inputDir = "data/dev";

    /** Root directory for artifacts, rewritten documents and (by default) the checkpoint. */
    @NotBlank(message = "Output directory must not be blank")
    private String outputDir = "data/dev_augmented";

    /** Checkpoint file; blank means {@code <output-dir>/checkpoint.json}. */
    private String checkpointFile = "";

    @Positive(message = "Batch size must be positive")
    private int batchSize = 32;

    /** Maximum groups (dialogues) admitted per run; 0 or negative disables the cap. */
    private int maxGroups = 127;

    @NotNull
    private BudgetScope budgetScope = BudgetScope.GLOBAL;

    /** Unit completions between intermediate checkpoint commits; 0 derives max(batch-size / 10, 1). */
    @Min(value = 0, message = "Save interval must not be negative")
    private int saveInterval = 0;

    @Positive(message = "Max payload length must be positive")
    @Max(value = 100_000, message = "Max payload length is unreasonably large")
    private int maxPayloadLength = 500;

    /** How long a shutdown signal waits for in-flight units and the final checkpoint flush. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(60);

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getCheckpointFile() {
        return checkpointFile;
    }

    public void setCheckpointFile(String checkpointFile) {
        this.checkpointFile = checkpointFile;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxGroups() {
        return maxGroups;
    }

    public void setMaxGroups(int maxGroups) {
        this.maxGroups = maxGroups;
    }

    public BudgetScope getBudgetScope() {
        return budgetScope;
    }

    public void setBudgetScope(BudgetScope budgetScope) {
        this.budgetScope = budgetScope;
    }

    public int getSaveInterval() {
        return saveInterval;
    }

    public void setSaveInterval(int saveInterval) {
        this.saveInterval = saveInterval;
    }

    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }

    public void setMaxPayloadLength(int maxPayloadLength) {
        this.maxPayloadLength = maxPayloadLength;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Path inputPath() {
        return Path.of(inputDir);
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public Path checkpointPath() {
        if (checkpointFile == null || checkpointFile.isBlank()) {
            return outputPath().resolve("checkpoint.json");
        }
        return Path.of(checkpointFile);
    }

    /** Save interval with the derived default applied. */
    public int effectiveSaveInterval() {
        return saveInterval > 0 ? saveInterval : Math.max(batchSize / 10, 1);
    }
}
