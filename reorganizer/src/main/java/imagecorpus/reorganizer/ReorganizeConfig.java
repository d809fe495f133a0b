package imagecorpus.reorganizer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one {@link Reorganizer} run. Built by the CLI or, in code, through {@link #builder}.
 */
public final class ReorganizeConfig {

    public static final long DEFAULT_SPILL_THRESHOLD = 2_000_000L;

    private final Path metadataFile;
    private final Path sourceDir;
    private final Path outputDir;
    private final int workers;
    private final TransferMode mode;
    private final boolean dryRun;
    private final boolean sidecars;
    private final Path mergeRules;
    private final long spillThreshold;
    private final Path tempDir;
    private final Path reportJson;
    private final int progressInterval;

    private ReorganizeConfig(Builder b) {
        this.metadataFile = Objects.requireNonNull(b.metadataFile, "metadataFile");
        this.sourceDir = Objects.requireNonNull(b.sourceDir, "sourceDir");
        this.outputDir = Objects.requireNonNull(b.outputDir, "outputDir");
        this.workers = b.workers;
        this.mode = b.mode;
        this.dryRun = b.dryRun;
        this.sidecars = b.sidecars;
        this.mergeRules = b.mergeRules;
        this.spillThreshold = b.spillThreshold;
        this.tempDir = b.tempDir;
        this.reportJson = b.reportJson;
        this.progressInterval = b.progressInterval;
    }

    public static Builder builder(Path metadataFile, Path sourceDir, Path outputDir) {
        return new Builder(metadataFile, sourceDir, outputDir);
    }

    public Path getMetadataFile() { return metadataFile; }
    public Path getSourceDir() { return sourceDir; }
    public Path getOutputDir() { return outputDir; }
    public int getWorkers() { return workers; }
    public TransferMode getMode() { return mode; }
    public boolean isDryRun() { return dryRun; }
    public boolean isSidecars() { return sidecars; }

    /** JSON merge rules for {@link LabelRouter}, or null. */
    public Path getMergeRules() { return mergeRules; }

    public long getSpillThreshold() { return spillThreshold; }

    /** Parent of the spilled source index, or null for the system temp directory. */
    public Path getTempDir() { return tempDir; }

    /** Where to write the JSON report, or null. */
    public Path getReportJson() { return reportJson; }

    public int getProgressInterval() { return progressInterval; }

    public static final class Builder {
        private final Path metadataFile;
        private final Path sourceDir;
        private final Path outputDir;
        private int workers = ParallelExecutor.defaultWorkers();
        private TransferMode mode = TransferMode.COPY;
        private boolean dryRun;
        private boolean sidecars;
        private Path mergeRules;
        private long spillThreshold = DEFAULT_SPILL_THRESHOLD;
        private Path tempDir;
        private Path reportJson;
        private int progressInterval = ParallelExecutor.DEFAULT_PROGRESS_INTERVAL;

        private Builder(Path metadataFile, Path sourceDir, Path outputDir) {
            this.metadataFile = metadataFile;
            this.sourceDir = sourceDir;
            this.outputDir = outputDir;
        }

        public Builder workers(int workers) {
            if (workers < 1) throw new IllegalArgumentException("worker count must be >= 1");
            this.workers = workers;
            return this;
        }

        public Builder mode(TransferMode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder sidecars(boolean sidecars) {
            this.sidecars = sidecars;
            return this;
        }

        public Builder mergeRules(Path mergeRules) {
            this.mergeRules = mergeRules;
            return this;
        }

        /** Files seen before the source index moves to disk; 0 = always, negative = never. */
        public Builder spillThreshold(long spillThreshold) {
            this.spillThreshold = spillThreshold;
            return this;
        }

        public Builder tempDir(Path tempDir) {
            this.tempDir = tempDir;
            return this;
        }

        public Builder reportJson(Path reportJson) {
            this.reportJson = reportJson;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval < 1) throw new IllegalArgumentException("progress interval must be >= 1");
            this.progressInterval = progressInterval;
            return this;
        }

        public ReorganizeConfig build() {
            return new ReorganizeConfig(this);
        }
    }
}
