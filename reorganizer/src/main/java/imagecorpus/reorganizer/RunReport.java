package imagecorpus.reorganizer;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Counts and timings of one reorganize run; written as JSON by {@link Reporter#writeJson}.
 * {@code resolved + skippedUnresolved == totalRecords}.
 */
public final class RunReport {

    @SerializedName("metadata_file")
    private String metadataFile;
    @SerializedName("source_dir")
    private String sourceDir;
    @SerializedName("output_dir")
    private String outputDir;
    private String strategy;
    private int workers;
    @SerializedName("dry_run")
    private boolean dryRun;

    @SerializedName("total_records")
    private long totalRecords;
    @SerializedName("malformed_rows")
    private long malformedRows;
    private long resolved;
    @SerializedName("skipped_unresolved")
    private long skippedUnresolved;
    private long copied;
    private long failed;
    @SerializedName("sidecars_copied")
    private long sidecarsCopied;
    @SerializedName("sidecars_failed")
    private long sidecarsFailed;

    @SerializedName("source_files_seen")
    private long sourceFilesSeen;
    @SerializedName("source_collisions")
    private long sourceCollisions;
    @SerializedName("source_index_spilled")
    private boolean sourceIndexSpilled;
    private int directories;
    @SerializedName("directories_failed")
    private int directoriesFailed;

    @SerializedName("elapsed_ms")
    private long elapsedMillis;
    @SerializedName("files_per_second")
    private double filesPerSecond;

    @SerializedName("unresolved_sample")
    private List<String> unresolvedSample;
    @SerializedName("failure_sample")
    private List<String> failureSample;

    public String getMetadataFile() { return metadataFile; }
    public void setMetadataFile(String metadataFile) { this.metadataFile = metadataFile; }

    public String getSourceDir() { return sourceDir; }
    public void setSourceDir(String sourceDir) { this.sourceDir = sourceDir; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public long getTotalRecords() { return totalRecords; }
    public void setTotalRecords(long totalRecords) { this.totalRecords = totalRecords; }

    public long getMalformedRows() { return malformedRows; }
    public void setMalformedRows(long malformedRows) { this.malformedRows = malformedRows; }

    public long getResolved() { return resolved; }
    public void setResolved(long resolved) { this.resolved = resolved; }

    public long getSkippedUnresolved() { return skippedUnresolved; }
    public void setSkippedUnresolved(long skippedUnresolved) { this.skippedUnresolved = skippedUnresolved; }

    public long getCopied() { return copied; }
    public void setCopied(long copied) { this.copied = copied; }

    public long getFailed() { return failed; }
    public void setFailed(long failed) { this.failed = failed; }

    public long getSidecarsCopied() { return sidecarsCopied; }
    public void setSidecarsCopied(long sidecarsCopied) { this.sidecarsCopied = sidecarsCopied; }

    public long getSidecarsFailed() { return sidecarsFailed; }
    public void setSidecarsFailed(long sidecarsFailed) { this.sidecarsFailed = sidecarsFailed; }

    public long getSourceFilesSeen() { return sourceFilesSeen; }
    public void setSourceFilesSeen(long sourceFilesSeen) { this.sourceFilesSeen = sourceFilesSeen; }

    public long getSourceCollisions() { return sourceCollisions; }
    public void setSourceCollisions(long sourceCollisions) { this.sourceCollisions = sourceCollisions; }

    public boolean isSourceIndexSpilled() { return sourceIndexSpilled; }
    public void setSourceIndexSpilled(boolean sourceIndexSpilled) { this.sourceIndexSpilled = sourceIndexSpilled; }

    public int getDirectories() { return directories; }
    public void setDirectories(int directories) { this.directories = directories; }

    public int getDirectoriesFailed() { return directoriesFailed; }
    public void setDirectoriesFailed(int directoriesFailed) { this.directoriesFailed = directoriesFailed; }

    public long getElapsedMillis() { return elapsedMillis; }
    public void setElapsedMillis(long elapsedMillis) { this.elapsedMillis = elapsedMillis; }

    public double getFilesPerSecond() { return filesPerSecond; }
    public void setFilesPerSecond(double filesPerSecond) { this.filesPerSecond = filesPerSecond; }

    public List<String> getUnresolvedSample() { return unresolvedSample; }
    public void setUnresolvedSample(List<String> unresolvedSample) { this.unresolvedSample = unresolvedSample; }

    public List<String> getFailureSample() { return failureSample; }
    public void setFailureSample(List<String> failureSample) { this.failureSample = failureSample; }
}
