package imagecorpus.reorganizer;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Output of {@link CopyPlanner}: the immutable job list and what could not be resolved.
 * {@code getJobs().size() + getSkippedUnresolved() == getParsedRecords()} always holds.
 */
public final class CopyPlan {

    private final List<CopyJob> jobs;
    private final Set<Path> targetDirectories;
    private final long parsedRecords;
    private final long skippedUnresolved;
    private final List<String> unresolvedSample;

    CopyPlan(List<CopyJob> jobs, Set<Path> targetDirectories, long parsedRecords,
             long skippedUnresolved, List<String> unresolvedSample) {
        this.jobs = List.copyOf(jobs);
        this.targetDirectories = Set.copyOf(targetDirectories);
        this.parsedRecords = parsedRecords;
        this.skippedUnresolved = skippedUnresolved;
        this.unresolvedSample = List.copyOf(unresolvedSample);
    }

    public List<CopyJob> getJobs() { return jobs; }

    /** Distinct {@code outputRoot/<base>/<model>} directories the jobs write into. */
    public Set<Path> getTargetDirectories() { return targetDirectories; }

    public long getParsedRecords() { return parsedRecords; }
    public long getResolved() { return jobs.size(); }
    public long getSkippedUnresolved() { return skippedUnresolved; }

    /** The first few file names that were not found in the source tree. */
    public List<String> getUnresolvedSample() { return unresolvedSample; }

    public long getSidecars() {
        return jobs.stream().filter(j -> j.getSidecarSource() != null).count();
    }
}
