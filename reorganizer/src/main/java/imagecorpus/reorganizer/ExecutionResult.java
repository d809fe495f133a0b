package imagecorpus.reorganizer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcomes of one {@link ParallelExecutor} run, in job-list order.
 */
public final class ExecutionResult {

    private final List<JobOutcome> outcomes;
    private final long copied;
    private final long sidecarsCopied;
    private final long sidecarsFailed;

    ExecutionResult(List<JobOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
        long ok = 0;
        long sidecarOk = 0;
        long sidecarBad = 0;
        for (JobOutcome o : outcomes) {
            if (o.isCopied()) ok++;
            if (o.getSidecarStatus() == JobOutcome.SidecarStatus.COPIED) sidecarOk++;
            if (o.getSidecarStatus() == JobOutcome.SidecarStatus.FAILED) sidecarBad++;
        }
        this.copied = ok;
        this.sidecarsCopied = sidecarOk;
        this.sidecarsFailed = sidecarBad;
    }

    static ExecutionResult empty() {
        return new ExecutionResult(List.of());
    }

    public List<JobOutcome> getOutcomes() { return outcomes; }
    public long getCopied() { return copied; }
    public long getFailed() { return outcomes.size() - copied; }
    public long getSidecarsCopied() { return sidecarsCopied; }
    public long getSidecarsFailed() { return sidecarsFailed; }

    public List<JobOutcome> getFailures() {
        return outcomes.stream().filter(o -> !o.isCopied()).collect(Collectors.toList());
    }
}
