package imagecorpus.reorganizer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembles the {@link RunReport} from what each stage returned, and renders it.
 */
public final class Reporter {

    static final int FAILURE_SAMPLE_SIZE = 20;
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private Reporter() {}

    /**
     * @param taxonomy  null for a dry run
     * @param execution null for a dry run
     */
    public static RunReport build(ReorganizeConfig config, TransferStrategy strategy, long malformedRows,
                                  SourceIndex index, CopyPlan plan, TaxonomyBuilder.Result taxonomy,
                                  ExecutionResult execution, long elapsedNanos) {
        RunReport r = new RunReport();
        r.setMetadataFile(config.getMetadataFile().toString());
        r.setSourceDir(config.getSourceDir().toString());
        r.setOutputDir(config.getOutputDir().toString());
        r.setStrategy(strategy.name());
        r.setWorkers(config.getWorkers());
        r.setDryRun(config.isDryRun());

        r.setTotalRecords(plan.getParsedRecords());
        r.setMalformedRows(malformedRows);
        r.setResolved(plan.getResolved());
        r.setSkippedUnresolved(plan.getSkippedUnresolved());
        r.setUnresolvedSample(plan.getUnresolvedSample());

        r.setSourceFilesSeen(index.getFilesSeen());
        r.setSourceCollisions(index.getCollisions());
        r.setSourceIndexSpilled(index.isSpilled());

        r.setDirectories(plan.getTargetDirectories().size());
        r.setDirectoriesFailed(taxonomy == null ? 0 : taxonomy.getFailed().size());

        ExecutionResult exec = execution == null ? ExecutionResult.empty() : execution;
        r.setCopied(exec.getCopied());
        r.setFailed(exec.getFailed());
        r.setSidecarsCopied(exec.getSidecarsCopied());
        r.setSidecarsFailed(exec.getSidecarsFailed());
        r.setFailureSample(exec.getFailures().stream()
            .limit(FAILURE_SAMPLE_SIZE)
            .map(JobOutcome::toString)
            .collect(Collectors.toList()));

        r.setElapsedMillis(elapsedNanos / 1_000_000L);
        r.setFilesPerSecond(throughput(exec.getCopied(), elapsedNanos));
        return r;
    }

    /** Copied files per second of wall time; 0 when no time elapsed. */
    public static double throughput(long copied, long elapsedNanos) {
        if (elapsedNanos <= 0) {
            return 0;
        }
        return copied / (elapsedNanos / 1e9);
    }

    public static String format(RunReport r) {
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(60);
        sb.append(rule).append('\n');
        sb.append(r.isDryRun() ? "Reorganize plan (dry run)" : "Reorganize complete").append('\n');
        sb.append(rule).append('\n');
        line(sb, "Output directory", r.getOutputDir());
        line(sb, "Strategy", r.getStrategy() + " (" + r.getWorkers() + " workers)");
        line(sb, "Source files seen", r.getSourceFilesSeen()
            + (r.getSourceCollisions() > 0 ? " (" + r.getSourceCollisions() + " duplicate names)" : "")
            + (r.isSourceIndexSpilled() ? " [on-disk index]" : ""));
        line(sb, "Records parsed", String.valueOf(r.getTotalRecords()));
        if (r.getMalformedRows() > 0) {
            line(sb, "Malformed rows", String.valueOf(r.getMalformedRows()));
        }
        line(sb, "Jobs resolved", String.valueOf(r.getResolved()));
        line(sb, "Skipped (unresolved)", String.valueOf(r.getSkippedUnresolved()));
        line(sb, "Directories", r.getDirectories()
            + (r.getDirectoriesFailed() > 0 ? " (" + r.getDirectoriesFailed() + " failed)" : ""));
        if (!r.isDryRun()) {
            line(sb, "Copied", String.valueOf(r.getCopied()));
            line(sb, "Failed", String.valueOf(r.getFailed()));
            if (r.getSidecarsCopied() > 0 || r.getSidecarsFailed() > 0) {
                line(sb, "Sidecars", r.getSidecarsCopied() + " copied, " + r.getSidecarsFailed() + " failed");
            }
        }
        line(sb, "Elapsed", String.format(Locale.ROOT, "%.2f s", r.getElapsedMillis() / 1000.0));
        if (!r.isDryRun()) {
            line(sb, "Throughput", String.format(Locale.ROOT, "%.2f files/s", r.getFilesPerSecond()));
        }
        sample(sb, "Unresolved file names", r.getUnresolvedSample(), r.getSkippedUnresolved());
        sample(sb, "Failures", r.getFailureSample(), r.getFailed());
        sb.append(rule).append('\n');
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "%-22s %s%n", label + ":", value));
    }

    private static void sample(StringBuilder sb, String title, List<String> items, long total) {
        if (items == null || items.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(":\n");
        for (String item : items) {
            sb.append("  - ").append(item).append('\n');
        }
        if (total > items.size()) {
            sb.append("  ... and ").append(total - items.size()).append(" more\n");
        }
    }

    public static void writeJson(RunReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(report, w);
        }
    }

    public static RunReport readJson(Path file) throws IOException {
        try (var r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return GSON.fromJson(r, RunReport.class);
        }
    }
}
