package imagecorpus.reorganizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reorganizes a nested source tree into {@code output/<base model>/<model>/<filename>}:
 * parse metadata, index the source tree, plan jobs, create directories, transfer in parallel, report.
 * <p>
 * Setup problems (missing metadata file or source directory, bad header, unwritable output root,
 * unusable transfer tool, invalid merge rules) are thrown before any file is written. Everything
 * after that is counted in the returned {@link RunReport} instead. The source index, which may live
 * in a temporary directory, is released on every exit path, interruption included.
 */
public final class Reorganizer {

    private static final Logger log = LoggerFactory.getLogger(Reorganizer.class);

    private Reorganizer() {}

    public static RunReport run(ReorganizeConfig config) throws IOException {
        return run(config, null);
    }

    public static RunReport run(ReorganizeConfig config, ParallelExecutor.ProgressListener progress)
            throws IOException {
        long start = System.nanoTime();
        Path sourceDir = config.getSourceDir();
        Path outputDir = config.getOutputDir().toAbsolutePath().normalize();
        if (!Files.isDirectory(sourceDir)) {
            throw new IllegalArgumentException("Source directory not found: " + sourceDir);
        }
        if (outputDir.startsWith(sourceDir.toAbsolutePath().normalize())) {
            log.warn("Output directory {} is inside the source tree; earlier output will be indexed too", outputDir);
        }
        LabelRouter router = config.getMergeRules() == null
            ? LabelRouter.identity()
            : LabelRouter.load(config.getMergeRules());
        if (router.size() > 0) {
            log.info("Loaded {} label merge rules from {}", router.size(), config.getMergeRules());
        }
        TransferStrategy strategy = config.getMode().newStrategy();

        try (MetadataParser records = MetadataParser.open(config.getMetadataFile())) {
            if (!config.isDryRun()) {
                strategy.verify();
                prepareOutputRoot(outputDir);
            }
            try (SourceIndex index = SourceIndexer.build(sourceDir, config.getSpillThreshold(), config.getTempDir())) {
                CopyPlanner planner = new CopyPlanner(index, outputDir, router, config.isSidecars());
                CopyPlan plan = planner.plan(records);

                if (config.isDryRun()) {
                    return finish(config, Reporter.build(config, strategy, records.getMalformedRows(), index, plan,
                        null, null, System.nanoTime() - start));
                }

                TaxonomyBuilder.Result taxonomy = TaxonomyBuilder.materialize(plan.getTargetDirectories());
                ParallelExecutor executor = new ParallelExecutor(strategy, config.getWorkers(),
                    progress, config.getProgressInterval());
                ExecutionResult execution = executor.execute(plan.getJobs());

                RunReport report = Reporter.build(config, strategy, records.getMalformedRows(), index, plan,
                    taxonomy, execution, System.nanoTime() - start);
                log.info("Copied {} of {} resolved files ({} failed)",
                    report.getCopied(), report.getResolved(), report.getFailed());
                return finish(config, report);
            }
        }
    }

    private static RunReport finish(ReorganizeConfig config, RunReport report) throws IOException {
        if (config.getReportJson() != null) {
            Reporter.writeJson(report, config.getReportJson());
            log.info("Wrote report to {}", config.getReportJson());
        }
        return report;
    }

    private static void prepareOutputRoot(Path outputDir) throws IOException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IOException("Cannot create output directory " + outputDir + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(outputDir)) {
            throw new IllegalArgumentException("Output directory is not writable: " + outputDir);
        }
    }
}
