package imagecorpus.reorganizer;

import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI to reorganize an image tree by model lineage.
 * <p>
 * Usage:
 * <pre>
 *   java ... Reorganize metadata.csv /data/images /data/organized
 *   java ... Reorganize metadata.csv /data/images /data/organized 32 rsync --sidecars --report-json run.json
 * </pre>
 * Exit status is 0 whenever the run completes, even with skipped or failed files; 1 for bad usage
 * and setup errors; 130 when interrupted.
 */
public final class Reorganize {

    private static final Logger log = LoggerFactory.getLogger(Reorganize.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INTERRUPTED = 130;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private static final AtomicInteger registeredHooks = new AtomicInteger();

    public static void main(String[] args) {
        ReorganizeConfig config = null;
        try {
            config = parse(args);
        } catch (IllegalArgumentException e) {
            usage(e.getMessage());
        }
        if (config == null) usage(null);
        System.exit(run(config));
    }

    /**
     * @return the parsed configuration, or null when help was requested
     * @throws IllegalArgumentException for invalid arguments
     */
    static ReorganizeConfig parse(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean dryRun = false;
        boolean sidecars = false;
        Path mergeRules = null;
        Path reportJson = null;
        Path tempDir = null;
        Long spillThreshold = null;
        Integer progressEvery = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i].toLowerCase(Locale.ROOT)) {
                case "--dry-run", "-n" -> dryRun = true;
                case "--sidecars" -> sidecars = true;
                case "--merge-rules", "-m" -> mergeRules = Path.of(value(args, i++));
                case "--report-json", "-r" -> reportJson = Path.of(value(args, i++));
                case "--temp-dir" -> tempDir = Path.of(value(args, i++));
                case "--spill-threshold" -> spillThreshold = parseLong("--spill-threshold", value(args, i++));
                case "--progress-every" -> progressEvery = parseInt("--progress-every", value(args, i++));
                case "--help", "-h" -> {
                    return null;
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    positional.add(args[i]);
                }
            }
        }
        if (positional.size() < 3) {
            throw new IllegalArgumentException("<metadata_file>, <source_dir> and <output_dir> are required");
        }
        if (positional.size() > 5) {
            throw new IllegalArgumentException("Unexpected argument: " + positional.get(5));
        }
        ReorganizeConfig.Builder b = ReorganizeConfig.builder(
                Path.of(positional.get(0)), Path.of(positional.get(1)), Path.of(positional.get(2)))
            .dryRun(dryRun)
            .sidecars(sidecars)
            .mergeRules(mergeRules)
            .reportJson(reportJson)
            .tempDir(tempDir);
        if (positional.size() > 3) {
            int workers = parseInt("worker_count", positional.get(3));
            if (workers < 1) throw new IllegalArgumentException("worker_count must be >= 1");
            b.workers(workers);
        }
        if (positional.size() > 4) {
            b.mode(TransferMode.parse(positional.get(4)));
        }
        if (spillThreshold != null) b.spillThreshold(spillThreshold);
        if (progressEvery != null) b.progressInterval(progressEvery);
        return b.build();
    }

    /**
     * Run with a shutdown hook that interrupts this thread on SIGINT/SIGTERM and waits for the pipeline
     * to release its resources.
     */
    static int run(ReorganizeConfig config) {
        Thread worker = Thread.currentThread();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) return;
            System.err.println("Interrupted, cleaning up...");
            worker.interrupt();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "reorganize-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        registeredHooks.incrementAndGet();

        int exit;
        try {
            System.out.println("Metadata: " + config.getMetadataFile());
            System.out.println("Source:   " + config.getSourceDir());
            System.out.println("Output:   " + config.getOutputDir()
                + " (" + config.getMode().name().toLowerCase(Locale.ROOT) + ", workers=" + config.getWorkers()
                + (config.isDryRun() ? ", dry run" : "") + ")");
            ParallelExecutor.ProgressListener progress = (done, total) ->
                System.err.printf("  %d/%d files%n", done, total);
            RunReport report = Reorganizer.run(config, progress);
            System.out.print(Reporter.format(report));
            exit = EXIT_OK;
        } catch (InterruptedIOException e) {
            System.err.println("Interrupted: " + e.getMessage());
            exit = EXIT_INTERRUPTED;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            exit = EXIT_ERROR;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            exit = EXIT_ERROR;
        } finally {
            finished.countDown();
            removeShutdownHook(hook);
        }
        return exit;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
            registeredHooks.decrementAndGet();
        } catch (IllegalStateException e) {
            // JVM is exiting; the hook is already running and returns once the latch is released
            log.debug("Shutdown in progress, keeping hook {}", hook.getName());
        }
    }

    /** Shutdown hooks added by {@link #run} that are still registered. */
    static int registeredShutdownHooks() {
        return registeredHooks.get();
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for " + args[i]);
        return args[i + 1];
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }

    private static void usage(String error) {
        if (error != null) System.err.println(error);
        System.err.println("Usage: Reorganize <metadata_file> <source_dir> <output_dir> [worker_count] [strategy] [options]");
        System.err.println("  metadata_file      CSV (or .tsv) with header: filename, base_model, model_name, model_type");
        System.err.println("  source_dir         Root of the nested source tree (scanned recursively)");
        System.err.println("  output_dir         Root for <base_model>/<model>/<filename>");
        System.err.println("  worker_count       Parallel transfers (default: " + ParallelExecutor.defaultWorkers() + ")");
        System.err.println("  strategy           copy | rsync | cp | symlink (default: copy)");
        System.err.println("  --dry-run          Plan and report only; write nothing");
        System.err.println("  --sidecars         Also transfer <stem>.json found next to each image");
        System.err.println("  --merge-rules      JSON file {\"Target\": [\"label\", ...]} folding model labels together");
        System.err.println("  --report-json      Write the run report as JSON to this file");
        System.err.println("  --spill-threshold  Source files before the index moves to disk (default: "
            + ReorganizeConfig.DEFAULT_SPILL_THRESHOLD + ", 0 = always, -1 = never)");
        System.err.println("  --temp-dir         Parent directory for the on-disk index (default: system temp)");
        System.err.println("  --progress-every   Files between progress lines (default: " + ParallelExecutor.DEFAULT_PROGRESS_INTERVAL + ")");
        System.exit(error == null ? EXIT_OK : EXIT_ERROR);
    }
}
