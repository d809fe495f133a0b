package imagecorpus.reorganizer;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a job list on a fixed pool of worker threads. Every job is isolated: whatever goes wrong with
 * one transfer is recorded as a failed {@link JobOutcome} and the others carry on. Only interruption of
 * the calling thread stops the run, as an {@link InterruptedIOException}. {@link #execute} does not
 * return before the workers have finished, up to {@link #TERMINATION_TIMEOUT_SECONDS} after an
 * interruption, because a copy already in progress does not react to interrupts.
 */
public final class ParallelExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    public static final int DEFAULT_PROGRESS_INTERVAL = 10_000;
    static final long TERMINATION_TIMEOUT_SECONDS = 20;

    @FunctionalInterface
    public interface ProgressListener {
        void report(long completed, long total);
    }

    private final TransferStrategy strategy;
    private final int workers;
    private final ProgressListener progress;
    private final int progressInterval;

    public ParallelExecutor(TransferStrategy strategy, int workers) {
        this(strategy, workers, null, DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * @param workers          maximum concurrent transfers, at least 1
     * @param progress         optional listener, called from the submitting thread
     * @param progressInterval jobs between progress reports
     */
    public ParallelExecutor(TransferStrategy strategy, int workers, ProgressListener progress, int progressInterval) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        this.strategy = strategy;
        this.workers = workers;
        this.progress = progress;
        this.progressInterval = progressInterval > 0 ? progressInterval : DEFAULT_PROGRESS_INTERVAL;
    }

    /** Default pool size for I/O bound copying: four threads per logical CPU, between 4 and 64. */
    public static int defaultWorkers() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(4, Math.min(64, cpus * 4));
    }

    public ExecutionResult execute(List<CopyJob> jobs) throws IOException {
        if (jobs.isEmpty()) {
            return ExecutionResult.empty();
        }
        int threads = Math.min(workers, jobs.size());
        log.info("Transferring {} files with {} workers ({})", jobs.size(), threads, strategy.name());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        try {
            List<Future<JobOutcome>> futures = new ArrayList<>(jobs.size());
            for (CopyJob job : jobs) {
                futures.add(pool.submit(() -> runJob(job)));
            }
            pool.shutdown();

            List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
            for (int i = 0; i < futures.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Interrupted during transfer");
                }
                outcomes.add(await(futures.get(i), jobs.get(i)));
                int done = i + 1;
                if (progress != null && (done % progressInterval == 0 || done == futures.size())) {
                    progress.report(done, futures.size());
                }
            }
            return new ExecutionResult(outcomes);
        } finally {
            stop(pool);
        }
    }

    private static void stop(ExecutorService pool) {
        pool.shutdownNow();
        // clear the flag so the wait below works, restore it afterwards
        boolean interrupted = Thread.interrupted();
        try {
            if (!pool.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Transfer workers still running {} s after shutdown", TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Interrupted while waiting for transfer workers to stop");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private JobOutcome runJob(CopyJob job) {
        try {
            strategy.transfer(job.getSource(), job.getDestination());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed {}: {}", job, e.toString());
            return JobOutcome.failed(job, e);
        }
        if (job.getSidecarSource() == null) {
            return JobOutcome.copied(job, JobOutcome.SidecarStatus.NONE);
        }
        try {
            strategy.transfer(job.getSidecarSource(), job.getSidecarDestination());
            return JobOutcome.copied(job, JobOutcome.SidecarStatus.COPIED);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed sidecar {} for {}: {}", job.getSidecarSource(), job.getDestination(), e.toString());
            return JobOutcome.copied(job, JobOutcome.SidecarStatus.FAILED);
        }
    }

    private static JobOutcome await(Future<JobOutcome> f, CopyJob job) throws IOException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error err) throw err;
            return JobOutcome.failed(job, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during transfer");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger next = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "transfer-" + next.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
