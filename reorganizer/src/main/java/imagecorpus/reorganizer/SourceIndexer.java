package imagecorpus.reorganizer;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SourceIndex} with a single recursive walk of the source tree.
 * <p>
 * Directory entries are streamed into the index as they are visited. Regular files only; symbolic
 * links are not followed. Unreadable subdirectories are logged and skipped. Once more than
 * {@code spillThreshold} files have been seen the entries move to a {@link SpilledSourceIndex}
 * (threshold 0 spills from the start; a negative threshold never spills).
 */
public final class SourceIndexer {

    private static final Logger log = LoggerFactory.getLogger(SourceIndexer.class);

    public static final long NEVER_SPILL = -1;
    private static final int PROGRESS_INTERVAL = 100_000;

    private SourceIndexer() {}

    /** Heap-only index. */
    public static SourceIndex build(Path sourceRoot) throws IOException {
        return build(sourceRoot, NEVER_SPILL, null);
    }

    /**
     * Scan {@code sourceRoot} and index every regular file below it by bare name.
     * The caller owns the returned index and must close it.
     *
     * @param sourceRoot     root of the nested source tree
     * @param spillThreshold files seen before moving to an on-disk index; 0 = always, negative = never
     * @param tempParent     parent for the spill directory; null for the system temp directory
     */
    public static SourceIndex build(Path sourceRoot, long spillThreshold, Path tempParent) throws IOException {
        if (!Files.isDirectory(sourceRoot)) {
            throw new IllegalArgumentException("Source directory not found: " + sourceRoot);
        }
        Path root = sourceRoot.toAbsolutePath().normalize();
        Collector collector = new Collector(spillThreshold, tempParent);
        try {
            Files.walkFileTree(root, collector);
            return collector.finish();
        } catch (IOException | RuntimeException e) {
            collector.discard();
            throw e;
        }
    }

    private static final class Collector extends SimpleFileVisitor<Path> {
        private final long spillThreshold;
        private final Path tempParent;
        private final InMemorySourceIndex heap = new InMemorySourceIndex();
        private SpilledSourceIndex spilled;
        private long seen;
        private long skippedDirs;

        Collector(long spillThreshold, Path tempParent) {
            this.spillThreshold = spillThreshold;
            this.tempParent = tempParent;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Interrupted while indexing " + dir);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            if (spilled == null && spillThreshold >= 0 && seen >= spillThreshold) {
                log.info("Source tree exceeds {} files, moving index to disk", spillThreshold);
                spilled = SpilledSourceIndex.create(tempParent);
                spilled.absorb(heap);
            }
            if (spilled != null) {
                spilled.add(file);
            } else {
                heap.add(file);
            }
            seen++;
            if (seen % PROGRESS_INTERVAL == 0) {
                log.info("Indexed {} source files", seen);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (exc instanceof InterruptedIOException) {
                throw exc;
            }
            skippedDirs++;
            log.warn("Cannot read {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        SourceIndex finish() throws IOException {
            if (skippedDirs > 0) {
                log.warn("{} entries of the source tree could not be read", skippedDirs);
            }
            if (spilled != null) {
                spilled.finish();
                return spilled;
            }
            log.info("Source index ready: {} files, {} names, {} collisions",
                heap.getFilesSeen(), heap.getDistinctNames(), heap.getCollisions());
            return heap;
        }

        void discard() {
            if (spilled == null) {
                return;
            }
            try {
                spilled.close();
            } catch (IOException e) {
                log.warn("Failed to remove spilled source index {}: {}", spilled.getTempDir(), e.toString());
            }
        }
    }
}
