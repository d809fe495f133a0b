package imagecorpus.reorganizer;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins metadata records against the source index. A record whose file is in the index becomes a
 * {@link CopyJob} targeting {@code outputRoot/<base model>/<effective model>/<filename>}; a record
 * whose file is not is skipped and counted.
 */
public final class CopyPlanner {

    private static final Logger log = LoggerFactory.getLogger(CopyPlanner.class);

    static final String SIDECAR_EXTENSION = ".json";
    private static final int UNRESOLVED_SAMPLE_SIZE = 20;

    private final SourceIndex index;
    private final Path outputRoot;
    private final LabelRouter router;
    private final boolean sidecars;

    public CopyPlanner(SourceIndex index, Path outputRoot) {
        this(index, outputRoot, LabelRouter.identity(), false);
    }

    /**
     * @param sidecars also carry {@code <stem>.json} from the source tree when one exists
     */
    public CopyPlanner(SourceIndex index, Path outputRoot, LabelRouter router, boolean sidecars) {
        this.index = index;
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
        this.router = router;
        this.sidecars = sidecars;
    }

    /** Directory for a record: {@code outputRoot/normalize(base)/route(normalize(effective))}. */
    public Path targetDirectory(MetadataRecord record) {
        String base = NameNormalizer.normalize(record.getBaseModel());
        String model = router.route(NameNormalizer.normalize(record.getEffectiveModel()));
        return outputRoot.resolve(base).resolve(model);
    }

    public CopyPlan plan(Iterable<MetadataRecord> records) throws IOException {
        List<CopyJob> jobs = new ArrayList<>();
        Set<Path> dirs = new HashSet<>();
        List<String> unresolved = new ArrayList<>();
        long parsed = 0;
        long skipped = 0;
        for (MetadataRecord record : records) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Interrupted while planning");
            }
            parsed++;
            Path source = index.lookup(record.getFilename());
            if (source == null) {
                skipped++;
                if (unresolved.size() < UNRESOLVED_SAMPLE_SIZE) {
                    unresolved.add(record.getFilename());
                }
                log.debug("No source file for {} (row {})", record.getFilename(), record.getRow());
                continue;
            }
            Path dir = targetDirectory(record);
            dirs.add(dir);
            jobs.add(new CopyJob(source, dir.resolve(record.getFilename()), sidecarFor(record.getFilename())));
        }
        log.info("Planned {} jobs from {} records ({} unresolved) into {} directories",
            jobs.size(), parsed, skipped, dirs.size());
        return new CopyPlan(jobs, dirs, parsed, skipped, unresolved);
    }

    private Path sidecarFor(String filename) throws IOException {
        if (!sidecars) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String sidecarName = stem + SIDECAR_EXTENSION;
        if (sidecarName.equals(filename)) {
            return null;
        }
        return index.lookup(sidecarName);
    }
}
