package imagecorpus.reorganizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@code outputRoot/<base>/<model>} directories ahead of the transfers.
 * Creation is create-if-missing, so repeated or concurrent calls for the same directory succeed.
 * A directory that cannot be created is reported, not thrown: the jobs targeting it fail on their own.
 */
public final class TaxonomyBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyBuilder.class);

    private TaxonomyBuilder() {}

    public static Result materialize(Collection<Path> directories) {
        int created = 0;
        List<Path> failed = new ArrayList<>();
        for (Path dir : directories) {
            try {
                if (!Files.isDirectory(dir)) {
                    Files.createDirectories(dir);
                    created++;
                }
            } catch (IOException e) {
                failed.add(dir);
                log.warn("Cannot create directory {}: {}", dir, e.toString());
            }
        }
        log.info("Taxonomy: {} directories, {} created, {} failed", directories.size(), created, failed.size());
        return new Result(directories.size(), created, failed);
    }

    public static final class Result {
        private final int directories;
        private final int created;
        private final List<Path> failed;

        Result(int directories, int created, List<Path> failed) {
            this.directories = directories;
            this.created = created;
            this.failed = List.copyOf(failed);
        }

        public int getDirectories() { return directories; }
        public int getCreated() { return created; }
        public List<Path> getFailed() { return failed; }
    }
}
