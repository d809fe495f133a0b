package imagecorpus.reorganizer;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-resident {@link SourceIndex}; the default for trees below the spill threshold.
 */
final class InMemorySourceIndex implements SourceIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemorySourceIndex.class);

    private final Map<String, Path> byName = new HashMap<>();
    private long filesSeen;
    private long collisions;

    void add(Path file) {
        filesSeen++;
        String name = file.getFileName().toString();
        Path current = byName.putIfAbsent(name, file);
        if (current == null) {
            return;
        }
        collisions++;
        if (SourceIndex.wins(file, current)) {
            byName.put(name, file);
            log.warn("Duplicate file name {}: keeping {}, ignoring {}", name, file, current);
        } else {
            log.warn("Duplicate file name {}: keeping {}, ignoring {}", name, current, file);
        }
    }

    /** Current entries, used when the index is moved to disk. */
    Map<String, Path> entries() {
        return byName;
    }

    @Override
    public Path lookup(String filename) {
        return byName.get(filename);
    }

    @Override
    public long getFilesSeen() { return filesSeen; }

    @Override
    public long getDistinctNames() { return byName.size(); }

    @Override
    public long getCollisions() { return collisions; }

    @Override
    public boolean isSpilled() { return false; }

    @Override
    public void close() {
        byName.clear();
    }
}
