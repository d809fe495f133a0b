package imagecorpus.reorganizer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * How one file gets from the source tree to its destination. Implementations must be thread-safe and
 * idempotent: transferring onto an existing destination replaces it.
 */
public interface TransferStrategy {

    String name();

    /**
     * @param source      existing regular file
     * @param destination target path; its parent directory is expected to exist
     */
    void transfer(Path source, Path destination) throws IOException;

    /** Fails fast, before any job runs, when the strategy cannot work on this host. */
    default void verify() throws IOException {}
}
