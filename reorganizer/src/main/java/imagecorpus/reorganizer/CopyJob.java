package imagecorpus.reorganizer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One resolved transfer: source file to its place in the taxonomy. The destination depends only on
 * the record it came from, so a job means the same thing whatever order or run it executes in.
 */
public final class CopyJob {

    private final Path source;
    private final Path destination;
    private final Path sidecarSource;

    public CopyJob(Path source, Path destination) {
        this(source, destination, null);
    }

    public CopyJob(Path source, Path destination, Path sidecarSource) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.sidecarSource = sidecarSource;
    }

    public Path getSource() { return source; }
    public Path getDestination() { return destination; }

    /** {@code <stem>.json} next to the source image, or null. */
    public Path getSidecarSource() { return sidecarSource; }

    public Path getSidecarDestination() {
        return sidecarSource == null ? null : destination.resolveSibling(sidecarSource.getFileName());
    }

    /** {@code outputRoot/<base>/<model>} directory the job writes into. */
    public Path getTargetDirectory() {
        return destination.getParent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CopyJob other)) return false;
        return source.equals(other.source)
            && destination.equals(other.destination)
            && Objects.equals(sidecarSource, other.sidecarSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, sidecarSource);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
