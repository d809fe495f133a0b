package imagecorpus.reorganizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Links instead of copying: each destination becomes an absolute symbolic link to its source file.
 * Costs no space, but the taxonomy is only valid while the source tree stays in place.
 */
public final class SymlinkStrategy implements TransferStrategy {

    @Override
    public String name() {
        return "symlink";
    }

    @Override
    public void transfer(Path source, Path destination) throws IOException {
        // a rerun may resolve a file to its own earlier output; replacing it would leave a self-link
        if (source.toAbsolutePath().normalize().equals(destination.toAbsolutePath().normalize())) {
            return;
        }
        Files.deleteIfExists(destination);
        Files.createSymbolicLink(destination, source.toAbsolutePath());
    }
}
