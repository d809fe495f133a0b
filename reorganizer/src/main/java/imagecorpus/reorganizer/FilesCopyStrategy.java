package imagecorpus.reorganizer;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * In-process copy that keeps content and basic attributes. Data is written to a hidden temporary file
 * beside the destination and renamed into place, so the destination is either absent, the previous
 * version or the complete new copy.
 */
public final class FilesCopyStrategy implements TransferStrategy {

    // temp name length is independent of the destination name
    static final String PART_PREFIX = ".reorg-";
    static final String PART_SUFFIX = ".part";

    @Override
    public String name() {
        return "copy";
    }

    @Override
    public void transfer(Path source, Path destination) throws IOException {
        Path tmp = Files.createTempFile(destination.getParent(), PART_PREFIX, PART_SUFFIX);
        try {
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            try {
                Files.move(tmp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
