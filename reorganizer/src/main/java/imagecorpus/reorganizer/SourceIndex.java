package imagecorpus.reorganizer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Filename to absolute source path lookup built from one scan of the source tree.
 * <p>
 * When several files share a bare name the lexicographically smallest absolute path wins; the others
 * are counted in {@link #getCollisions()}. Implementations may hold temporary on-disk state and must be
 * closed.
 */
public interface SourceIndex extends Closeable {

    /**
     * @param filename bare file name, e.g. {@code 2452418.png}
     * @return the absolute path of the file, or null when no file of that name was seen
     */
    Path lookup(String filename) throws IOException;

    /** Regular files visited during the scan, duplicates included. */
    long getFilesSeen();

    /** Distinct bare names in the index. */
    long getDistinctNames();

    /** Files shadowed by another file of the same name. */
    long getCollisions();

    /** True when entries live in an on-disk index rather than on the heap. */
    boolean isSpilled();

    /** Picks between two candidates for the same name. */
    static boolean wins(Path candidate, Path current) {
        return candidate.toString().compareTo(current.toString()) < 0;
    }
}
