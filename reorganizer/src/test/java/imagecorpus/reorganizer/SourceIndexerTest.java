package imagecorpus.reorganizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceIndexerTest {

    @TempDir
    Path tmp;

    private Path source;

    @BeforeEach
    void createTree() throws Exception {
        source = tmp.resolve("src");
        touch(source.resolve("dir1/2452418.png"));
        touch(source.resolve("dir2/deep/er/2452419.png"));
        touch(source.resolve("dir2/2452420.jpg"));
        touch(source.resolve("top.png"));
        Files.createDirectories(source.resolve("empty/dir"));
    }

    private static void touch(Path file) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, file.getFileName().toString());
    }

    private static long countEntries(Path dir) throws Exception {
        try (Stream<Path> s = Files.list(dir)) {
            return s.count();
        }
    }

    @Test
    void indexesEveryRegularFileByBareName() throws Exception {
        try (SourceIndex index = SourceIndexer.build(source)) {
            assertFalse(index.isSpilled());
            assertEquals(4, index.getFilesSeen());
            assertEquals(4, index.getDistinctNames());
            assertEquals(0, index.getCollisions());
            Path found = index.lookup("2452419.png");
            assertTrue(found.isAbsolute());
            assertEquals(source.resolve("dir2/deep/er/2452419.png").toAbsolutePath().normalize(), found);
            assertNull(index.lookup("missing.png"));
            assertNull(index.lookup("dir1"));
        }
    }

    @Test
    void smallestPathWinsOnDuplicateNames() throws Exception {
        touch(source.resolve("b/dup.png"));
        touch(source.resolve("a/dup.png"));
        touch(source.resolve("c/x/dup.png"));
        try (SourceIndex index = SourceIndexer.build(source)) {
            assertEquals(source.resolve("a/dup.png").toAbsolutePath().normalize(), index.lookup("dup.png"));
            assertEquals(2, index.getCollisions());
            assertEquals(7, index.getFilesSeen());
            assertEquals(5, index.getDistinctNames());
        }
    }

    @Test
    void spilledIndexAnswersLikeTheHeapIndex() throws Exception {
        touch(source.resolve("b/dup.png"));
        touch(source.resolve("a/dup.png"));
        Path temp = tmp.resolve("spill");
        try (SourceIndex heap = SourceIndexer.build(source, SourceIndexer.NEVER_SPILL, null);
             SourceIndex disk = SourceIndexer.build(source, 2, temp)) {
            assertTrue(disk.isSpilled());
            assertEquals(1, countEntries(temp));
            assertEquals(heap.getFilesSeen(), disk.getFilesSeen());
            assertEquals(heap.getDistinctNames(), disk.getDistinctNames());
            assertEquals(heap.getCollisions(), disk.getCollisions());
            for (String name : new String[] {"2452418.png", "2452419.png", "2452420.jpg", "top.png", "dup.png", "nope"}) {
                assertEquals(heap.lookup(name), disk.lookup(name), name);
            }
        }
        assertEquals(0, countEntries(temp), "spill directory left behind");
    }

    @Test
    void zeroThresholdSpillsFromTheFirstFile() throws Exception {
        Path temp = tmp.resolve("spill");
        try (SourceIndex index = SourceIndexer.build(source, 0, temp)) {
            assertTrue(index.isSpilled());
            assertEquals(4, index.getFilesSeen());
            assertEquals(source.resolve("top.png").toAbsolutePath().normalize(), index.lookup("top.png"));
        }
        assertEquals(0, countEntries(temp));
    }

    @Test
    void thresholdAboveTreeSizeStaysOnHeap() throws Exception {
        try (SourceIndex index = SourceIndexer.build(source, 100, tmp.resolve("spill"))) {
            assertFalse(index.isSpilled());
        }
        assertFalse(Files.exists(tmp.resolve("spill")));
    }

    @Test
    void missingRootIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SourceIndexer.build(tmp.resolve("absent")));
    }

    @Test
    void emptyTreeGivesEmptyIndex() throws Exception {
        try (SourceIndex index = SourceIndexer.build(source.resolve("empty"))) {
            assertEquals(0, index.getFilesSeen());
            assertNull(index.lookup("top.png"));
        }
    }
}
