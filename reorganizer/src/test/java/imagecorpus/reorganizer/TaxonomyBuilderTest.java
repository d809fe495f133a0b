package imagecorpus.reorganizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaxonomyBuilderTest {

    @TempDir
    Path tmp;

    @Test
    void createsMissingDirectoriesAndIsIdempotent() {
        List<Path> dirs = List.of(tmp.resolve("sd1.5/dreamshaper_v6"), tmp.resolve("sd1.5/sd1.5"), tmp.resolve("sdxl/x"));
        TaxonomyBuilder.Result first = TaxonomyBuilder.materialize(dirs);
        assertEquals(3, first.getDirectories());
        assertEquals(3, first.getCreated());
        assertTrue(first.getFailed().isEmpty());
        dirs.forEach(d -> assertTrue(Files.isDirectory(d)));

        TaxonomyBuilder.Result second = TaxonomyBuilder.materialize(dirs);
        assertEquals(0, second.getCreated());
        assertTrue(second.getFailed().isEmpty());
    }

    @Test
    void concurrentCallsForTheSameDirectoriesAllSucceed() throws Exception {
        List<Path> dirs = List.of(tmp.resolve("a/b"), tmp.resolve("a/c"), tmp.resolve("d/e"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<TaxonomyBuilder.Result>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> TaxonomyBuilder.materialize(dirs));
            }
            for (Future<TaxonomyBuilder.Result> f : pool.invokeAll(calls)) {
                assertTrue(f.get().getFailed().isEmpty());
            }
        } finally {
            pool.shutdownNow();
        }
        dirs.forEach(d -> assertTrue(Files.isDirectory(d)));
    }

    @Test
    void reportsDirectoriesThatCannotBeCreated() throws Exception {
        Files.writeString(tmp.resolve("blocked"), "not a directory");
        Path bad = tmp.resolve("blocked/model");
        Path good = tmp.resolve("fine/model");
        TaxonomyBuilder.Result result = TaxonomyBuilder.materialize(List.of(bad, good));
        assertEquals(List.of(bad), result.getFailed());
        assertEquals(1, result.getCreated());
        assertTrue(Files.isDirectory(good));
    }
}
