package imagecorpus.reorganizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CopyPlannerTest {

    @TempDir
    Path tmp;

    private Path source;
    private Path out;
    private SourceIndex index;

    @BeforeEach
    void setUp() throws Exception {
        source = tmp.resolve("src");
        out = tmp.resolve("out");
        write(source.resolve("dir1/a.png"));
        write(source.resolve("dir2/deep/b.png"));
        write(source.resolve("dir2/deep/b.json"));
        write(source.resolve("c.png"));
        index = SourceIndexer.build(source);
    }

    @AfterEach
    void tearDown() throws Exception {
        index.close();
    }

    private static void write(Path file) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, file.getFileName().toString());
    }

    private static List<MetadataRecord> scenario() {
        return List.of(
            new MetadataRecord("a.png", "SD1.5", "DreamShaper_v6", "Checkpoint"),
            new MetadataRecord("b.png", "SD1.5", "someLora", "LORA"),
            new MetadataRecord("missing.png", "SDXL", "x", "Checkpoint"));
    }

    @Test
    void resolvesRecordsIntoTheTaxonomy() throws Exception {
        CopyPlan plan = new CopyPlanner(index, out).plan(scenario());
        Path root = out.toAbsolutePath().normalize();

        assertEquals(3, plan.getParsedRecords());
        assertEquals(2, plan.getResolved());
        assertEquals(1, plan.getSkippedUnresolved());
        assertEquals(List.of("missing.png"), plan.getUnresolvedSample());

        CopyJob a = plan.getJobs().get(0);
        assertEquals(source.resolve("dir1/a.png").toAbsolutePath().normalize(), a.getSource());
        assertEquals(root.resolve("sd1.5/dreamshaper_v6/a.png"), a.getDestination());
        CopyJob b = plan.getJobs().get(1);
        assertEquals(root.resolve("sd1.5/sd1.5/b.png"), b.getDestination());
        assertNull(b.getSidecarSource());

        assertEquals(Set.of(root.resolve("sd1.5/dreamshaper_v6"), root.resolve("sd1.5/sd1.5")),
            plan.getTargetDirectories());
    }

    @Test
    void jobCountInvariantHolds() throws Exception {
        CopyPlan plan = new CopyPlanner(index, out).plan(scenario());
        assertEquals(plan.getParsedRecords(), plan.getJobs().size() + plan.getSkippedUnresolved());
    }

    @Test
    void jobsDoNotDependOnRecordOrder() throws Exception {
        List<MetadataRecord> shuffled = new ArrayList<>(scenario());
        Collections.reverse(shuffled);
        CopyPlan forward = new CopyPlanner(index, out).plan(scenario());
        CopyPlan backward = new CopyPlanner(index, out).plan(shuffled);
        assertEquals(new HashSet<>(forward.getJobs()), new HashSet<>(backward.getJobs()));
        assertEquals(forward.getTargetDirectories(), backward.getTargetDirectories());
    }

    @Test
    void unknownLabelsLandInUnknownDirectories() throws Exception {
        CopyPlan plan = new CopyPlanner(index, out).plan(List.of(new MetadataRecord("c.png", "nan", "", "Checkpoint")));
        assertEquals(out.toAbsolutePath().normalize().resolve("unknown/unknown/c.png"),
            plan.getJobs().get(0).getDestination());
    }

    @Test
    void attachesSidecarsWhenRequested() throws Exception {
        CopyPlan plan = new CopyPlanner(index, out, LabelRouter.identity(), true).plan(scenario());
        CopyJob b = plan.getJobs().get(1);
        assertEquals(source.resolve("dir2/deep/b.json").toAbsolutePath().normalize(), b.getSidecarSource());
        assertEquals(b.getDestination().resolveSibling("b.json"), b.getSidecarDestination());
        assertNull(plan.getJobs().get(0).getSidecarSource());
        assertEquals(1, plan.getSidecars());
    }

    @Test
    void routerMergesModelDirectories() throws Exception {
        LabelRouter router = LabelRouter.fromRules(Map.of("DreamShaper", List.of("DreamShaper_v6", "DreamShaper v7")));
        CopyPlan plan = new CopyPlanner(index, out, router, false).plan(scenario());
        assertEquals(out.toAbsolutePath().normalize().resolve("sd1.5/dreamshaper/a.png"),
            plan.getJobs().get(0).getDestination());
    }

    @Test
    void unresolvedSampleIsBounded() throws Exception {
        List<MetadataRecord> records = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            records.add(new MetadataRecord("gone-" + i + ".png", "SD1.5", "m", "Checkpoint"));
        }
        CopyPlan plan = new CopyPlanner(index, out).plan(records);
        assertEquals(50, plan.getSkippedUnresolved());
        assertEquals(20, plan.getUnresolvedSample().size());
        assertEquals("gone-0.png", plan.getUnresolvedSample().get(0));
        assertTrue(plan.getJobs().isEmpty());
    }

    @Test
    void planIsImmutable() throws Exception {
        CopyPlan plan = new CopyPlanner(index, out).plan(scenario());
        assertThrows(UnsupportedOperationException.class, () -> plan.getJobs().clear());
    }
}
