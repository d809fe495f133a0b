package imagecorpus.reorganizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LabelRouterTest {

    @TempDir
    Path tmp;

    @Test
    void identityLeavesLabelsAlone() {
        LabelRouter router = LabelRouter.identity();
        assertEquals("dreamshaper_v6", router.route("dreamshaper_v6"));
        assertEquals(0, router.size());
    }

    @Test
    void loadsRulesAndComparesNormalizedLabels() throws Exception {
        Path rules = tmp.resolve("rules.json");
        Files.writeString(rules, "{\n"
            + "  \"DreamShaper\": [\"DreamShaper_v6\", \"DreamShaper v7\"],\n"
            + "  \"Realistic Vision\": [\"realisticVisionV51\"]\n"
            + "}\n");
        LabelRouter router = LabelRouter.load(rules);
        assertEquals(3, router.size());
        assertEquals("dreamshaper", router.route(NameNormalizer.normalize("DreamShaper v7")));
        assertEquals("dreamshaper", router.route("dreamshaper_v6"));
        assertEquals("realistic_vision", router.route("realisticvisionv51"));
        assertEquals("other", router.route("other"));
    }

    @Test
    void routedLabelsStayNormalized() {
        LabelRouter router = LabelRouter.fromRules(Map.of("Dream Shaper!", List.of("ds")));
        String routed = router.route("ds");
        assertEquals(routed, NameNormalizer.normalize(routed));
    }

    @Test
    void labelMergedIntoTwoTargetsIsRejected() {
        Map<String, List<String>> rules = Map.of("A", List.of("x"), "B", List.of("X"));
        assertThrows(IllegalArgumentException.class, () -> LabelRouter.fromRules(rules));
    }

    @Test
    void badRulesFilesAreRejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> LabelRouter.load(tmp.resolve("missing.json")));

        Path array = tmp.resolve("array.json");
        Files.writeString(array, "[\"not\", \"an\", \"object\"]");
        assertThrows(IllegalArgumentException.class, () -> LabelRouter.load(array));

        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(IllegalArgumentException.class, () -> LabelRouter.load(empty));
    }
}
