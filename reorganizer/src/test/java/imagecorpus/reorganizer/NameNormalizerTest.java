package imagecorpus.reorganizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameNormalizerTest {

    private static final Pattern ALLOWED = Pattern.compile("[a-z0-9._-]+");

    @Test
    void replacesSpacesAndPunctuation() {
        assertEquals("dream_shaper_v6", NameNormalizer.normalize("Dream Shaper v6!"));
        assertEquals("sd_1.5", NameNormalizer.normalize("SD 1.5"));
        assertEquals("sd1.5", NameNormalizer.normalize("SD1.5"));
        assertEquals("a_b_c", NameNormalizer.normalize("a   b\tc"));
        assertEquals("foo_bar", NameNormalizer.normalize("__Foo__Bar__"));
        assertEquals("my-model.v2", NameNormalizer.normalize("my-model.v2"));
        assertEquals("pony_diffusion_v6_xl", NameNormalizer.normalize("Pony Diffusion (V6 XL)"));
    }

    @Test
    void nonAsciiLettersBecomeSeparators() {
        assertEquals("n_code_model", NameNormalizer.normalize("Ünïcode Model"));
        assertEquals("unknown", NameNormalizer.normalize("模型"));
    }

    @Test
    void emptyAndPlaceholderInputsFallBackToUnknown() {
        assertEquals("unknown", NameNormalizer.normalize(null));
        assertEquals("unknown", NameNormalizer.normalize(""));
        assertEquals("unknown", NameNormalizer.normalize("Unknown"));
        assertEquals("unknown", NameNormalizer.normalize("   "));
        assertEquals("unknown", NameNormalizer.normalize("!!!"));
    }

    @Test
    void dotOnlyResultsDoNotEscapeTheOutputRoot() {
        assertEquals("unknown", NameNormalizer.normalize("."));
        assertEquals("unknown", NameNormalizer.normalize(".."));
        assertEquals("unknown", NameNormalizer.normalize(" .. "));
        assertEquals(".._etc", NameNormalizer.normalize("../etc"));
    }

    @Test
    void idempotentAndAlwaysWithinAlphabet() {
        List<String> samples = new ArrayList<>(List.of(
            "Dream Shaper v6!", "SDXL 1.0", "  leading", "trailing  ", "a__b", "x/y\\z", "tab\there",
            "Ünïcode", "..", "-", "_", "name.with.dots", "UPPER_lower-123"));
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            StringBuilder sb = new StringBuilder();
            int len = random.nextInt(20);
            for (int j = 0; j < len; j++) {
                // mostly printable ASCII, sometimes anything from the BMP
                sb.append(random.nextInt(4) == 0 ? (char) random.nextInt(0xD800) : (char) (32 + random.nextInt(95)));
            }
            samples.add(sb.toString());
        }
        for (String s : samples) {
            String once = NameNormalizer.normalize(s);
            assertEquals(once, NameNormalizer.normalize(once), "not idempotent for '" + s + "'");
            assertEquals(once, NameNormalizer.normalize(s), "not deterministic for '" + s + "'");
            assertTrue(ALLOWED.matcher(once).matches(), "bad characters in '" + once + "'");
            assertFalse(once.contains("__"), "repeated separator in '" + once + "'");
            assertFalse(once.startsWith("_") || once.endsWith("_"), "edge separator in '" + once + "'");
        }
    }

    @Test
    void independentOfDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("title_i", NameNormalizer.normalize("TITLE I"));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
