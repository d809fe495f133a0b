package imagecorpus.reorganizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free-text model labels into directory names.
 * <p>
 * Output contains only {@code [a-z0-9._-]}, never has two underscores in a row, never starts or ends
 * with an underscore and is never empty. The mapping is pure and idempotent:
 * {@code normalize(normalize(s)).equals(normalize(s))}.
 * <pre>
 *   "Dream Shaper v6!"  -> "dream_shaper_v6"
 *   "SD 1.5"            -> "sd_1.5"
 *   ""  / "Unknown"     -> "unknown"
 * </pre>
 */
public final class NameNormalizer {

    public static final String UNKNOWN = "unknown";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern DOTS_ONLY = Pattern.compile("\\.+");

    private NameNormalizer() {}

    public static String normalize(String label) {
        if (label == null || label.isEmpty() || label.equals(MetadataRecord.UNKNOWN)) {
            return UNKNOWN;
        }
        String s = WHITESPACE.matcher(label).replaceAll("_");
        s = DISALLOWED.matcher(s).replaceAll("_");
        s = UNDERSCORES.matcher(s).replaceAll("_");
        s = stripUnderscores(s);
        s = s.toLowerCase(Locale.ROOT);
        // "." and ".." would point at the current or parent directory
        if (s.isEmpty() || DOTS_ONLY.matcher(s).matches()) {
            return UNKNOWN;
        }
        return s;
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }
}
