package imagecorpus.reorganizer;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds several model labels into one directory, e.g. {@code DreamShaper_v6} and
 * {@code DreamShaper_v7} into {@code dreamshaper}.
 * <p>
 * Rules file (JSON), target label to the labels merged into it:
 * <pre>
 * {
 *   "DreamShaper": ["DreamShaper_v6", "DreamShaper v7"],
 *   "Realistic Vision": ["realisticVisionV51", "realisticVisionV60B1"]
 * }
 * </pre>
 * Both sides are compared after {@link NameNormalizer#normalize(String)}, so the router maps
 * normalized labels to normalized labels and stays a pure function.
 */
public final class LabelRouter {

    private static final Gson GSON = new Gson();
    private static final Type RULES_TYPE = new TypeToken<Map<String, List<String>>>() {}.getType();

    private static final LabelRouter IDENTITY = new LabelRouter(Collections.emptyMap());

    private final Map<String, String> targetByLabel;

    private LabelRouter(Map<String, String> targetByLabel) {
        this.targetByLabel = targetByLabel;
    }

    public static LabelRouter identity() {
        return IDENTITY;
    }

    public static LabelRouter fromRules(Map<String, List<String>> rules) {
        Map<String, String> targets = new HashMap<>();
        for (Map.Entry<String, List<String>> rule : rules.entrySet()) {
            String target = NameNormalizer.normalize(rule.getKey());
            if (rule.getValue() == null) {
                continue;
            }
            for (String label : rule.getValue()) {
                String source = NameNormalizer.normalize(label);
                String previous = targets.put(source, target);
                if (previous != null && !previous.equals(target)) {
                    throw new IllegalArgumentException("Label '" + label + "' is merged into both '"
                        + previous + "' and '" + target + "'");
                }
            }
        }
        return new LabelRouter(Collections.unmodifiableMap(targets));
    }

    /** Load merge rules from a JSON file. */
    public static LabelRouter load(Path rulesFile) throws IOException {
        if (!Files.isRegularFile(rulesFile)) {
            throw new IllegalArgumentException("Merge rules file not found: " + rulesFile);
        }
        Map<String, List<String>> rules;
        try (Reader r = Files.newBufferedReader(rulesFile, StandardCharsets.UTF_8)) {
            rules = GSON.fromJson(r, RULES_TYPE);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid merge rules in " + rulesFile + ": " + e.getMessage(), e);
        }
        if (rules == null) {
            throw new IllegalArgumentException("Empty merge rules file: " + rulesFile);
        }
        return fromRules(rules);
    }

    /** @param normalizedLabel output of {@link NameNormalizer#normalize(String)} */
    public String route(String normalizedLabel) {
        return targetByLabel.getOrDefault(normalizedLabel, normalizedLabel);
    }

    public int size() {
        return targetByLabel.size();
    }
}
