package ai.docsite.richtext.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from editor style names to the control words that switch them on and off.
 *
 * <p>Values are raw control-word runs (for example {@code \b} or {@code \strike0}); they may be
 * empty but can never open or close a group, so overriding a style cannot unbalance a document.
 */
public final class StyleTable {

    public static final String BOLD = "bold";
    public static final String BOLD_OFF = "bold.off";
    public static final String ITALIC = "italic";
    public static final String ITALIC_OFF = "italic.off";
    public static final String UNDERLINE = "underline";
    public static final String UNDERLINE_OFF = "underline.off";
    public static final String STRIKE = "strike";
    public static final String STRIKE_OFF = "strike.off";
    public static final String CODE = "code";
    public static final String ALIGN_LEFT = "align.left";
    public static final String ALIGN_CENTER = "align.center";
    public static final String ALIGN_RIGHT = "align.right";
    public static final String ALIGN_JUSTIFY = "align.justify";

    private static final Map<String, String> DEFAULTS = defaultEntries();

    private final Map<String, String> entries;

    private StyleTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static StyleTable defaults() {
        return new StyleTable(DEFAULTS);
    }

    /**
     * Returns a copy of this table with the given entries replaced.
     */
    public StyleTable withOverrides(Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides");
        Map<String, String> merged = new LinkedHashMap<>(entries);
        overrides.forEach((name, value) -> {
            String key = normalizeName(name);
            if (!DEFAULTS.containsKey(key)) {
                throw new IllegalArgumentException("Unknown style name: " + name);
            }
            merged.put(key, requireControlWords(value, key));
        });
        return new StyleTable(merged);
    }

    public String controlWord(String styleName) {
        String value = entries.get(normalizeName(styleName));
        if (value == null) {
            throw new IllegalArgumentException("Unknown style name: " + styleName);
        }
        return value;
    }

    /**
     * Looks up an alignment variant such as {@code center}; unknown values fall back to left alignment.
     */
    public String alignment(String variant) {
        if (variant == null) {
            return entries.get(ALIGN_LEFT);
        }
        String key = "align." + variant.trim().toLowerCase(Locale.ROOT);
        return entries.getOrDefault(key, entries.get(ALIGN_LEFT));
    }

    public Map<String, String> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StyleTable table && entries.equals(table.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "StyleTable" + entries;
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Style name must not be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String requireControlWords(String value, String key) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        if (!trimmed.startsWith("\\") || trimmed.indexOf('{') >= 0 || trimmed.indexOf('}') >= 0) {
            throw new IllegalArgumentException("Style " + key + " must be a control-word run without groups: " + value);
        }
        boolean wellFormed = Arrays.stream(trimmed.substring(1).split("\\\\"))
                .allMatch(word -> word.matches("[a-z]+-?\\d*"));
        if (!wellFormed) {
            throw new IllegalArgumentException("Style " + key + " contains a malformed control word: " + value);
        }
        return trimmed;
    }

    private static Map<String, String> defaultEntries() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(BOLD, "\\b");
        map.put(BOLD_OFF, "\\b0");
        map.put(ITALIC, "\\i");
        map.put(ITALIC_OFF, "\\i0");
        map.put(UNDERLINE, "\\ul");
        map.put(UNDERLINE_OFF, "\\ulnone");
        map.put(STRIKE, "\\strike");
        map.put(STRIKE_OFF, "\\strike0");
        // The preamble declares a single font, so code runs only switch back to it.
        map.put(CODE, "\\f0");
        map.put(ALIGN_LEFT, "\\ql");
        map.put(ALIGN_CENTER, "\\qc");
        map.put(ALIGN_RIGHT, "\\qr");
        map.put(ALIGN_JUSTIFY, "\\qj");
        return Collections.unmodifiableMap(map);
    }
}
