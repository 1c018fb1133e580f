package ai.docsite.richtext.config;

import java.util.Locale;

/**
 * 8-bit RGB triple used for the single color table entry.
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    public RgbColor {
        requireChannel(red, "red");
        requireChannel(green, "green");
        requireChannel(blue, "blue");
    }

    /**
     * Parses {@code #RRGGBB} or {@code RRGGBB}.
     */
    public static RgbColor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Color must be provided");
        }
        String hex = raw.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() != 6) {
            throw new IllegalArgumentException("Color must use the #RRGGBB form: " + raw);
        }
        try {
            int value = Integer.parseInt(hex, 16);
            return new RgbColor((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid color value: " + raw, ex);
        }
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    private static void requireChannel(int value, String name) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be between 0 and 255");
        }
    }
}
