package ai.docsite.richtext.config;

import java.util.Objects;

/**
 * Immutable document defaults shared by every conversion.
 *
 * <p>Sizes follow the control-word conventions: {@code fontSize} is in points and is emitted as
 * half-points, spacing, line height and margins are in twips.
 */
public record DocumentProperties(
        String fontFamily,
        int fontSize,
        RgbColor fontColor,
        int charset,
        int languageId,
        int paragraphSpacing,
        int lineHeight,
        int margin,
        StyleTable styles,
        boolean legacyUnderscoreUnderline
) {

    public static final String DEFAULT_FONT_FAMILY = "Calibri";
    public static final int DEFAULT_FONT_SIZE = 11;
    public static final int DEFAULT_CHARSET = 0;
    public static final int DEFAULT_LANGUAGE_ID = 1033;
    public static final int DEFAULT_PARAGRAPH_SPACING = 200;
    public static final int DEFAULT_LINE_HEIGHT = 276;
    public static final int DEFAULT_MARGIN = 1440;

    public DocumentProperties {
        fontFamily = requireFontFamily(fontFamily);
        if (fontSize < 1 || fontSize > 1638) {
            throw new IllegalArgumentException("fontSize must be between 1 and 1638 points");
        }
        fontColor = Objects.requireNonNull(fontColor, "fontColor");
        if (charset < 0 || charset > 255) {
            throw new IllegalArgumentException("charset must be between 0 and 255");
        }
        if (languageId < 0) {
            throw new IllegalArgumentException("languageId must not be negative");
        }
        requireNonNegative(paragraphSpacing, "paragraphSpacing");
        requireNonNegative(lineHeight, "lineHeight");
        requireNonNegative(margin, "margin");
        styles = Objects.requireNonNull(styles, "styles");
    }

    public static DocumentProperties defaults() {
        return new DocumentProperties(DEFAULT_FONT_FAMILY, DEFAULT_FONT_SIZE, RgbColor.BLACK, DEFAULT_CHARSET,
                DEFAULT_LANGUAGE_ID, DEFAULT_PARAGRAPH_SPACING, DEFAULT_LINE_HEIGHT, DEFAULT_MARGIN,
                StyleTable.defaults(), false);
    }

    /**
     * Font size in half-points, the unit of the {@code \fs} control word.
     */
    public int fontSizeHalfPoints() {
        return halfPoints(fontSize);
    }

    public static int halfPoints(int points) {
        return points * 2;
    }

    public DocumentProperties withFontFamily(String family) {
        return new DocumentProperties(family, fontSize, fontColor, charset, languageId, paragraphSpacing,
                lineHeight, margin, styles, legacyUnderscoreUnderline);
    }

    public DocumentProperties withFontSize(int size) {
        return new DocumentProperties(fontFamily, size, fontColor, charset, languageId, paragraphSpacing,
                lineHeight, margin, styles, legacyUnderscoreUnderline);
    }

    public DocumentProperties withLegacyUnderscoreUnderline(boolean enabled) {
        return new DocumentProperties(fontFamily, fontSize, fontColor, charset, languageId, paragraphSpacing,
                lineHeight, margin, styles, enabled);
    }

    private static String requireFontFamily(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fontFamily must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.indexOf('{') >= 0 || trimmed.indexOf('}') >= 0 || trimmed.indexOf('\\') >= 0
                || trimmed.indexOf(';') >= 0) {
            throw new IllegalArgumentException("fontFamily must not contain control characters: " + value);
        }
        return trimmed;
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
