package ai.docsite.richtext.detect;

import ai.docsite.richtext.rtf.StructuralValidator;
import ai.docsite.richtext.rtf.ValidationVerdict;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heuristic classifier for untyped text.
 *
 * <p>Checks run in a fixed priority order and the first match wins: control words, markup tree,
 * object notation, tabular, lightweight markup, generic markup, plain text. A match whose
 * confidence is below the configured minimum is reported as plain text.
 */
public class FormatDetector {

    public static final int DEFAULT_MIN_CONFIDENCE = 10;

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatDetector.class);

    private static final String RTF_MARKER = "{\\rtf";
    private static final Pattern DOCUMENT_TAG = Pattern.compile("(?i)<!doctype\\s+html|<html[\\s>]|<body[\\s>]");
    private static final Pattern BLOCK_TAG = Pattern.compile("(?i)<(div|span|p|h[1-6]|table|ul|ol)(\\s[^>]*)?/?>");
    private static final Pattern XML_DECLARATION = Pattern.compile("^\\s*<\\?xml[\\s?]");
    private static final Pattern TAG_PAIR = Pattern.compile("<([A-Za-z][\\w:.-]*)(\\s[^>]*)?>.*?</\\1\\s*>", Pattern.DOTALL);
    private static final Set<String> KNOWN_BLOCK_TAGS = Set.of(
            "html", "body", "head", "div", "span", "p", "h1", "h2", "h3", "h4", "h5", "h6", "table", "ul", "ol");

    private static final Pattern HEADER = Pattern.compile("(?m)^#{1,6}[ \\t]+\\S");
    private static final List<Pattern> MARKDOWN_PATTERNS = List.of(
            HEADER,
            Pattern.compile("(?m)^[ \\t]*[-*+][ \\t]+\\S"),
            Pattern.compile("(?m)^[ \\t]*\\d{1,9}[.)][ \\t]+\\S"),
            Pattern.compile("\\*\\*[^*\\n]+\\*\\*|__[^_\\n]+__"),
            Pattern.compile("(?<![*\\w])\\*(?![*\\s])[^*\\n]+(?<![*\\s])\\*(?![*\\w])"),
            Pattern.compile("~~[^~\\n]+~~"),
            Pattern.compile("`[^`\\n]+`"),
            Pattern.compile("(?m)^[ \\t]*```"),
            Pattern.compile("(?<!!)\\[[^\\]\\n]+\\]\\([^)\\s]+\\)"),
            Pattern.compile("!\\[[^\\]\\n]*\\]\\([^)\\s]+\\)"));
    private static final int MARKDOWN_MIN_HITS = 2;
    private static final int LONE_HEADER_MAX_LINES = 3;

    private final StructuralValidator validator;
    private final int minConfidence;

    public FormatDetector() {
        this(new StructuralValidator(), DEFAULT_MIN_CONFIDENCE);
    }

    public FormatDetector(StructuralValidator validator, int minConfidence) {
        this.validator = Objects.requireNonNull(validator, "validator");
        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 100");
        }
        this.minConfidence = minConfidence;
    }

    public FormatKind detectFormat(String content) {
        return detect(content).kind();
    }

    public DetectionResult detect(String content) {
        return detect(content, null);
    }

    /**
     * Classifies content, preferring the format named by a clipboard content type when the content
     * passes that format's own check.
     */
    public DetectionResult detect(String content, String contentTypeHint) {
        if (content == null || content.isBlank()) {
            return DetectionResult.plainText();
        }
        try {
            Optional<DetectionResult> hinted = hintedKind(contentTypeHint)
                    .flatMap(kind -> check(kind, content).stream()
                            .mapToObj(confidence -> new DetectionResult(kind, confidence))
                            .findFirst());
            if (hinted.isPresent()) {
                LOGGER.debug("Content type {} confirmed as {}", contentTypeHint, hinted.get().kind());
                return applyThreshold(hinted.get());
            }
            return applyThreshold(classify(content));
        } catch (RuntimeException ex) {
            LOGGER.warn("Format detection failed, treating content as plain text: {}", ex.getMessage());
            return DetectionResult.plainText();
        }
    }

    private DetectionResult classify(String content) {
        for (FormatKind kind : List.of(FormatKind.RICH_CONTROL_WORD, FormatKind.MARKUP_TREE,
                FormatKind.OBJECT_NOTATION, FormatKind.TABULAR_COMMA, FormatKind.LIGHTWEIGHT_MARKUP,
                FormatKind.GENERIC_MARKUP)) {
            if (kind == FormatKind.TABULAR_COMMA) {
                Optional<DetectionResult> tabular = tabular(content);
                if (tabular.isPresent()) {
                    return tabular.get();
                }
                continue;
            }
            OptionalInt confidence = check(kind, content);
            if (confidence.isPresent()) {
                return new DetectionResult(kind, confidence.getAsInt());
            }
        }
        return DetectionResult.plainText();
    }

    private DetectionResult applyThreshold(DetectionResult result) {
        if (result.kind() != FormatKind.PLAIN_TEXT && result.confidence() < minConfidence) {
            LOGGER.debug("Detection {} below minimum confidence {}", result, minConfidence);
            return new DetectionResult(FormatKind.PLAIN_TEXT, result.confidence());
        }
        return result;
    }

    private OptionalInt check(FormatKind kind, String content) {
        return switch (kind) {
            case RICH_CONTROL_WORD -> richControlWord(content);
            case MARKUP_TREE -> markupTree(content);
            case OBJECT_NOTATION -> objectNotation(content);
            case TABULAR_COMMA, TABULAR_TAB -> tabular(content)
                    .filter(result -> result.kind() == kind)
                    .map(result -> OptionalInt.of(result.confidence()))
                    .orElse(OptionalInt.empty());
            case LIGHTWEIGHT_MARKUP -> lightweightMarkup(content);
            case GENERIC_MARKUP -> genericMarkup(content);
            case PLAIN_TEXT -> OptionalInt.of(100);
        };
    }

    private OptionalInt richControlWord(String content) {
        if (!content.contains(RTF_MARKER)) {
            return OptionalInt.empty();
        }
        ValidationVerdict verdict = validator.validate(content);
        if (!verdict.isValid()) {
            LOGGER.debug("Control-word marker present but structure rejected (delta={}, confidence={})",
                    verdict.balanceDelta(), verdict.confidence());
            return OptionalInt.empty();
        }
        return OptionalInt.of(verdict.confidence());
    }

    private OptionalInt markupTree(String content) {
        if (DOCUMENT_TAG.matcher(content).find()) {
            return OptionalInt.of(90);
        }
        if (BLOCK_TAG.matcher(content).find()) {
            return OptionalInt.of(70);
        }
        return OptionalInt.empty();
    }

    private OptionalInt objectNotation(String content) {
        String trimmed = content.trim();
        if (trimmed.length() < 2) {
            return OptionalInt.empty();
        }
        char first = trimmed.charAt(0);
        char last = trimmed.charAt(trimmed.length() - 1);
        if ((first == '{' && last == '}') || (first == '[' && last == ']')) {
            return OptionalInt.of(80);
        }
        return OptionalInt.empty();
    }

    /**
     * Compares delimiter counts on the first two lines; equal positive comma counts win ties.
     */
    Optional<DetectionResult> tabular(String content) {
        String[] lines = content.strip().split("\\r?\\n|\\r", -1);
        if (lines.length < 2) {
            return Optional.empty();
        }
        int commasFirst = count(lines[0], ',');
        int commasSecond = count(lines[1], ',');
        int tabsFirst = count(lines[0], '\t');
        int tabsSecond = count(lines[1], '\t');
        if (commasFirst > 0 && commasFirst == commasSecond && commasFirst >= tabsFirst) {
            return Optional.of(new DetectionResult(FormatKind.TABULAR_COMMA, tabularConfidence(commasFirst)));
        }
        if (tabsFirst > 0 && tabsFirst == tabsSecond && tabsFirst >= commasFirst) {
            return Optional.of(new DetectionResult(FormatKind.TABULAR_TAB, tabularConfidence(tabsFirst)));
        }
        return Optional.empty();
    }

    private OptionalInt lightweightMarkup(String content) {
        int hits = 0;
        for (Pattern pattern : MARKDOWN_PATTERNS) {
            if (pattern.matcher(content).find()) {
                hits++;
            }
        }
        if (hits >= MARKDOWN_MIN_HITS) {
            return OptionalInt.of(Math.min(100, hits * 20));
        }
        if (hits == 1 && HEADER.matcher(content).find()
                && content.strip().split("\\r?\\n|\\r").length <= LONE_HEADER_MAX_LINES) {
            return OptionalInt.of(30);
        }
        return OptionalInt.empty();
    }

    private OptionalInt genericMarkup(String content) {
        if (XML_DECLARATION.matcher(content).find()) {
            return OptionalInt.of(60);
        }
        Matcher matcher = TAG_PAIR.matcher(content);
        while (matcher.find()) {
            if (!KNOWN_BLOCK_TAGS.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                return OptionalInt.of(50);
            }
        }
        return OptionalInt.empty();
    }

    private static int tabularConfidence(int delimiters) {
        return Math.min(100, 40 + 10 * delimiters);
    }

    private static int count(String line, char delimiter) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == delimiter) {
                count++;
            }
        }
        return count;
    }

    /**
     * Maps a clipboard content type to the format it announces; {@code text/plain} announces nothing.
     */
    static Optional<FormatKind> hintedKind(String contentTypeHint) {
        if (contentTypeHint == null || contentTypeHint.isBlank()) {
            return Optional.empty();
        }
        String mime = contentTypeHint.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return switch (mime) {
            case "text/rtf", "application/rtf" -> Optional.of(FormatKind.RICH_CONTROL_WORD);
            case "text/html", "application/xhtml+xml" -> Optional.of(FormatKind.MARKUP_TREE);
            case "text/markdown", "text/x-markdown" -> Optional.of(FormatKind.LIGHTWEIGHT_MARKUP);
            case "text/csv" -> Optional.of(FormatKind.TABULAR_COMMA);
            case "text/tab-separated-values" -> Optional.of(FormatKind.TABULAR_TAB);
            case "application/json" -> Optional.of(FormatKind.OBJECT_NOTATION);
            case "application/xml", "text/xml" -> Optional.of(FormatKind.GENERIC_MARKUP);
            default -> Optional.empty();
        };
    }
}
