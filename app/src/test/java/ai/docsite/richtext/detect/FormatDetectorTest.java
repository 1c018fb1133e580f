package ai.docsite.richtext.detect;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.rtf.StructuralValidator;
import org.junit.jupiter.api.Test;

class FormatDetectorTest {

    private final FormatDetector detector = new FormatDetector();

    @Test
    void detectsBalancedControlWordDocument() {
        DetectionResult result = detector.detect("{\\rtf1\\ansi{\\fonttbl{\\f0 Arial;}}\\pard\\f0\\fs22 Hello\\par}");

        assertThat(result.kind()).isEqualTo(FormatKind.RICH_CONTROL_WORD);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(FormatDetector.DEFAULT_MIN_CONFIDENCE);
    }

    @Test
    void unbalancedControlWordMarkerIsNotRichText() {
        assertThat(detector.detectFormat("{\\rtf1\\ansi{\\fonttbl x}\\par hello")).isEqualTo(FormatKind.PLAIN_TEXT);
    }

    @Test
    void detectsMarkupTree() {
        assertThat(detector.detect("<!DOCTYPE html><html><body>Hi</body></html>"))
                .isEqualTo(new DetectionResult(FormatKind.MARKUP_TREE, 90));
        assertThat(detector.detect("<p>Hello <b>there</b></p>"))
                .isEqualTo(new DetectionResult(FormatKind.MARKUP_TREE, 70));
    }

    @Test
    void detectsObjectNotation() {
        assertThat(detector.detect("  {\"name\": \"value\"}\n"))
                .isEqualTo(new DetectionResult(FormatKind.OBJECT_NOTATION, 80));
        assertThat(detector.detectFormat("[1, 2, 3]")).isEqualTo(FormatKind.OBJECT_NOTATION);
    }

    @Test
    void detectsCommaAndTabDelimitedTables() {
        assertThat(detector.detect("name,age,city\nAda,36,London\n"))
                .isEqualTo(new DetectionResult(FormatKind.TABULAR_COMMA, 60));
        assertThat(detector.detect("name\tage\nAda\t36"))
                .isEqualTo(new DetectionResult(FormatKind.TABULAR_TAB, 50));
    }

    @Test
    void commaWinsTabularTie() {
        assertThat(detector.detectFormat("a,b\tc\n1,2\t3")).isEqualTo(FormatKind.TABULAR_COMMA);
    }

    @Test
    void unevenDelimiterCountsAreNotTabular() {
        assertThat(detector.detectFormat("Hello, world\nNo commas here")).isEqualTo(FormatKind.PLAIN_TEXT);
    }

    @Test
    void detectsLightweightMarkupFromSeveralPatterns() {
        DetectionResult result = detector.detect("# Title\n\nThis is **bold** and a [link](https://example.com).");

        assertThat(result.kind()).isEqualTo(FormatKind.LIGHTWEIGHT_MARKUP);
        assertThat(result.confidence()).isEqualTo(60);
    }

    @Test
    void loneShortHeaderIsLightweightMarkupWithLowConfidence() {
        assertThat(detector.detect("# Title")).isEqualTo(new DetectionResult(FormatKind.LIGHTWEIGHT_MARKUP, 30));
    }

    @Test
    void singleInlinePatternIsPlainText() {
        assertThat(detector.detectFormat("I said **hello** yesterday")).isEqualTo(FormatKind.PLAIN_TEXT);
    }

    @Test
    void detectsGenericMarkup() {
        assertThat(detector.detect("<?xml version=\"1.0\"?><note><to>Ada</to></note>"))
                .isEqualTo(new DetectionResult(FormatKind.GENERIC_MARKUP, 60));
        assertThat(detector.detect("<note><to>Ada</to></note>"))
                .isEqualTo(new DetectionResult(FormatKind.GENERIC_MARKUP, 50));
    }

    @Test
    void nullAndBlankInputAreConfidentPlainText() {
        assertThat(detector.detect(null)).isEqualTo(DetectionResult.plainText());
        assertThat(detector.detect("   \n\t")).isEqualTo(DetectionResult.plainText());
        assertThat(detector.detect("Just some words.")).isEqualTo(DetectionResult.plainText());
    }

    @Test
    void resultsBelowMinimumConfidenceBecomePlainText() {
        FormatDetector strict = new FormatDetector(new StructuralValidator(), 50);

        DetectionResult result = strict.detect("# Title");

        assertThat(result.kind()).isEqualTo(FormatKind.PLAIN_TEXT);
        assertThat(result.confidence()).isEqualTo(30);
    }

    @Test
    void contentTypeHintWinsWhenContentPassesItsCheck() {
        String content = "- **first**, entry\n- second, entry";

        assertThat(detector.detectFormat(content)).isEqualTo(FormatKind.TABULAR_COMMA);
        assertThat(detector.detect(content, "text/markdown").kind()).isEqualTo(FormatKind.LIGHTWEIGHT_MARKUP);
    }

    @Test
    void contentTypeHintIsIgnoredWhenContentDoesNotMatch() {
        assertThat(detector.detect("plain words only", "text/html")).isEqualTo(DetectionResult.plainText());
        assertThat(detector.detect("<p>hi</p>", "text/plain").kind()).isEqualTo(FormatKind.MARKUP_TREE);
    }

    @Test
    void mapsClipboardContentTypes() {
        assertThat(FormatDetector.hintedKind("text/html; charset=utf-8")).contains(FormatKind.MARKUP_TREE);
        assertThat(FormatDetector.hintedKind("application/rtf")).contains(FormatKind.RICH_CONTROL_WORD);
        assertThat(FormatDetector.hintedKind("TEXT/CSV")).contains(FormatKind.TABULAR_COMMA);
        assertThat(FormatDetector.hintedKind("text/plain")).isEmpty();
        assertThat(FormatDetector.hintedKind(null)).isEmpty();
    }
}
