package ai.docsite.richtext.convert;

import ai.docsite.richtext.config.Config;
import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.detect.DetectionResult;
import ai.docsite.richtext.detect.FormatDetector;
import ai.docsite.richtext.detect.FormatKind;
import ai.docsite.richtext.html.MarkupTreeTranspiler;
import ai.docsite.richtext.markdown.DefaultBlockTokenizer;
import ai.docsite.richtext.markdown.LightweightMarkupTranspiler;
import ai.docsite.richtext.reverse.ExternalConversionException;
import ai.docsite.richtext.reverse.ExternalConverter;
import ai.docsite.richtext.reverse.ExternalConverterFactory;
import ai.docsite.richtext.reverse.RegexExtractionConverter;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.StructuralValidator;
import ai.docsite.richtext.rtf.ValidationVerdict;
import ai.docsite.richtext.tabular.TabularTranspiler;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the conversion engine.
 *
 * <p>Text already in the requested format is returned unchanged, so converting converted output is
 * a no-op. Pairs with a native transpiler are converted in-process; control-word output is
 * validated and replaced by an escaped plain-text document when its structure is rejected. Other
 * pairs go to the reverse converter; when it fails the original text comes back flagged as a soft
 * failure. Document properties are read once per call and can be swapped at any time.
 */
public class ConversionFacade {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionFacade.class);

    private final AtomicReference<DocumentProperties> properties;
    private final FormatDetector detector;
    private final StructuralValidator validator;
    private final ExternalConverter reverseConverter;
    private final ExternalConverter nativeReverseConverter;
    private final PlainTextTranspiler plainText;
    private final Map<ConversionPair, Transpiler> transpilers;

    public ConversionFacade(DocumentProperties properties) {
        this(properties, new FormatDetector(), new RegexExtractionConverter());
    }

    public ConversionFacade(DocumentProperties properties, FormatDetector detector, ExternalConverter reverseConverter) {
        this(properties, detector, reverseConverter, new RegexExtractionConverter());
    }

    public ConversionFacade(DocumentProperties properties, FormatDetector detector,
                            ExternalConverter reverseConverter, ExternalConverter nativeReverseConverter) {
        this(properties, detector, reverseConverter, nativeReverseConverter, Map.of());
    }

    /**
     * @param overrides transpilers that replace the built-in ones for their pairs
     */
    ConversionFacade(DocumentProperties properties, FormatDetector detector, ExternalConverter reverseConverter,
                     ExternalConverter nativeReverseConverter, Map<ConversionPair, Transpiler> overrides) {
        this.properties = new AtomicReference<>(Objects.requireNonNull(properties, "properties"));
        this.detector = Objects.requireNonNull(detector, "detector");
        this.reverseConverter = Objects.requireNonNull(reverseConverter, "reverseConverter");
        this.nativeReverseConverter = Objects.requireNonNull(nativeReverseConverter, "nativeReverseConverter");
        this.validator = new StructuralValidator();
        ControlWordEmitter emitter = new ControlWordEmitter();
        this.plainText = new PlainTextTranspiler(emitter);
        Map<ConversionPair, Transpiler> registry = new HashMap<>(registry(emitter, plainText));
        registry.putAll(overrides);
        this.transpilers = Map.copyOf(registry);
    }

    public static ConversionFacade create(Config config) {
        ExternalConverterFactory converters = ExternalConverterFactory.forConfig(config.externalConverterConfig());
        FormatDetector detector = new FormatDetector(new StructuralValidator(), config.detectionMinConfidence());
        return new ConversionFacade(config.documentProperties(), detector,
                converters.select(config.externalConverterConfig().kind()), converters.nativeConverter());
    }

    private static Map<ConversionPair, Transpiler> registry(ControlWordEmitter emitter, PlainTextTranspiler plainText) {
        LightweightMarkupTranspiler markdown = new LightweightMarkupTranspiler(new DefaultBlockTokenizer(), emitter);
        MarkupTreeTranspiler markup = new MarkupTreeTranspiler(emitter);
        TabularTranspiler tabular = new TabularTranspiler(emitter);

        Map<ConversionPair, Transpiler> registry = new HashMap<>();
        registry.put(ConversionPair.of(FormatKind.LIGHTWEIGHT_MARKUP, FormatKind.RICH_CONTROL_WORD), markdown::toRichControlWord);
        registry.put(ConversionPair.of(FormatKind.LIGHTWEIGHT_MARKUP, FormatKind.MARKUP_TREE), markdown::toMarkupTree);
        registry.put(ConversionPair.of(FormatKind.MARKUP_TREE, FormatKind.RICH_CONTROL_WORD), markup::toRichControlWord);
        registry.put(ConversionPair.of(FormatKind.PLAIN_TEXT, FormatKind.RICH_CONTROL_WORD), plainText::toRichControlWord);
        registry.put(ConversionPair.of(FormatKind.PLAIN_TEXT, FormatKind.MARKUP_TREE), (text, props) -> plainText.toMarkupTree(text));
        for (FormatKind structured : new FormatKind[] {FormatKind.OBJECT_NOTATION, FormatKind.GENERIC_MARKUP}) {
            registry.put(ConversionPair.of(structured, FormatKind.RICH_CONTROL_WORD), plainText::toRichControlWord);
            registry.put(ConversionPair.of(structured, FormatKind.MARKUP_TREE), (text, props) -> plainText.toPreformattedMarkup(text));
        }
        for (FormatKind table : new FormatKind[] {FormatKind.TABULAR_COMMA, FormatKind.TABULAR_TAB}) {
            char delimiter = table.delimiter().orElseThrow();
            registry.put(ConversionPair.of(table, FormatKind.RICH_CONTROL_WORD),
                    (text, props) -> tabular.toRichControlWord(text, delimiter, props));
            registry.put(ConversionPair.of(table, FormatKind.MARKUP_TREE),
                    (text, props) -> tabular.toMarkupTree(text, delimiter));
        }
        return registry;
    }

    public DetectionResult detect(String content) {
        return detector.detect(content);
    }

    public DetectionResult detect(String content, String contentTypeHint) {
        return detector.detect(content, contentTypeHint);
    }

    public FormatKind detectFormat(String content) {
        return detector.detectFormat(content);
    }

    /**
     * Converts text whose format is detected first.
     */
    public ConversionResult convert(FormatKind to, String text) {
        return convert(to, text, null);
    }

    public ConversionResult convert(FormatKind to, String text, String contentTypeHint) {
        requireText(text);
        LOGGER.debug("{} -> {}", ConversionState.UNCONVERTED, ConversionState.DETECTING);
        DetectionResult detected = detector.detect(text, contentTypeHint);
        LOGGER.debug("Detected {} with confidence {}", detected.kind(), detected.confidence());
        return convert(detected.kind(), to, text);
    }

    public ConversionResult convert(FormatKind from, FormatKind to, String text) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        requireText(text);
        DocumentProperties current = properties.get();

        if (from == to || detector.detectFormat(text) == to) {
            LOGGER.debug("Text already in {}, returning it unchanged", to);
            return ConversionResult.unchanged(text, from, to);
        }

        LOGGER.debug("{} -> {} ({} to {})", ConversionState.DETECTING, ConversionState.CONVERTING, from, to);
        Transpiler transpiler = transpilers.get(ConversionPair.of(from, to));
        if (transpiler == null) {
            return delegate(from, to, text, current);
        }
        String output;
        try {
            output = transpiler.transpile(text, current);
        } catch (RuntimeException ex) {
            LOGGER.warn("Native conversion {} to {} failed: {}", from, to, ex.getMessage());
            return to == FormatKind.RICH_CONTROL_WORD
                    ? reject(text, from, current)
                    : ConversionResult.softFailure(text, from, to);
        }
        LOGGER.debug("{} -> {}", ConversionState.CONVERTING, ConversionState.CONVERTED);
        return to == FormatKind.RICH_CONTROL_WORD
                ? validate(output, text, from, current)
                : new ConversionResult(output, from, to, ConversionState.CONVERTED, false);
    }

    /**
     * Converts any text into a control-word document.
     *
     * @throws InvalidInputTypeException when the input is not text
     */
    public ConversionResult toRichText(Object input) {
        if (!(input instanceof CharSequence sequence)) {
            throw new InvalidInputTypeException("Expected text but received "
                    + (input == null ? "null" : input.getClass().getName()));
        }
        return convert(FormatKind.RICH_CONTROL_WORD, sequence.toString());
    }

    public ConversionResult fromRichText(String richText, FormatKind target) {
        return convert(FormatKind.RICH_CONTROL_WORD, target, richText);
    }

    /**
     * Converts text into {@code through} and back into its detected format.
     */
    public ConversionResult roundTrip(String text, FormatKind through) {
        requireText(text);
        FormatKind origin = detector.detectFormat(text);
        ConversionResult forward = convert(origin, through, text);
        if (forward.softFailure() || forward.isRejected()) {
            return forward;
        }
        return convert(through, origin, forward.text());
    }

    /**
     * Replaces the document properties used by subsequent conversions.
     */
    public void reload(DocumentProperties updated) {
        DocumentProperties previous = properties.getAndSet(Objects.requireNonNull(updated, "updated"));
        LOGGER.info("Document properties reloaded (font {} {}pt, was {} {}pt)",
                updated.fontFamily(), updated.fontSize(), previous.fontFamily(), previous.fontSize());
    }

    public DocumentProperties properties() {
        return properties.get();
    }

    private ConversionResult validate(String output, String original, FormatKind from, DocumentProperties current) {
        ValidationVerdict verdict = validator.validate(output);
        if (!verdict.isValid()) {
            LOGGER.warn("Generated control words rejected (balance delta {}, confidence {}); falling back to plain text",
                    verdict.balanceDelta(), verdict.confidence());
            return reject(original, from, current);
        }
        LOGGER.debug("{} -> {} (confidence {})", ConversionState.CONVERTED, ConversionState.VALIDATED, verdict.confidence());
        return new ConversionResult(output, from, FormatKind.RICH_CONTROL_WORD, ConversionState.VALIDATED, false);
    }

    private ConversionResult reject(String original, FormatKind from, DocumentProperties current) {
        return new ConversionResult(plainText.toRichControlWord(original, current), from,
                FormatKind.RICH_CONTROL_WORD, ConversionState.REJECTED, false);
    }

    private ConversionResult delegate(FormatKind from, FormatKind to, String text, DocumentProperties current) {
        try {
            String output = reverse(reverseConverter, from, to, text);
            return to == FormatKind.RICH_CONTROL_WORD
                    ? validate(output, text, from, current)
                    : new ConversionResult(output, from, to, ConversionState.CONVERTED, false);
        } catch (ExternalConversionException ex) {
            if (from == FormatKind.RICH_CONTROL_WORD && reverseConverter != nativeReverseConverter) {
                LOGGER.warn("Reverse conversion to {} failed ({}); using native extraction", to, ex.getMessage());
                try {
                    return new ConversionResult(reverse(nativeReverseConverter, from, to, text), from, to,
                            ConversionState.CONVERTED, false);
                } catch (ExternalConversionException nativeFailure) {
                    LOGGER.warn("Native extraction failed: {}", nativeFailure.getMessage());
                }
            } else {
                LOGGER.warn("No conversion from {} to {}: {}", from, to, ex.getMessage());
            }
            return ConversionResult.softFailure(text, from, to);
        }
    }

    private static String reverse(ExternalConverter converter, FormatKind from, FormatKind to, String text) {
        try {
            return converter.convert(from, to, text);
        } catch (ExternalConversionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ExternalConversionException("Conversion " + from + " to " + to + " failed: " + ex, ex);
        }
    }

    private static void requireText(String text) {
        if (text == null) {
            throw new InvalidInputTypeException("Text must not be null");
        }
    }
}
