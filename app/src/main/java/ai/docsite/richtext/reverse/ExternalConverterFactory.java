package ai.docsite.richtext.reverse;

import ai.docsite.richtext.config.ExternalConverterConfig;
import ai.docsite.richtext.config.ReverseConverterKind;
import java.util.Objects;

/**
 * Provides the reverse converter for the configured kind.
 */
public class ExternalConverterFactory {

    private final ExternalConverter nativeConverter;
    private final ExternalConverter processConverter;

    public ExternalConverterFactory(ExternalConverter nativeConverter, ExternalConverter processConverter) {
        this.nativeConverter = Objects.requireNonNull(nativeConverter, "nativeConverter");
        this.processConverter = Objects.requireNonNull(processConverter, "processConverter");
    }

    public static ExternalConverterFactory forConfig(ExternalConverterConfig config) {
        return new ExternalConverterFactory(new RegexExtractionConverter(), new ProcessExternalConverter(config));
    }

    public ExternalConverter select(ReverseConverterKind kind) {
        return switch (kind) {
            case NATIVE -> nativeConverter;
            case EXTERNAL -> processConverter;
        };
    }

    public ExternalConverter nativeConverter() {
        return nativeConverter;
    }
}
