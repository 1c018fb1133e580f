package ai.docsite.richtext.cli;

import ai.docsite.richtext.config.ReverseConverterKind;
import picocli.CommandLine;

public class ReverseConverterKindConverter implements CommandLine.ITypeConverter<ReverseConverterKind> {

    @Override
    public ReverseConverterKind convert(String value) {
        return ReverseConverterKind.from(value);
    }
}
