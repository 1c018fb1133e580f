package ai.docsite.richtext.cli;

import ai.docsite.richtext.detect.FormatKind;
import picocli.CommandLine;

public class FormatKindConverter implements CommandLine.ITypeConverter<FormatKind> {

    @Override
    public FormatKind convert(String value) {
        return FormatKind.from(value);
    }
}
