package ai.docsite.richtext.cli;

import ai.docsite.richtext.config.LogFormat;
import ai.docsite.richtext.config.ReverseConverterKind;
import ai.docsite.richtext.detect.FormatKind;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "richtext-converter", mixinStandardHelpOptions = true, version = "richtext-converter 0.1.0",
        description = "Detects document formats and converts between text, Markdown, HTML and RTF")
public class CliArguments {

    @CommandLine.Option(names = "--detect", description = "Print the detected format and confidence instead of converting")
    private boolean detectOnly;

    @CommandLine.Option(names = "--from", converter = FormatKindConverter.class,
            description = "Source format (rtf, html, markdown, json, csv, tsv, xml, text); detected when omitted", paramLabel = "FORMAT")
    private FormatKind sourceFormat;

    @CommandLine.Option(names = "--to", converter = FormatKindConverter.class,
            description = "Target format, rtf by default", paramLabel = "FORMAT")
    private FormatKind targetFormat;

    @CommandLine.Option(names = "--input", description = "Input document; standard input when omitted", paramLabel = "PATH")
    private Path input;

    @CommandLine.Option(names = "--output", description = "Output document; standard output when omitted", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--content-type", description = "Clipboard content type hint such as text/html", paramLabel = "MIME")
    private String contentType;

    @CommandLine.Option(names = "--reverse-converter", converter = ReverseConverterKindConverter.class,
            description = "Converter for pairs without a native transpiler: native or external")
    private ReverseConverterKind reverseConverter;

    @CommandLine.Option(names = "--font-family", description = "Document font family", paramLabel = "NAME")
    private String fontFamily;

    @CommandLine.Option(names = "--font-size", description = "Document font size in points", paramLabel = "POINTS")
    private Integer fontSize;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public boolean detectOnly() {
        return detectOnly;
    }

    public FormatKind sourceFormat() {
        return sourceFormat;
    }

    public FormatKind targetFormat() {
        return targetFormat;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public String contentType() {
        return contentType;
    }

    public ReverseConverterKind reverseConverter() {
        return reverseConverter;
    }

    public String fontFamily() {
        return fontFamily;
    }

    public Integer fontSize() {
        return fontSize;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
