package ai.docsite.richtext.cli;

import ai.docsite.richtext.config.Config;
import ai.docsite.richtext.config.ConfigLoader;
import ai.docsite.richtext.config.SystemEnvironmentReader;
import ai.docsite.richtext.convert.ConversionFacade;
import ai.docsite.richtext.convert.ConversionResult;
import ai.docsite.richtext.detect.DetectionResult;
import ai.docsite.richtext.logging.LoggingConfigurator;
import ai.docsite.richtext.writer.DocumentWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and conversion engine.
 */
public final class CliApplication {

    static final int EXIT_IO_ERROR = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentWriter());
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.logLevel());

        MDC.put("input", config.input().map(Path::toString).orElse("stdin"));
        MDC.put("target", config.targetFormat().name());
        try {
            String content = documentWriter.read(config.input());
            ConversionFacade facade = ConversionFacade.create(config);
            String hint = config.contentType().orElse(null);

            if (config.detectOnly()) {
                DetectionResult detection = facade.detect(content, hint);
                LOGGER.info("Detected {} with confidence {}", detection.kind(), detection.confidence());
                documentWriter.write(Optional.empty(), detection.kind() + " " + detection.confidence() + System.lineSeparator());
                return 0;
            }

            ConversionResult result = config.sourceFormat()
                    .map(from -> facade.convert(from, config.targetFormat(), content))
                    .orElseGet(() -> facade.convert(config.targetFormat(), content, hint));
            if (result.softFailure()) {
                LOGGER.warn("Conversion from {} to {} not available; writing the input unchanged",
                        result.sourceFormat(), result.targetFormat());
            } else if (result.isRejected()) {
                LOGGER.warn("Converted output failed validation; wrote plain-text fallback");
            } else {
                LOGGER.info("Converted {} to {} ({})", result.sourceFormat(), result.targetFormat(), result.state());
            }
            documentWriter.write(config.output(), result.text());
            return 0;
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_IO_ERROR;
        } finally {
            MDC.remove("input");
            MDC.remove("target");
        }
    }
}
