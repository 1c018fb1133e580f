package ai.docsite.richtext.reverse;

import ai.docsite.richtext.config.ExternalConverterConfig;
import ai.docsite.richtext.detect.FormatKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates conversion to an external command that reads the document on stdin and writes the
 * result to stdout, such as {@code pandoc -f {from} -t {to}}.
 */
public class ProcessExternalConverter implements ExternalConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessExternalConverter.class);
    private static final Duration STREAM_FLUSH_TIMEOUT = Duration.ofMillis(500);
    private static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    private final ExternalConverterConfig config;
    private final ProcessFactory processFactory;

    public ProcessExternalConverter(ExternalConverterConfig config) {
        this(config, new DefaultProcessFactory());
    }

    ProcessExternalConverter(ExternalConverterConfig config, ProcessFactory processFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public String convert(FormatKind from, FormatKind to, String content) {
        List<String> command = command(from, to);
        LOGGER.debug("Running external converter: {}", String.join(" ", command));
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException ex) {
            throw new ExternalConversionException("Failed to start external converter: " + command.get(0), ex);
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream(), "external-converter-stdout");
        CompletableFuture<String> stderr = readAsync(process.getErrorStream(), "external-converter-stderr");
        try {
            writeInput(process.getOutputStream(), content == null ? "" : content);
            boolean finished = process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                throw new ExternalConversionException("External converter timed out after "
                        + config.timeout().toSeconds() + "s");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ExternalConversionException("External converter exited with code " + exitCode + ": "
                        + await(stderr).strip());
            }
            return await(stdout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExternalConversionException("Interrupted while waiting for external converter", ex);
        } catch (UncheckedIOException ex) {
            process.destroyForcibly();
            throw new ExternalConversionException("Failed to exchange data with external converter", ex);
        }
    }

    /**
     * Resolves the command template for one conversion.
     */
    List<String> command(FormatKind from, FormatKind to) {
        String fromName = toolFormatName(Objects.requireNonNull(from, "from"));
        String toName = toolFormatName(Objects.requireNonNull(to, "to"));
        return config.commandTemplate().stream()
                .map(token -> token.replace("{from}", fromName).replace("{to}", toName))
                .collect(Collectors.toList());
    }

    static String toolFormatName(FormatKind kind) {
        return switch (kind) {
            case RICH_CONTROL_WORD -> "rtf";
            case MARKUP_TREE -> "html";
            case LIGHTWEIGHT_MARKUP -> "markdown";
            case OBJECT_NOTATION -> "json";
            case TABULAR_COMMA -> "csv";
            case TABULAR_TAB -> "tsv";
            case GENERIC_MARKUP -> "docbook";
            case PLAIN_TEXT -> "plain";
        };
    }

    private static void writeInput(OutputStream stdin, String content) {
        try (OutputStream out = stdin) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            // a converter that exits without reading its input is judged by its exit code
            LOGGER.debug("External converter closed its input early: {}", ex.getMessage());
        }
    }

    private static CompletableFuture<String> readAsync(InputStream stream, String threadName) {
        CompletableFuture<String> future = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                in.transferTo(buffer);
                future.complete(buffer.toString(StandardCharsets.UTF_8));
            } catch (IOException ex) {
                future.completeExceptionally(new UncheckedIOException(ex));
            }
        }, threadName);
        reader.setDaemon(true);
        reader.start();
        return future;
    }

    private static String await(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(STREAM_FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked;
            }
            throw new ExternalConversionException("Failed to read external converter output", cause);
        } catch (TimeoutException ex) {
            throw new ExternalConversionException("External converter output not flushed within "
                    + STREAM_FLUSH_TIMEOUT.toMillis() + " ms", ex);
        }
    }
}
