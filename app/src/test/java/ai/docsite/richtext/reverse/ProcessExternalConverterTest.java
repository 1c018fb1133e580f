package ai.docsite.richtext.reverse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.docsite.richtext.config.ExternalConverterConfig;
import ai.docsite.richtext.config.ReverseConverterKind;
import ai.docsite.richtext.detect.FormatKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessExternalConverterTest {

    @Test
    void resolvesFormatPlaceholders() {
        ProcessExternalConverter converter = new ProcessExternalConverter(ExternalConverterConfig.nativeOnly());

        assertThat(converter.command(FormatKind.RICH_CONTROL_WORD, FormatKind.LIGHTWEIGHT_MARKUP))
                .containsExactly("pandoc", "-f", "rtf", "-t", "markdown");
        assertThat(ProcessExternalConverter.toolFormatName(FormatKind.GENERIC_MARKUP)).isEqualTo("docbook");
    }

    @Test
    void passesContentThroughTheCommand() {
        assumeTrue(Files.isExecutable(Path.of("/bin/cat")));
        ProcessExternalConverter converter = new ProcessExternalConverter(config(List.of("/bin/cat"), Duration.ofSeconds(10)));

        String result = converter.convert(FormatKind.MARKUP_TREE, FormatKind.PLAIN_TEXT, "<p>héllo</p>\n");

        assertThat(result).isEqualTo("<p>héllo</p>\n");
    }

    @Test
    void nonZeroExitReportsStandardError() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ProcessExternalConverter converter = new ProcessExternalConverter(
                config(List.of("/bin/sh", "-c", "echo unsupported {from} >&2; exit 3"), Duration.ofSeconds(10)));

        Throwable thrown = catchThrowable(() -> converter.convert(FormatKind.RICH_CONTROL_WORD, FormatKind.PLAIN_TEXT, "x"));

        assertThat(thrown)
                .isInstanceOf(ExternalConversionException.class)
                .hasMessageContaining("code 3")
                .hasMessageContaining("unsupported rtf");
    }

    @Test
    void timesOutAndStopsTheProcess() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        RecordingProcessFactory factory = new RecordingProcessFactory();
        ProcessExternalConverter converter = new ProcessExternalConverter(
                config(List.of("/bin/sh", "-c", "sleep 5"), Duration.ofMillis(200)), factory);

        Throwable thrown = catchThrowable(() -> converter.convert(FormatKind.RICH_CONTROL_WORD, FormatKind.PLAIN_TEXT, "x"));

        assertThat(thrown).isInstanceOf(ExternalConversionException.class).hasMessageContaining("timed out");
        assertThat(factory.started).hasSize(1);
        assertThat(factory.started.get(0).isAlive()).isFalse();
    }

    @Test
    void startFailureIsWrapped() {
        ProcessExternalConverter converter = new ProcessExternalConverter(ExternalConverterConfig.nativeOnly(), command -> {
            throw new IOException("no such file");
        });

        Throwable thrown = catchThrowable(() -> converter.convert(FormatKind.RICH_CONTROL_WORD, FormatKind.PLAIN_TEXT, "x"));

        assertThat(thrown)
                .isInstanceOf(ExternalConversionException.class)
                .hasMessageContaining("pandoc")
                .hasCauseInstanceOf(IOException.class);
    }

    private static ExternalConverterConfig config(List<String> command, Duration timeout) {
        return new ExternalConverterConfig(ReverseConverterKind.EXTERNAL, command, timeout);
    }

    private static final class RecordingProcessFactory implements ProcessFactory {

        private final List<Process> started = new ArrayList<>();

        @Override
        public Process start(List<String> command) throws IOException {
            Process process = new ProcessBuilder(command).start();
            started.add(process);
            return process;
        }
    }
}
