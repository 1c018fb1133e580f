package ai.docsite.richtext.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.Config;
import ai.docsite.richtext.config.ConfigLoader;
import ai.docsite.richtext.writer.DocumentWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void convertsFileToRichText() throws Exception {
        Path input = tempDir.resolve("notes.md");
        Path output = tempDir.resolve("out/notes.rtf");
        Files.writeString(input, "# Title\n\nThis is **bold**.\n", StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {
                "--input", input.toString(),
                "--output", output.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8))
                .startsWith("{\\rtf1")
                .contains("{\\fs48 Title}\\par")
                .contains("\\b bold\\b0 ");
    }

    @Test
    void detectPrintsFormatAndConfidence() {
        int exitCode = application("<p>Hello</p>").run(new String[] {"--detect"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("MARKUP_TREE 70" + System.lineSeparator());
    }

    @Test
    void explicitSourceFormatConvertsStandardInput() {
        int exitCode = application("# Title\n- a\n").run(new String[] {"--from", "md", "--to", "html"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("<h1>Title</h1>\n<ul>\n<li>a</li>\n</ul>\n");
    }

    @Test
    void unsupportedPairWritesInputUnchanged() {
        int exitCode = application("<p>x</p>").run(new String[] {"--to", "json"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("<p>x</p>");
    }

    @Test
    void invalidArgumentsReturnUsageExitCode() {
        assertThat(application("").run(new String[] {"--to", "docx"})).isEqualTo(2);
        assertThat(application("").run(new String[] {"--unknown"})).isEqualTo(2);
    }

    @Test
    void configurationErrorsReturnUsageExitCode() {
        int exitCode = application("").run(new String[] {"--detect", "--output", tempDir.resolve("x").toString()});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void missingInputFileReturnsIoErrorCode() {
        int exitCode = application("").run(new String[] {"--input", tempDir.resolve("missing.md").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_ERROR);
    }

    @Test
    void usesConfigurationFromLoader() {
        Config config = new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--to", "html", "--from", "text"));
        CliApplication application = new CliApplication(new FixedConfigLoader(config), writer("a < b"));

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("<p>a &lt; b</p>\n");
    }

    private CliApplication application(String stdin) {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), writer(stdin));
    }

    private DocumentWriter writer(String stdin) {
        return new DocumentWriter(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), stdout);
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
