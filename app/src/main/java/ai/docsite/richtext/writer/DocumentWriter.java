package ai.docsite.richtext.writer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads source documents and writes converted documents as UTF-8, using a file when a path is
 * given and the supplied stream otherwise.
 */
public class DocumentWriter {

    private final InputStream standardInput;
    private final OutputStream standardOutput;

    public DocumentWriter() {
        this(System.in, System.out);
    }

    public DocumentWriter(InputStream standardInput, OutputStream standardOutput) {
        this.standardInput = Objects.requireNonNull(standardInput, "standardInput");
        this.standardOutput = Objects.requireNonNull(standardOutput, "standardOutput");
    }

    public String read(Optional<Path> source) {
        if (source.isPresent()) {
            Path path = source.get();
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read document: " + path, ex);
            }
        }
        try {
            return new String(standardInput.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document from standard input", ex);
        }
    }

    public void write(Optional<Path> target, String content) {
        String text = content == null ? "" : content;
        if (target.isPresent()) {
            Path path = target.get();
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, text, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to write converted document: " + path, ex);
            }
            return;
        }
        try {
            standardOutput.write(text.getBytes(StandardCharsets.UTF_8));
            standardOutput.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write converted document to standard output", ex);
        }
    }
}
