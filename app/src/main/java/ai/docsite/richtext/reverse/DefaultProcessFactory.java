package ai.docsite.richtext.reverse;

import java.io.IOException;
import java.util.List;

/**
 * Starts real processes with stdout and stderr kept apart.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(false);
        return builder.start();
    }
}
