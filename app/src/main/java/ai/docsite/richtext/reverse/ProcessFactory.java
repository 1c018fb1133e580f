package ai.docsite.richtext.reverse;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so process-backed conversion can be tested with fake processes.
 */
interface ProcessFactory {

    Process start(List<String> command) throws IOException;
}
