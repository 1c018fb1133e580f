package ai.docsite.richtext.config;

import java.util.Optional;

/**
 * Reads converter settings from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
