package ai.docsite.richtext.convert;

import ai.docsite.richtext.config.DocumentProperties;

/**
 * Native conversion of one format pair.
 */
@FunctionalInterface
public interface Transpiler {

    String transpile(String text, DocumentProperties properties);
}
