package ai.docsite.richtext.markdown;

import java.util.List;

/**
 * Splits lightweight-markup text into typed blocks.
 */
public interface BlockTokenizer {

    List<BlockToken> tokenize(String markdown);
}
