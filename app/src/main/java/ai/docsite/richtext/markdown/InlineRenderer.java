package ai.docsite.richtext.markdown;

import java.util.List;

/**
 * Writes inline spans in a target format.
 */
public interface InlineRenderer {

    String render(List<InlineSpan> spans);
}
