package ai.docsite.richtext.reverse;

import ai.docsite.richtext.markdown.SpanStyle;
import ai.docsite.richtext.rtf.ListKind;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A paragraph recovered from a control-word document.
 *
 * @param runs text runs in order
 * @param listKind list kind when the paragraph is a list item
 * @param listLevel nesting level of the list item
 * @param fontSize half-point size of the first text run, zero when it is the document size
 */
record ExtractedParagraph(List<Run> runs, Optional<ListKind> listKind, int listLevel, int fontSize) {

    ExtractedParagraph {
        runs = List.copyOf(runs);
        listKind = listKind == null ? Optional.empty() : listKind;
    }

    String plainText() {
        StringBuilder builder = new StringBuilder();
        runs.forEach(run -> builder.append(run.text()));
        return builder.toString();
    }

    boolean isBlank() {
        return plainText().isBlank();
    }

    /**
     * A run of text sharing styles and link target.
     */
    record Run(String text, Set<SpanStyle> styles, String href) {

        Run {
            styles = Set.copyOf(styles);
            href = href == null ? "" : href;
        }
    }
}
