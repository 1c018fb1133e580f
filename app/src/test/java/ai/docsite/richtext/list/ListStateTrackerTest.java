package ai.docsite.richtext.list;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ListKind;
import org.junit.jupiter.api.Test;

class ListStateTrackerTest {

    private final ListStateTracker tracker = new ListStateTracker(new ControlWordEmitter(), DocumentProperties.defaults());

    @Test
    void definesTheListTableOncePerRun() {
        String first = tracker.item(ListKind.BULLET, 0, "one");
        String second = tracker.item(ListKind.BULLET, 0, "two");

        assertThat(first).startsWith("{\\*\\listtable").contains("\\listoverridetable");
        assertThat(second).doesNotContain("\\listtable");
        assertThat(second).isEqualTo("{\\listtext \\u8226 ?\\tab}\\ls1\\ilvl0\\fi-360\\li720 two\\par\n");
        assertThat(tracker.tableDefinitions()).isEqualTo(1);
        assertThat(tracker.context()).isEqualTo(ListContext.of(ListKind.BULLET, 0));
    }

    @Test
    void exitEmitsTheCloseMarkerAndReturnsToIdle() {
        tracker.item(ListKind.BULLET, 0, "one");

        assertThat(tracker.exit()).isEqualTo("\\pard\\sa200\\sl276\\slmult1 ");
        assertThat(tracker.isActive()).isFalse();
        assertThat(tracker.context()).isEqualTo(ListContext.idle());
        assertThat(tracker.exit()).isEmpty();
    }

    @Test
    void newRunAfterExitDefinesTheTableAgain() {
        tracker.item(ListKind.BULLET, 0, "one");
        tracker.exit();

        assertThat(tracker.item(ListKind.BULLET, 0, "again")).contains("\\listtable");
        assertThat(tracker.tableDefinitions()).isEqualTo(2);
    }

    @Test
    void nestedItemsUseDeeperIndent() {
        tracker.item(ListKind.BULLET, 0, "top");

        String nested = tracker.item(ListKind.BULLET, 1, "child");

        assertThat(nested).contains("\\ilvl1\\fi-360\\li1440 child");
        assertThat(nested).contains("\\u9702 ?");
    }

    @Test
    void orderedItemsCountPerLevel() {
        String first = tracker.item(ListKind.ORDERED, 0, "a");
        String second = tracker.item(ListKind.ORDERED, 0, "b");
        String nested = tracker.item(ListKind.ORDERED, 1, "b1");
        String third = tracker.item(ListKind.ORDERED, 0, "c");
        String afterNested = tracker.item(ListKind.ORDERED, 1, "c1");

        assertThat(first).contains("{\\listtext 1.\\tab}\\ls2");
        assertThat(second).contains("{\\listtext 2.\\tab}");
        assertThat(nested).contains("{\\listtext 1.\\tab}").contains("\\ilvl1");
        assertThat(third).contains("{\\listtext 3.\\tab}");
        assertThat(afterNested).contains("{\\listtext 1.\\tab}");
    }

    @Test
    void nestedBulletInsideOrderedRunKeepsNumbering() {
        tracker.item(ListKind.ORDERED, 0, "a");
        String bullet = tracker.item(ListKind.BULLET, 1, "note");
        String next = tracker.item(ListKind.ORDERED, 0, "b");

        assertThat(bullet).contains("\\listtable").doesNotContain("\\pard");
        assertThat(next).contains("{\\listtext 2.\\tab}").doesNotContain("\\listtable");
    }

    @Test
    void topLevelKindSwitchClosesTheRun() {
        tracker.item(ListKind.BULLET, 0, "dot");

        String ordered = tracker.item(ListKind.ORDERED, 0, "one");

        assertThat(ordered).startsWith("\\pard").contains("\\listtemplateid2").contains("{\\listtext 1.\\tab}");
    }
}
