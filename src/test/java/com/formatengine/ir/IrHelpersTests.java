package com.formatengine.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrHelpersTests {

    @Test
    void withIndentSurroundsItems() {
        assertEquals(List.of(Signal.START_INDENT, Text.of("a"), Signal.FINISH_INDENT),
                IrHelpers.withIndent(PrintItems.of(Text.of("a"))).toList());
    }

    @Test
    void withIndentTimesRepeatsSignals() {
        assertEquals(List.of(Signal.START_INDENT, Signal.START_INDENT, Text.of("a"),
                        Signal.FINISH_INDENT, Signal.FINISH_INDENT),
                IrHelpers.withIndentTimes(PrintItems.of(Text.of("a")), 2).toList());
    }

    @Test
    void wrappersLeaveEmptyInputEmpty() {
        assertTrue(IrHelpers.withIndent(new PrintItems()).isEmpty());
        assertTrue(IrHelpers.newLineGroup(new PrintItems()).isEmpty());
        assertTrue(IrHelpers.withNoNewLines(new PrintItems()).isEmpty());
        assertTrue(IrHelpers.surroundWithNewLines(new PrintItems()).isEmpty());
    }

    @Test
    void queuedIndentIsFinishedWithFinishIndent() {
        assertEquals(List.of(Signal.QUEUE_START_INDENT, Text.of("a"), Signal.FINISH_INDENT),
                IrHelpers.withQueuedIndent(PrintItems.of(Text.of("a"))).toList());
    }

    @Test
    void fromStringSplitsLinesAndTabs() {
        assertEquals(List.of(Text.of("a"), Signal.TAB, Text.of("b"), Signal.NEW_LINE, Text.of("c")),
                IrHelpers.fromString("a\tb\r\nc").toList());
        assertTrue(IrHelpers.fromString("").isEmpty());
    }

    @Test
    void fromRawStringIgnoresIndentOnlyForMultipleLines() {
        assertEquals(List.of(Text.of("a")), IrHelpers.fromRawString("a").toList());
        assertEquals(List.of(Signal.START_IGNORING_INDENT, Text.of("a"), Signal.NEW_LINE, Text.of("  b"),
                        Signal.FINISH_IGNORING_INDENT),
                IrHelpers.fromRawString("a\n  b").toList());
    }

    @Test
    void printItemsRejectsNullAndSkipsEmptyText() {
        PrintItems items = new PrintItems();

        assertThrows(IllegalArgumentException.class, () -> items.push((PrintItem) null));
        items.push("");
        assertTrue(items.isEmpty());
        items.push("x");
        assertEquals(1, items.size());
    }

    @Test
    void conditionNeedsResolverOrReference() {
        assertThrows(IllegalArgumentException.class, () -> Condition.builder("nothing").build());
        assertThrows(IllegalArgumentException.class,
                () -> new Condition("nullResolver", null, new PrintItems(), null));

        Condition original = Conditions.ifTrue("original", ConditionResolvers.trueResolver(), null);
        Condition reused = Condition.reusing("reused", original, null, null);
        assertTrue(reused.isReference());
        assertSame(original, reused.getReference());
        assertNull(reused.getResolver());
    }
}
