package com.formatengine.printing;

import com.formatengine.api.FormatterResult;
import com.formatengine.config.FormatterConfig;
import com.formatengine.config.NewlineKind;
import com.formatengine.ir.PrintItems;
import com.formatengine.ir.Signal;
import com.formatengine.ir.Text;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatEngineTests {

    private final FormatEngine engine = new FormatEngine();

    @Test
    void identicalOutputIsReportedUnchanged() {
        FormatterResult result = engine.format("a\n", PrintItems.of(Text.of("a"), Signal.NEW_LINE),
                FormatterConfig.defaults());

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
        assertEquals("a\n", result.getFormattedCode());
    }

    @Test
    void differentOutputIsReportedChanged() {
        FormatterResult result = engine.format("a  b", PrintItems.of(Text.of("a"), Signal.SPACE_OR_NEW_LINE,
                Text.of("b")), FormatterConfig.defaults());

        assertTrue(result.isSuccessful());
        assertTrue(result.isChanged());
        assertEquals("a b", result.getFormattedCode());
    }

    @Test
    void autoNewlineFollowsSourceText() {
        PrintItems items = PrintItems.of(Text.of("a"), Signal.NEW_LINE, Text.of("b"));

        assertEquals("a\r\nb", engine.print(items, FormatterConfig.defaults(), "x\r\n"));
        assertEquals("a\nb", engine.print(items, FormatterConfig.defaults(), "x\n"));
    }

    @Test
    void explicitNewlineKindOverridesSource() {
        FormatterConfig config = FormatterConfig.builder().newlineKind(NewlineKind.CRLF).build();

        assertEquals("a\r\nb", engine.print(PrintItems.of(Text.of("a"), Signal.NEW_LINE, Text.of("b")),
                config, "x\n"));
    }

    @Test
    void usesConfiguredIndentation() {
        FormatterConfig config = FormatterConfig.builder().indentWidth(2).build();
        PrintItems items = PrintItems.of(Signal.START_INDENT, Text.of("a"), Signal.FINISH_INDENT);

        assertEquals("  a", engine.print(items, config, ""));
        assertEquals("\ta", engine.print(items, config.toBuilder().useTabs(true).build(), ""));
    }

    @Test
    void malformedIrFails() {
        assertThrows(PrintException.class, () -> engine.format("", PrintItems.of(Signal.FINISH_INDENT),
                FormatterConfig.defaults()));
    }
}
