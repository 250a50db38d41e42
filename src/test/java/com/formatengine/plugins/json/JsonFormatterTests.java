package com.formatengine.plugins.json;

import com.formatengine.api.FormatterException;
import com.formatengine.api.FormatterResult;
import com.formatengine.api.error.Severity;
import com.formatengine.config.FormatterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFormatterTests {

    private static final Path FILE = Path.of("test.json");

    private static JsonFormatter formatter(FormatterConfig config) {
        JsonFormatter formatter = new JsonFormatter();
        formatter.initialize(config);
        return formatter;
    }

    private static String format(String source, FormatterConfig config) {
        FormatterResult result = formatter(config).format(FILE, source);
        assertTrue(result.isSuccessful(), () -> "Errors: " + result.getErrors());
        return result.getFormattedCode();
    }

    private static String format(String source) {
        return format(source, FormatterConfig.defaults());
    }

    @Test
    void compactDocumentStaysOnOneLine() {
        assertEquals("{ \"a\": 1, \"b\": [true, null] }\n", format("{\"a\":1,\"b\":[true,null]}"));
    }

    @Test
    void multiLineObjectKeepsOneMemberPerLine() {
        String source = "{\n\"a\": 1,\n\"b\": [1,2]\n}";

        assertEquals("{\n    \"a\": 1,\n    \"b\": [1, 2]\n}\n", format(source));
    }

    @Test
    void nestedMultiLineObjectsAreIndented() {
        String source = "{\n  \"a\": {\n    \"b\": 1\n  }\n}";

        assertEquals("{\n    \"a\": {\n        \"b\": 1\n    }\n}\n", format(source));
    }

    @Test
    void wrapsMembersThatExceedLineWidth() {
        FormatterConfig config = FormatterConfig.builder().lineWidth(20).build();

        assertEquals("{ \"alpha\": 1,\n    \"beta\": 2,\n    \"gamma\": 3 }\n",
                format("{\"alpha\": 1, \"beta\": 2, \"gamma\": 3}", config));
    }

    @Test
    void emptyContainers() {
        assertEquals("{}\n", format("{ }"));
        assertEquals("[]\n", format("[\n]"));
        assertEquals("{ \"a\": [], \"b\": {} }\n", format("{\"a\":[],\"b\":{}}"));
    }

    @Test
    void keepsStringEscapes() {
        assertEquals("[\"a\\\"b\\\\c\", \"line\\nbreak\"]\n", format("[\"a\\\"b\\\\c\",\"line\\nbreak\"]"));
    }

    @Test
    void scalarDocument() {
        assertEquals("42\n", format("  42  "));
    }

    @Test
    void emptyDocumentIsUnchanged() {
        FormatterResult result = formatter(FormatterConfig.defaults()).format(FILE, "");

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
    }

    @Test
    void formattedDocumentIsUnchanged() {
        FormatterResult result = formatter(FormatterConfig.defaults())
                .format(FILE, "{\n    \"a\": [1, 2]\n}\n");

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
    }

    @Test
    void keepsCrLfLineEndings() {
        assertEquals("{\r\n    \"a\": 1\r\n}\r\n", format("{\r\n\"a\": 1\r\n}\r\n"));
    }

    @Test
    void usesTabsWhenConfigured() {
        FormatterConfig config = FormatterConfig.builder().useTabs(true).build();

        assertEquals("[\n\t1,\n\t2\n]\n", format("[\n1, 2]", config));
    }

    @Test
    void pluginSectionOverridesGeneralOptions() {
        FormatterConfig config = FormatterConfig.builder()
                .pluginConfig(JsonFormatter.NAME, Map.of("indentWidth", 2))
                .build();

        assertEquals("{\n  \"a\": 1\n}\n", format("{\n\"a\": 1}", config));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"alpha\": 1, \"beta\": [1, 2, 3], \"gamma\": {\"delta\": \"value\"}}",
            "{\n\"a\": [\n1,\n{\"b\": 2}\n],\n\"c\": \"text\"\n}",
            "[[1, 2], [3, 4], {\"k\": [5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15]}]"
    })
    void formattingIsIdempotent(String source) {
        FormatterConfig config = FormatterConfig.builder().lineWidth(24).build();

        String once = format(source, config);
        String twice = format(once, config);

        assertEquals(once, twice);
    }

    @Test
    void invalidJsonIsFatal() {
        FormatterResult result = formatter(FormatterConfig.defaults()).format(FILE, "{\"a\": }");

        assertFalse(result.isSuccessful());
        assertNull(result.getFormattedCode());
        assertEquals(1, result.getErrors().size());
        assertEquals(Severity.FATAL, result.getErrors().get(0).getSeverity());
        assertTrue(result.getErrors().get(0).getMessage().startsWith("Failed to parse JSON"));
        assertEquals(1, result.getErrors().get(0).getLine());
    }

    @Test
    void trailingContentIsRejected() {
        JsonFormatter formatter = formatter(FormatterConfig.defaults());

        FormatterException e = assertThrows(FormatterException.class, () -> formatter.generateIr(FILE, "{} {}"));

        assertEquals("Unexpected content after the root value", e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    void commentsAreRejected() {
        assertFalse(formatter(FormatterConfig.defaults()).format(FILE, "// note\n{}").isSuccessful());
    }
}
