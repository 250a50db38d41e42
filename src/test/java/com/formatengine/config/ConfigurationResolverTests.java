package com.formatengine.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationResolverTests {

    private static ResolveConfigurationResult<FormatterConfig> resolve(Map<String, Object> options) {
        return ConfigurationResolver.resolveConfiguration(options);
    }

    @Test
    void resolvesValidOptions() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of(
                "lineWidth", 80,
                "indentWidth", 2,
                "useTabs", true,
                "newlineKind", "crlf"));

        assertFalse(result.hasDiagnostics());
        FormatterConfig config = result.getConfig();
        assertEquals(80, config.getLineWidth());
        assertEquals(2, config.getIndentWidth());
        assertTrue(config.isUseTabs());
        assertEquals(NewlineKind.CRLF, config.getNewlineKind());
    }

    @Test
    void emptyOrNullOptionsGiveDefaults() {
        for (Map<String, Object> options : Arrays.<Map<String, Object>>asList(null, Map.of())) {
            ResolveConfigurationResult<FormatterConfig> result = resolve(options);

            assertFalse(result.hasDiagnostics());
            assertEquals(FormatterConfig.DEFAULT_LINE_WIDTH, result.getConfig().getLineWidth());
            assertEquals(FormatterConfig.DEFAULT_INDENT_WIDTH, result.getConfig().getIndentWidth());
            assertEquals(NewlineKind.AUTO, result.getConfig().getNewlineKind());
        }
    }

    @Test
    void acceptsNumbersAndBooleansWrittenAsStrings() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of(
                "lineWidth", "100",
                "useTabs", "true"));

        assertFalse(result.hasDiagnostics());
        assertEquals(100, result.getConfig().getLineWidth());
        assertTrue(result.getConfig().isUseTabs());
    }

    @Test
    void reportsUnknownProperty() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("lineWidh", 80));

        assertEquals(List.of(new ConfigurationDiagnostic("lineWidh", ConfigurationResolver.UNKNOWN_PROPERTY_MESSAGE)),
                result.getDiagnostics());
        assertEquals(FormatterConfig.DEFAULT_LINE_WIDTH, result.getConfig().getLineWidth());
    }

    @Test
    void reportsNonNumericWidth() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("lineWidth", "wide"));

        assertEquals(List.of(new ConfigurationDiagnostic("lineWidth",
                        "Expected the configuration for 'lineWidth' to be a number, but its value was: wide")),
                result.getDiagnostics());
        assertEquals(FormatterConfig.DEFAULT_LINE_WIDTH, result.getConfig().getLineWidth());
    }

    @Test
    void reportsWidthThatIsNotPositive() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("indentWidth", 0));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals("indentWidth", result.getDiagnostics().get(0).getPropertyName());
        assertTrue(result.getDiagnostics().get(0).getMessage().contains("greater than zero"));
        assertEquals(FormatterConfig.DEFAULT_INDENT_WIDTH, result.getConfig().getIndentWidth());
    }

    @Test
    void reportsInvalidBoolean() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("useTabs", "yes"));

        assertEquals(List.of(new ConfigurationDiagnostic("useTabs",
                        "Expected the configuration for 'useTabs' to be a boolean, but its value was: yes")),
                result.getDiagnostics());
        assertFalse(result.getConfig().isUseTabs());
    }

    @Test
    void reportsInvalidNewlineKind() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("newLineKind", "windows"));

        assertEquals(List.of(new ConfigurationDiagnostic("newLineKind", "Found invalid value 'windows'.")),
                result.getDiagnostics());
        assertEquals(NewlineKind.AUTO, result.getConfig().getNewlineKind());
    }

    @Test
    void acceptsIndentSizeAlias() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("indentSize", 3));

        assertFalse(result.hasDiagnostics());
        assertEquals(3, result.getConfig().getIndentWidth());
    }

    @Test
    void indentWidthWinsOverIndentSize() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of("indentWidth", 2, "indentSize", 8));

        assertEquals(2, result.getConfig().getIndentWidth());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("indentSize", result.getDiagnostics().get(0).getPropertyName());
    }

    @Test
    void resolvesPluginOverrides() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("lineWidth", 40);
        json.put("useTabs", "true");
        json.put("bogus", 1);

        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of(
                "lineWidth", 100,
                "plugins", Map.of("json", json)));

        assertEquals(List.of(new ConfigurationDiagnostic("plugins.json.bogus",
                ConfigurationResolver.UNKNOWN_PROPERTY_MESSAGE)), result.getDiagnostics());

        FormatterConfig jsonConfig = result.getConfig().forPlugin("json");
        assertEquals(40, jsonConfig.getLineWidth());
        assertTrue(jsonConfig.isUseTabs());
        assertEquals(100, result.getConfig().forPlugin("other").getLineWidth());
    }

    @Test
    void reportsInvalidPluginValuesWithPrefixedName() {
        ResolveConfigurationResult<FormatterConfig> result = resolve(Map.of(
                "plugins", Map.of("json", Map.of("indentWidth", "x"))));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals("plugins.json.indentWidth", result.getDiagnostics().get(0).getPropertyName());
        assertEquals(FormatterConfig.DEFAULT_INDENT_WIDTH, result.getConfig().forPlugin("json").getIndentWidth());
    }

    @Test
    void resolvesIgnoreFiles() {
        Map<String, Object> options = new HashMap<>();
        options.put("ignoreFiles", List.of("**/build/**", 5));

        ResolveConfigurationResult<FormatterConfig> result = resolve(options);

        assertEquals(List.of("**/build/**"), result.getConfig().getIgnoreFiles());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("ignoreFiles", result.getDiagnostics().get(0).getPropertyName());
    }

    @Test
    void doesNotModifyInput() {
        Map<String, Object> options = new HashMap<>();
        options.put("lineWidth", 90);
        options.put("unknown", true);

        resolve(options);

        assertEquals(2, options.size());
    }
}
