package com.formatengine.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.formatengine.util.LoggerUtil;

/**
 * Validates raw option maps into a {@link FormatterConfig}.
 *
 * <p>Never fails: unknown names and values of the wrong type become diagnostics and the
 * default is used for that option. Numbers and booleans written as strings are accepted.</p>
 */
public final class ConfigurationResolver {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationResolver.class);

    public static final String LINE_WIDTH = "lineWidth";
    public static final String INDENT_WIDTH = "indentWidth";
    public static final String INDENT_SIZE = "indentSize";
    public static final String USE_TABS = "useTabs";
    public static final String NEWLINE_KIND = "newlineKind";
    public static final String NEW_LINE_KIND = "newLineKind";
    public static final String IGNORE_FILES = "ignoreFiles";
    public static final String PLUGINS = "plugins";

    static final String UNKNOWN_PROPERTY_MESSAGE = "Unknown property in configuration.";

    private ConfigurationResolver() {
    }

    /**
     * Resolves a flat map of global options, optionally holding a {@code plugins} map
     * of per-plugin overrides.
     */
    public static ResolveConfigurationResult<FormatterConfig> resolveConfiguration(Map<String, Object> rawOptions) {
        Map<String, Object> remaining = rawOptions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(rawOptions);
        List<ConfigurationDiagnostic> diagnostics = new ArrayList<>();

        Map<String, Object> engineOptions = new LinkedHashMap<>();
        _resolveEngineOptions(remaining, "", engineOptions, diagnostics);

        FormatterConfig.Builder builder = FormatterConfig.builder();
        if (engineOptions.containsKey(LINE_WIDTH)) {
            builder.lineWidth((Integer) engineOptions.get(LINE_WIDTH));
        }
        if (engineOptions.containsKey(INDENT_WIDTH)) {
            builder.indentWidth((Integer) engineOptions.get(INDENT_WIDTH));
        }
        if (engineOptions.containsKey(USE_TABS)) {
            builder.useTabs((Boolean) engineOptions.get(USE_TABS));
        }
        if (engineOptions.containsKey(NEWLINE_KIND)) {
            builder.newlineKind(NewlineKind.fromValue((String) engineOptions.get(NEWLINE_KIND)));
        }

        if (remaining.containsKey(IGNORE_FILES)) {
            builder.ignoreFiles(_resolveIgnoreFiles(remaining.remove(IGNORE_FILES), diagnostics));
        }

        if (remaining.containsKey(PLUGINS)) {
            _resolvePlugins(remaining.remove(PLUGINS), builder, diagnostics);
        }

        _addUnknownPropertyDiagnostics(remaining, "", diagnostics);

        logger.fine("Resolved configuration with " + diagnostics.size() + " diagnostic(s)");
        return new ResolveConfigurationResult<>(builder.build(), diagnostics);
    }

    /**
     * Takes the engine options out of {@code remaining} and puts the valid ones, under their
     * canonical names, into {@code resolved}.
     */
    private static void _resolveEngineOptions(Map<String, Object> remaining, String prefix,
                                              Map<String, Object> resolved,
                                              List<ConfigurationDiagnostic> diagnostics) {
        Integer lineWidth = _takePositiveInt(remaining, LINE_WIDTH, prefix, diagnostics);
        if (lineWidth != null) {
            resolved.put(LINE_WIDTH, lineWidth);
        }

        boolean hasIndentWidth = remaining.containsKey(INDENT_WIDTH);
        Integer indentWidth = _takePositiveInt(remaining, INDENT_WIDTH, prefix, diagnostics);
        if (hasIndentWidth && remaining.containsKey(INDENT_SIZE)) {
            remaining.remove(INDENT_SIZE);
            diagnostics.add(new ConfigurationDiagnostic(prefix + INDENT_SIZE,
                    "Ignored because '" + INDENT_WIDTH + "' is also specified."));
        }
        Integer indentSize = _takePositiveInt(remaining, INDENT_SIZE, prefix, diagnostics);
        if (indentWidth != null) {
            resolved.put(INDENT_WIDTH, indentWidth);
        } else if (indentSize != null) {
            resolved.put(INDENT_WIDTH, indentSize);
        }

        Boolean useTabs = _takeBoolean(remaining, USE_TABS, prefix, diagnostics);
        if (useTabs != null) {
            resolved.put(USE_TABS, useTabs);
        }

        String newlineKey = remaining.containsKey(NEWLINE_KIND) ? NEWLINE_KIND : NEW_LINE_KIND;
        if (remaining.containsKey(newlineKey)) {
            Object value = remaining.remove(newlineKey);
            NewlineKind kind = value instanceof String ? NewlineKind.fromValue((String) value) : null;
            if (kind == null) {
                diagnostics.add(new ConfigurationDiagnostic(prefix + newlineKey,
                        "Found invalid value '" + value + "'."));
            } else {
                resolved.put(NEWLINE_KIND, kind.getValue());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void _resolvePlugins(Object value, FormatterConfig.Builder builder,
                                        List<ConfigurationDiagnostic> diagnostics) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            diagnostics.add(new ConfigurationDiagnostic(PLUGINS,
                    "Expected the configuration for '" + PLUGINS + "' to be a map, but its value was: " + value));
            return;
        }

        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            String pluginName = entry.getKey();
            String prefix = PLUGINS + "." + pluginName + ".";

            if (entry.getValue() == null) {
                builder.pluginConfig(pluginName, new LinkedHashMap<>());
                continue;
            }
            if (!(entry.getValue() instanceof Map)) {
                diagnostics.add(new ConfigurationDiagnostic(PLUGINS + "." + pluginName,
                        "Expected the configuration for '" + PLUGINS + "." + pluginName
                                + "' to be a map, but its value was: " + entry.getValue()));
                continue;
            }

            Map<String, Object> remaining = new LinkedHashMap<>((Map<String, Object>) entry.getValue());
            Map<String, Object> resolved = new LinkedHashMap<>();
            _resolveEngineOptions(remaining, prefix, resolved, diagnostics);
            _addUnknownPropertyDiagnostics(remaining, prefix, diagnostics);
            builder.pluginConfig(pluginName, resolved);
        }
    }

    private static List<String> _resolveIgnoreFiles(Object value, List<ConfigurationDiagnostic> diagnostics) {
        List<String> patterns = new ArrayList<>();
        if (value == null) {
            return patterns;
        }
        if (value instanceof String) {
            patterns.add((String) value);
            return patterns;
        }
        if (!(value instanceof List)) {
            diagnostics.add(new ConfigurationDiagnostic(IGNORE_FILES,
                    "Expected the configuration for '" + IGNORE_FILES
                            + "' to be a list of glob patterns, but its value was: " + value));
            return patterns;
        }
        for (Object pattern : (List<?>) value) {
            if (pattern instanceof String) {
                patterns.add((String) pattern);
            } else {
                diagnostics.add(new ConfigurationDiagnostic(IGNORE_FILES,
                        "Expected a glob pattern, but found: " + pattern));
            }
        }
        return patterns;
    }

    private static Integer _takePositiveInt(Map<String, Object> remaining, String key, String prefix,
                                            List<ConfigurationDiagnostic> diagnostics) {
        if (!remaining.containsKey(key)) {
            return null;
        }
        Object value = remaining.remove(key);
        Integer parsed = _parseInt(value);
        if (parsed == null) {
            diagnostics.add(new ConfigurationDiagnostic(prefix + key,
                    "Expected the configuration for '" + key + "' to be a number, but its value was: " + value));
            return null;
        }
        if (parsed < 1) {
            diagnostics.add(new ConfigurationDiagnostic(prefix + key,
                    "Expected the configuration for '" + key + "' to be greater than zero, but its value was: " + value));
            return null;
        }
        return parsed;
    }

    private static Integer _parseInt(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            return longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE ? (int) longValue : null;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean _takeBoolean(Map<String, Object> remaining, String key, String prefix,
                                        List<ConfigurationDiagnostic> diagnostics) {
        if (!remaining.containsKey(key)) {
            return null;
        }
        Object value = remaining.remove(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Boolean.valueOf(text);
            }
        }
        diagnostics.add(new ConfigurationDiagnostic(prefix + key,
                "Expected the configuration for '" + key + "' to be a boolean, but its value was: " + value));
        return null;
    }

    private static void _addUnknownPropertyDiagnostics(Map<String, Object> remaining, String prefix,
                                                       List<ConfigurationDiagnostic> diagnostics) {
        for (String key : remaining.keySet()) {
            diagnostics.add(new ConfigurationDiagnostic(prefix + key, UNKNOWN_PROPERTY_MESSAGE));
        }
    }
}
