package com.formatengine.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved configuration for the formatter. Immutable, so it can be shared by parallel passes.
 */
public class FormatterConfig {
    public static final int DEFAULT_LINE_WIDTH = 120;
    public static final int DEFAULT_INDENT_WIDTH = 4;
    public static final boolean DEFAULT_USE_TABS = false;
    public static final NewlineKind DEFAULT_NEWLINE_KIND = NewlineKind.AUTO;

    private final int lineWidth;
    private final int indentWidth;
    private final boolean useTabs;
    private final NewlineKind newlineKind;
    private final List<String> ignoreFiles;
    private final Map<String, Map<String, Object>> pluginConfigs;

    private FormatterConfig(Builder builder) {
        this.lineWidth = builder.lineWidth;
        this.indentWidth = builder.indentWidth;
        this.useTabs = builder.useTabs;
        this.newlineKind = builder.newlineKind;
        this.ignoreFiles = Collections.unmodifiableList(new ArrayList<>(builder.ignoreFiles));
        Map<String, Map<String, Object>> plugins = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : builder.pluginConfigs.entrySet()) {
            plugins.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.pluginConfigs = Collections.unmodifiableMap(plugins);
    }

    public static FormatterConfig defaults() {
        return builder().build();
    }

    public int getLineWidth() { return lineWidth; }
    public int getIndentWidth() { return indentWidth; }
    public boolean isUseTabs() { return useTabs; }
    public NewlineKind getNewlineKind() { return newlineKind; }
    public List<String> getIgnoreFiles() { return ignoreFiles; }

    /**
     * Gets the global options in the shape of the configuration file's {@code general} section.
     */
    public Map<String, Object> getGeneralConfigMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ConfigurationResolver.LINE_WIDTH, lineWidth);
        result.put(ConfigurationResolver.INDENT_WIDTH, indentWidth);
        result.put(ConfigurationResolver.USE_TABS, useTabs);
        result.put(ConfigurationResolver.NEWLINE_KIND, newlineKind.getValue());
        result.put(ConfigurationResolver.IGNORE_FILES, new ArrayList<>(ignoreFiles));
        return result;
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }

        Object value = pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }

            return defaultValue;
        }

        return (T) value;
    }

    /**
     * Gets the configuration a plugin runs with: the global options overridden by
     * whatever the plugin's own section sets.
     */
    public FormatterConfig forPlugin(String plugin) {
        if (!pluginConfigs.containsKey(plugin)) {
            return this;
        }
        NewlineKind pluginNewlineKind = NewlineKind.fromValue(
                getPluginConfig(plugin, ConfigurationResolver.NEWLINE_KIND, newlineKind.getValue()));
        return toBuilder()
                .lineWidth(getPluginConfig(plugin, ConfigurationResolver.LINE_WIDTH, lineWidth))
                .indentWidth(getPluginConfig(plugin, ConfigurationResolver.INDENT_WIDTH, indentWidth))
                .useTabs(getPluginConfig(plugin, ConfigurationResolver.USE_TABS, useTabs))
                .newlineKind(pluginNewlineKind != null ? pluginNewlineKind : newlineKind)
                .build();
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .lineWidth(lineWidth)
                .indentWidth(indentWidth)
                .useTabs(useTabs)
                .newlineKind(newlineKind)
                .ignoreFiles(ignoreFiles);
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            builder.pluginConfig(entry.getKey(), entry.getValue());
        }
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lineWidth = DEFAULT_LINE_WIDTH;
        private int indentWidth = DEFAULT_INDENT_WIDTH;
        private boolean useTabs = DEFAULT_USE_TABS;
        private NewlineKind newlineKind = DEFAULT_NEWLINE_KIND;
        private List<String> ignoreFiles = new ArrayList<>();
        private final Map<String, Map<String, Object>> pluginConfigs = new LinkedHashMap<>();

        public Builder lineWidth(int lineWidth) {
            this.lineWidth = lineWidth;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder useTabs(boolean useTabs) {
            this.useTabs = useTabs;
            return this;
        }

        public Builder newlineKind(NewlineKind newlineKind) {
            this.newlineKind = newlineKind;
            return this;
        }

        public Builder ignoreFiles(List<String> ignoreFiles) {
            this.ignoreFiles = new ArrayList<>(ignoreFiles);
            return this;
        }

        public Builder pluginConfig(String plugin, Map<String, Object> config) {
            this.pluginConfigs.put(plugin, new LinkedHashMap<>(config));
            return this;
        }

        public FormatterConfig build() {
            return new FormatterConfig(this);
        }
    }
}
