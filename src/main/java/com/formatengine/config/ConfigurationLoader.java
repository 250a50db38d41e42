package com.formatengine.config;

import com.formatengine.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads YAML configuration files with fallback to the bundled defaults.
 *
 * <p>A file has a {@code general} section with the global options and a {@code plugins} section
 * with per-plugin overrides. Options placed at the top level are treated as global options.</p>
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    static final String GENERAL_SECTION = "general";

    private static ResolveConfigurationResult<FormatterConfig> _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     * Diagnostics are logged as warnings.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        return loadConfigWithDiagnostics(configPath).getConfig();
    }

    /**
     * Loads configuration from a file and returns the diagnostics alongside it.
     */
    public static ResolveConfigurationResult<FormatterConfig> loadConfigWithDiagnostics(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return _loadDefaultConfigResult();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return _loadDefaultConfigResult();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            ResolveConfigurationResult<FormatterConfig> result = resolveSections(config);
            for (ConfigurationDiagnostic diagnostic : result.getDiagnostics()) {
                logger.warning(configPath + ": " + diagnostic);
            }
            logger.info("Configuration loaded with " + result.getConfig().getPluginConfigsMap().size()
                    + " plugin configurations");

            return result;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return _loadDefaultConfigResult();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static FormatterConfig loadDefaultConfig() {
        return _loadDefaultConfigResult().getConfig();
    }

    /**
     * Flattens the sections of a parsed configuration file and resolves them.
     */
    @SuppressWarnings("unchecked")
    public static ResolveConfigurationResult<FormatterConfig> resolveSections(Map<String, Object> config) {
        Map<String, Object> rawOptions = new LinkedHashMap<>();
        List<ConfigurationDiagnostic> sectionDiagnostics = new ArrayList<>();

        if (config != null) {
            for (Map.Entry<String, Object> entry : config.entrySet()) {
                if (!GENERAL_SECTION.equals(entry.getKey())) {
                    rawOptions.put(entry.getKey(), entry.getValue());
                }
            }

            Object general = config.get(GENERAL_SECTION);
            if (general instanceof Map) {
                rawOptions.putAll((Map<String, Object>) general);
            } else if (general != null) {
                sectionDiagnostics.add(new ConfigurationDiagnostic(GENERAL_SECTION,
                        "Expected the configuration for '" + GENERAL_SECTION + "' to be a map, but its value was: "
                                + general));
            }
        }

        ResolveConfigurationResult<FormatterConfig> result = ConfigurationResolver.resolveConfiguration(rawOptions);
        if (sectionDiagnostics.isEmpty()) {
            return result;
        }
        sectionDiagnostics.addAll(result.getDiagnostics());
        return new ResolveConfigurationResult<>(result.getConfig(), sectionDiagnostics);
    }

    private static synchronized ResolveConfigurationResult<FormatterConfig> _loadDefaultConfigResult() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return new ResolveConfigurationResult<>(FormatterConfig.defaults(), new ArrayList<>());
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = resolveSections(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return new ResolveConfigurationResult<>(FormatterConfig.defaults(), new ArrayList<>());
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put(GENERAL_SECTION, config.getGeneralConfigMap());
            configMap.put(ConfigurationResolver.PLUGINS, config.getPluginConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
