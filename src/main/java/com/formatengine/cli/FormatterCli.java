package com.formatengine.cli;

import com.formatengine.api.FormatterResult;
import com.formatengine.api.error.FormatterError;
import com.formatengine.config.ConfigurationDiagnostic;
import com.formatengine.config.ConfigurationLoader;
import com.formatengine.config.FormatterConfig;
import com.formatengine.config.ResolveConfigurationResult;
import com.formatengine.core.PluggableCodeFormatter;
import com.formatengine.plugins.FileType;
import com.formatengine.plugins.json.JsonFormatter;
import com.formatengine.util.ErrorFormatter;
import com.formatengine.util.LoggerUtil;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line interface: {@code format}, {@code check} and {@code init}.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".formatengine.yml";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode = run(args);
        LoggerUtil.shutdown();
        System.exit(exitCode);
    }

    /**
     * Runs a command and returns the process exit code.
     */
    public static int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        try {
            String command = args[0];
            switch (command) {
                case "format":
                    return _formatFiles(args, true);
                case "check":
                    return _formatFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details");
            }
            return 1;
        }
    }

    private static void _printVersion() {
        System.out.println("Format Engine version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Format Engine CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  formatengine init [--force]        - Create a configuration file");
        System.out.println("  formatengine format <path>         - Format files in path");
        System.out.println("  formatengine check <path>          - Report files that are not formatted");
        System.out.println("  formatengine --help|-h             - Show this help");
        System.out.println("  formatengine --version|-v          - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                    - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                          - Show detailed output");
        System.out.println("  --ci                               - CI friendly output (no summary)");
        System.out.println("  --no-color                         - Disable colored output");
        System.out.println("  --include=<glob>                   - Only include files matching pattern");
        System.out.println("  --threads=<num>                    - Number of threads to use (default: available processors)");
        System.out.println("  --force                            - Overwrite an existing file (with init)");
    }

    /**
     * Formats the files below a path. With {@code write} false nothing is written and every file
     * that would change is reported.
     */
    private static int _formatFiles(String[] args, boolean write) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + path);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String includePattern = _getOptionValue(args, "--include");
        int threads = _getThreadCount(args);

        FormatterConfig config = _loadConfig(args);

        try (PluggableCodeFormatter formatter = _createFormatter(config)) {
            List<Path> files = _findFiles(path, config.getIgnoreFiles(), includePattern);
            _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = formatter.formatFiles(files, threads);

            int changedCount = 0;
            int unchangedCount = 0;
            int errorCount = 0;
            Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();

            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (result == null || !result.isSuccessful()) {
                    _printError("Failed to format: " + file);
                    if (result != null) {
                        errorsByFile.put(file, result.getErrors());
                        result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    }
                    errorCount++;
                } else if (result.isChanged()) {
                    if (write) {
                        Files.writeString(file, result.getFormattedCode());
                        _printSuccess("Formatted: " + file);
                    } else {
                        _printWarning("File needs formatting: " + file);
                    }
                    changedCount++;
                } else {
                    if (verbose) {
                        _printInfo("Already formatted: " + file);
                    }
                    unchangedCount++;
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            System.out.println();
            System.out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
            System.out.println("  Processed files: " + files.size());
            System.out.println((write ? "  Formatted files: " : "  Files needing formatting: ") + changedCount);
            System.out.println("  Already formatted: " + unchangedCount);
            System.out.println("  Files with errors: " + errorCount);

            if (!errorsByFile.isEmpty() && !ciMode) {
                System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            if (errorCount > 0 || (!write && changedCount > 0)) {
                return 1;
            }
            return 0;
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return 1;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);

        if (configFile != null) {
            if (Files.exists(configPath)) {
                _printInfo("Using config file: " + configPath);
            } else {
                _printWarning("Config file not found: " + configPath + ", using defaults");
            }
        }

        ResolveConfigurationResult<FormatterConfig> loaded = ConfigurationLoader.loadConfigWithDiagnostics(configPath);
        for (ConfigurationDiagnostic diagnostic : loaded.getDiagnostics()) {
            System.out.println(errorFormatter.formatDiagnostic(configPath, diagnostic));
        }
        return loaded.getConfig();
    }

    private static PluggableCodeFormatter _createFormatter(FormatterConfig config) {
        PluggableCodeFormatter formatter = new PluggableCodeFormatter(config);
        formatter.registerPlugin(FileType.JSON, new JsonFormatter());
        return formatter;
    }

    private static int _getThreadCount(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return Math.max(1, threads);
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        List<PathMatcher> ignoreMatchers = ignorePatterns.stream()
                .map(FormatterCli::_globMatcher)
                .collect(Collectors.toList());
        PathMatcher includeMatcher = includePattern == null || includePattern.isEmpty()
                ? null
                : _globMatcher(includePattern);

        try (Stream<Path> paths = Files.walk(path)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> FileType.detect(p) != FileType.UNKNOWN)
                    .filter(p -> includeMatcher == null || includeMatcher.matches(p.getFileName()))
                    .filter(p -> !_isIgnored(path.relativize(p), ignoreMatchers))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static PathMatcher _globMatcher(String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    private static boolean _isIgnored(Path relativePath, List<PathMatcher> ignoreMatchers) {
        // "**/dir/**" should also match at the top level, so try the path below a dummy parent
        Path nested = Paths.get("_").resolve(relativePath);
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(relativePath) || matcher.matches(nested)) {
                return true;
            }
        }
        return false;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
