package com.formatengine.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.formatengine.api.CodeFormatter;
import com.formatengine.api.FormatterPlugin;
import com.formatengine.api.FormatterResult;
import com.formatengine.api.error.FormatterError;
import com.formatengine.api.error.Severity;
import com.formatengine.config.FormatterConfig;
import com.formatengine.plugins.FileType;
import com.formatengine.printing.PrintException;
import com.formatengine.util.LoggerUtil;

/**
 * Thread-safe formatter that hands every file to the plugin registered for its type.
 *
 * <p>Each file is formatted in its own engine pass. A failure in one file, including a
 * {@link PrintException} from the engine, becomes a failed result for that file only.</p>
 */
public class PluggableCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(PluggableCodeFormatter.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public PluggableCodeFormatter(FormatterConfig config) {
        this.config = config;
        logger.fine("Formatter created: lineWidth=" + config.getLineWidth()
                + ", indentWidth=" + config.getIndentWidth());
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin '" + plugin.getName() + "' for file type: " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            0, 0))
                    .build();
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine((result.isChanged() ? "Formatted: " : "Already formatted: ") + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (PrintException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Printing failed for file: " + filePath + " - " + e.getMessage(), e);
            return _failure(sourceCode, "Printing failed: " + e.getMessage());
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return _failure(sourceCode, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Formats every file below a directory that has a registered plugin,
     * using one thread per available processor.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return new ConcurrentHashMap<>();
        }

        List<Path> filesToProcess;
        try (Stream<Path> paths = Files.walk(directory)) {
            filesToProcess = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detect(path)))
                    .toList();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new ConcurrentHashMap<>();
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return formatFiles(filesToProcess, threadCount);
    }

    /**
     * Reads and formats files in parallel. Nothing is written back.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, formatFile(file, content));
                    } catch (IOException e) {
                        errorCount.incrementAndGet();
                        logger.log(Level.WARNING, "Failed to read file: " + file, e);
                        results.put(file, _failure(null, "Failed to read file: " + e.getMessage()));
                    }
                });
            }

            executor.shutdown();
            if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.fine("Processed " + results.size() + " files");
        return results;
    }

    private static FormatterResult _failure(String sourceCode, String message) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addError(new FormatterError(Severity.FATAL, message, 0, 0))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins that hold resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) entry.getValue()).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
