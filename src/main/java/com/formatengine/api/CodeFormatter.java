package com.formatengine.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats files by handing them to the plugin registered for their type.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
