package com.formatengine.api;

import java.nio.file.Path;

import com.formatengine.config.FormatterConfig;
import com.formatengine.ir.PrintItem;

/**
 * A language front end. Parses source text into print items that the shared engine renders.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the resolved configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Short name, also the key of the plugin's section in the configuration file.
     */
    String getName();

    /**
     * Builds the IR for a file.
     *
     * @throws FormatterException when the source cannot be parsed
     */
    Iterable<PrintItem> generateIr(Path filePath, String sourceCode) throws FormatterException;

    /**
     * Formats the provided source code. Parse failures are reported in the result.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
