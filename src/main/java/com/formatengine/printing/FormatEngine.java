package com.formatengine.printing;

import java.util.List;
import java.util.logging.Logger;

import com.formatengine.api.FormatterResult;
import com.formatengine.config.FormatterConfig;
import com.formatengine.ir.PrintItem;
import com.formatengine.util.LoggerUtil;

/**
 * Renders IR to text with a resolved configuration: prepares the graph, runs the resolution
 * engine and assembles the write items using the newline kind the configuration asks for.
 */
public class FormatEngine {
    private static final Logger logger = LoggerUtil.getLogger(FormatEngine.class);

    /**
     * Formats and compares with the source text.
     *
     * @return a successful result, marked unchanged when the output equals {@code sourceText}
     * @throws PrintException when the IR is malformed or a resolver fails
     */
    public FormatterResult format(String sourceText, Iterable<PrintItem> ir, FormatterConfig config) {
        String formatted = print(ir, config, sourceText);
        if (formatted.equals(sourceText)) {
            return FormatterResult.unchanged(sourceText);
        }
        return FormatterResult.builder()
                .successful(true)
                .changed(true)
                .formattedCode(formatted)
                .build();
    }

    /**
     * Renders IR to text.
     *
     * @param sourceText the original file text, consulted when the newline kind is automatic
     */
    public String print(Iterable<PrintItem> ir, FormatterConfig config, String sourceText) {
        PrintOptions options = new PrintOptions(config.getLineWidth(), config.getIndentWidth(), config.isUseTabs());
        List<WriteItem> writeItems = new Printer(options).print(ir);
        String newLine = config.getNewlineKind().resolve(sourceText);

        logger.finer("Assembling " + writeItems.size() + " write items");
        return new WriteItemsPrinter(config.getIndentWidth(), config.isUseTabs(), newLine).print(writeItems);
    }
}
