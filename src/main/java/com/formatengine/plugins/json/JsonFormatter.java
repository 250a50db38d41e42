package com.formatengine.plugins.json;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.formatengine.api.FormatterException;
import com.formatengine.api.FormatterPlugin;
import com.formatengine.api.FormatterResult;
import com.formatengine.api.error.FormatterError;
import com.formatengine.api.error.Severity;
import com.formatengine.config.FormatterConfig;
import com.formatengine.ir.PrintItem;
import com.formatengine.printing.FormatEngine;
import com.formatengine.util.LoggerUtil;

/**
 * JSON formatter plugin. Parses with Jackson's streaming parser and renders through the
 * shared engine. Comments are not supported and are reported as parse errors.
 */
public class JsonFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(JsonFormatter.class);
    public static final String NAME = "json";

    private final JsonFactory jsonFactory = new JsonFactory();
    private final FormatEngine engine = new FormatEngine();
    private FormatterConfig config = FormatterConfig.defaults();

    @Override
    public void initialize(FormatterConfig config) {
        this.config = config.forPlugin(NAME);
        logger.fine("JSON plugin initialized: lineWidth=" + this.config.getLineWidth()
                + ", indentWidth=" + this.config.getIndentWidth() + ", useTabs=" + this.config.isUseTabs());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Iterable<PrintItem> generateIr(Path filePath, String sourceCode) throws FormatterException {
        try (JsonParser parser = jsonFactory.createParser(sourceCode)) {
            return new JsonIrGenerator(parser).generate();
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new FormatterException(e.getOriginalMessage(),
                    location != null ? location.getLineNr() : 0,
                    location != null ? location.getColumnNr() : 0, e);
        } catch (IOException e) {
            throw new FormatterException("Failed to read JSON: " + e.getMessage(), 0, 0, e);
        }
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        Iterable<PrintItem> ir;
        try {
            ir = generateIr(filePath, sourceCode);
        } catch (FormatterException e) {
            logger.fine("Failed to parse " + filePath + ": " + e.getMessage());
            return _handleParseError(e);
        }
        return engine.format(sourceCode, ir, config);
    }

    private FormatterResult _handleParseError(FormatterException e) {
        FormatterError error = new FormatterError(
                Severity.FATAL,
                "Failed to parse JSON: " + e.getMessage(),
                e.getLine(), e.getColumn());

        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(error)
                .build();
    }
}
