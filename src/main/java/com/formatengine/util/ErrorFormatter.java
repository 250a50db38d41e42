package com.formatengine.util;

import com.formatengine.api.error.FormatterError;
import com.formatengine.api.error.Severity;
import com.formatengine.config.ConfigurationDiagnostic;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders errors and configuration diagnostics for the console.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use ANSI colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ").append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (Line ").append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(", Column ").append(error.getColumn());
            }
            sb.append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: ")).append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Formats a configuration diagnostic as {@code <source>: <message> (<property>)}.
     */
    public String formatDiagnostic(Path source, ConfigurationDiagnostic diagnostic) {
        String location = source != null ? source.toString() : "default configuration";
        return colorize(ANSI_YELLOW, "WARNING") + ": " + location + ": " + diagnostic;
    }

    /**
     * Creates a summary of errors per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int[] totals = new int[Severity.values().length];
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }

            int[] counts = new int[Severity.values().length];
            for (FormatterError error : entry.getValue()) {
                counts[error.getSeverity().ordinal()]++;
                totals[error.getSeverity().ordinal()]++;
            }

            sb.append(entry.getKey()).append(": ").append(_formatCounts(counts)).append("\n");
        }

        sb.append("\nTotal: ").append(_formatCounts(totals));
        return sb.toString();
    }

    private String _formatCounts(int[] counts) {
        StringBuilder sb = new StringBuilder();
        for (Severity severity : Severity.values()) {
            int count = counts[severity.ordinal()];
            if (count == 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            String color = switch (severity) {
                case FATAL, ERROR -> ANSI_RED;
                case WARNING -> ANSI_YELLOW;
                case INFO -> ANSI_BLUE;
            };
            sb.append(colorize(color, count + " " + severity.name().toLowerCase()));
        }
        return sb.toString();
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
