package com.formatengine.api;

/**
 * Thrown by a front end when source text cannot be parsed.
 * Line and column are one based, or zero when unknown.
 */
public class FormatterException extends Exception {
    private final int line;
    private final int column;

    public FormatterException(String message) {
        this(message, 0, 0, null);
    }

    public FormatterException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
}
