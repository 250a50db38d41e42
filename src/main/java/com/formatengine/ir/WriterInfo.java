package com.formatengine.ir;

/**
 * Immutable snapshot of the writer position. Line and column numbers are zero based.
 */
public final class WriterInfo {
    private final int lineNumber;
    private final int columnNumber;
    private final int indentLevel;
    private final int lineStartIndentLevel;
    private final int indentWidth;
    private final boolean expectNewLineNext;

    public WriterInfo(int lineNumber, int columnNumber, int indentLevel, int lineStartIndentLevel,
                      int indentWidth, boolean expectNewLineNext) {
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.indentLevel = indentLevel;
        this.lineStartIndentLevel = lineStartIndentLevel;
        this.indentWidth = indentWidth;
        this.expectNewLineNext = expectNewLineNext;
    }

    public int getLineNumber() { return lineNumber; }
    public int getColumnNumber() { return columnNumber; }
    public int getIndentLevel() { return indentLevel; }
    public int getLineStartIndentLevel() { return lineStartIndentLevel; }
    public int getIndentWidth() { return indentWidth; }
    public boolean isExpectNewLineNext() { return expectNewLineNext; }

    public int getLineStartColumnNumber() {
        return lineStartIndentLevel * indentWidth;
    }

    /**
     * True when nothing but indentation precedes the position on its line,
     * or a line break is pending.
     */
    public boolean isStartOfLine() {
        return expectNewLineNext || isColumnNumberAtLineStart();
    }

    public boolean isStartOfLineIndented() {
        return lineStartIndentLevel > indentLevel;
    }

    public boolean isColumnNumberAtLineStart() {
        return columnNumber == getLineStartColumnNumber();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WriterInfo)) {
            return false;
        }
        WriterInfo other = (WriterInfo) o;
        return lineNumber == other.lineNumber
                && columnNumber == other.columnNumber
                && indentLevel == other.indentLevel
                && lineStartIndentLevel == other.lineStartIndentLevel
                && indentWidth == other.indentWidth
                && expectNewLineNext == other.expectNewLineNext;
    }

    @Override
    public int hashCode() {
        int result = lineNumber;
        result = 31 * result + columnNumber;
        result = 31 * result + indentLevel;
        result = 31 * result + lineStartIndentLevel;
        result = 31 * result + indentWidth;
        result = 31 * result + (expectNewLineNext ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "WriterInfo{line=" + lineNumber + ", column=" + columnNumber
                + ", indentLevel=" + indentLevel + ", lineStartIndentLevel=" + lineStartIndentLevel + "}";
    }
}
