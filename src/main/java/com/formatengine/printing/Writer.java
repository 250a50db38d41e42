package com.formatengine.printing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.formatengine.ir.WriterInfo;

/**
 * Tracks line, column and indentation while collecting write items.
 *
 * <p>Indentation is not written when an indent starts but at the first write on each line,
 * unless indentation is being ignored.</p>
 */
final class Writer {
    private final int indentWidth;
    private final List<WriteItem> items = new ArrayList<>();

    private int currentLineColumn;
    private int currentLineNumber;
    private int lastLineIndentLevel;
    private int indentLevel;
    private boolean expectNewLineNext;
    private int indentQueueCount;
    private boolean lastWasNotTrailingSpace;
    private int ignoreIndentCount;

    Writer(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    /**
     * Display width of text. Tabs count as one indentation unit.
     */
    static int measure(String text, int indentWidth) {
        int width = text.codePointCount(0, text.length());
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\t') {
                width += indentWidth - 1;
            }
        }
        return width;
    }

    WriterInfo getWriterInfo() {
        return new WriterInfo(currentLineNumber, getLineColumn(), indentLevel, lastLineIndentLevel,
                indentWidth, expectNewLineNext);
    }

    /**
     * Current column. On an untouched line this is where the indentation will end.
     */
    int getLineColumn() {
        if (currentLineColumn == 0) {
            return indentWidth * indentLevel;
        }
        return currentLineColumn;
    }

    /**
     * Whether nothing has been written on the current line yet.
     */
    boolean isLineEmpty() {
        return currentLineColumn == 0;
    }

    boolean isExpectNewLineNext() {
        return expectNewLineNext;
    }

    int getIndentLevel() {
        return indentLevel;
    }

    int getIgnoreIndentCount() {
        return ignoreIndentCount;
    }

    void startIndent() {
        _setIndentLevel(indentLevel + 1);
    }

    void finishIndent() {
        if (indentQueueCount > 0) {
            indentQueueCount--;
            return;
        }
        if (indentLevel == 0) {
            throw new PrintException("Found a finish indent without a corresponding start indent");
        }
        _setIndentLevel(indentLevel - 1);
    }

    void queueIndent() {
        indentQueueCount++;
    }

    void startIgnoringIndent() {
        ignoreIndentCount++;
    }

    void finishIgnoringIndent() {
        if (ignoreIndentCount == 0) {
            throw new PrintException("Found a finish ignoring indent without a corresponding start");
        }
        ignoreIndentCount--;
    }

    void markExpectNewLine() {
        expectNewLineNext = true;
    }

    void spaceIfNotTrailing() {
        if (!expectNewLineNext) {
            _space();
            lastWasNotTrailingSpace = true;
        }
    }

    void newLine() {
        if (lastWasNotTrailingSpace) {
            items.remove(items.size() - 1);
            lastWasNotTrailingSpace = false;
        }

        currentLineColumn = 0;
        currentLineNumber++;
        lastLineIndentLevel = indentLevel;
        expectNewLineNext = false;
        _push(WriteItem.NEW_LINE);
    }

    void singleIndent() {
        _handleFirstColumn();
        currentLineColumn += indentWidth;
        _push(WriteItem.indent(1));
    }

    void tab() {
        _handleFirstColumn();
        currentLineColumn += indentWidth;
        _push(WriteItem.TAB);
    }

    void write(String text) {
        _handleFirstColumn();
        currentLineColumn += measure(text, indentWidth);
        _push(WriteItem.text(text));
    }

    List<WriteItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    private void _space() {
        _handleFirstColumn();
        currentLineColumn++;
        _push(WriteItem.SPACE);
    }

    private void _setIndentLevel(int newLevel) {
        indentLevel = newLevel;
        // the line has not started yet, so it starts at the new level
        if (currentLineColumn == 0) {
            lastLineIndentLevel = newLevel;
        }
    }

    private void _handleFirstColumn() {
        if (expectNewLineNext) {
            newLine();
        }

        lastWasNotTrailingSpace = false;

        if (currentLineColumn == 0 && indentLevel > 0 && ignoreIndentCount == 0) {
            lastLineIndentLevel = indentLevel;
            currentLineColumn = indentLevel * indentWidth;
            _push(WriteItem.indent(indentLevel));
        }
    }

    private void _push(WriteItem item) {
        items.add(item);

        if (indentQueueCount > 0) {
            indentLevel += indentQueueCount;
            indentQueueCount = 0;
        }
    }
}
