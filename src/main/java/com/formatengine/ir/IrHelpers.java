package com.formatengine.ir;

/**
 * Wrappers that front ends combine to build IR.
 */
public final class IrHelpers {

    private IrHelpers() {
    }

    public static PrintItems withIndent(Iterable<PrintItem> items) {
        return withIndentTimes(items, 1);
    }

    public static PrintItems withIndentTimes(Iterable<PrintItem> items, int times) {
        PrintItems inner = _copy(items);
        if (inner.isEmpty()) {
            return inner;
        }
        PrintItems result = new PrintItems();
        for (int i = 0; i < times; i++) {
            result.push(Signal.START_INDENT);
        }
        result.pushAll(inner);
        for (int i = 0; i < times; i++) {
            result.push(Signal.FINISH_INDENT);
        }
        return result;
    }

    /**
     * Indents everything after the first written item.
     */
    public static PrintItems withQueuedIndent(Iterable<PrintItem> items) {
        return _surround(Signal.QUEUE_START_INDENT, items, Signal.FINISH_INDENT);
    }

    public static PrintItems newLineGroup(Iterable<PrintItem> items) {
        return _surround(Signal.START_NEW_LINE_GROUP, items, Signal.FINISH_NEW_LINE_GROUP);
    }

    public static PrintItems withNoNewLines(Iterable<PrintItem> items) {
        return _surround(Signal.START_FORCE_NO_NEW_LINES, items, Signal.FINISH_FORCE_NO_NEW_LINES);
    }

    public static PrintItems surroundWithNewLines(Iterable<PrintItem> items) {
        return _surround(Signal.NEW_LINE, items, Signal.NEW_LINE);
    }

    /**
     * Converts text into items, turning line breaks into {@link Signal#NEW_LINE} and tabs into
     * {@link Signal#TAB} so the engine accounts for them.
     */
    public static PrintItems fromString(String text) {
        PrintItems result = new PrintItems();
        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                result.push(Signal.NEW_LINE);
            }
            _pushLine(result, lines[i]);
        }
        return result;
    }

    /**
     * Like {@link #fromString(String)} but continuation lines keep their own leading whitespace
     * instead of receiving the current indentation.
     */
    public static PrintItems fromRawString(String text) {
        if (text.indexOf('\n') < 0) {
            return fromString(text);
        }
        return _surround(Signal.START_IGNORING_INDENT, fromString(text), Signal.FINISH_IGNORING_INDENT);
    }

    private static void _pushLine(PrintItems result, String line) {
        int start = 0;
        int tab = line.indexOf('\t');
        while (tab >= 0) {
            result.push(line.substring(start, tab));
            result.push(Signal.TAB);
            start = tab + 1;
            tab = line.indexOf('\t', start);
        }
        result.push(line.substring(start));
    }

    private static PrintItems _surround(Signal start, Iterable<PrintItem> items, Signal finish) {
        PrintItems inner = _copy(items);
        if (inner.isEmpty()) {
            return inner;
        }
        PrintItems result = new PrintItems();
        result.push(start);
        result.pushAll(inner);
        result.push(finish);
        return result;
    }

    private static PrintItems _copy(Iterable<PrintItem> items) {
        if (items instanceof PrintItems) {
            return (PrintItems) items;
        }
        return new PrintItems().pushAll(items);
    }
}
