package com.formatengine.printing;

import java.util.Objects;

/**
 * An already decided output primitive.
 */
public final class WriteItem {
    public enum Kind {
        TEXT,
        INDENT,
        NEW_LINE,
        TAB,
        SPACE
    }

    public static final WriteItem NEW_LINE = new WriteItem(Kind.NEW_LINE, null, 0);
    public static final WriteItem TAB = new WriteItem(Kind.TAB, null, 0);
    public static final WriteItem SPACE = new WriteItem(Kind.SPACE, null, 0);

    private final Kind kind;
    private final String text;
    private final int indentCount;

    private WriteItem(Kind kind, String text, int indentCount) {
        this.kind = kind;
        this.text = text;
        this.indentCount = indentCount;
    }

    public static WriteItem text(String text) {
        return new WriteItem(Kind.TEXT, Objects.requireNonNull(text, "text"), 0);
    }

    /**
     * The given number of indentation units.
     */
    public static WriteItem indent(int count) {
        return new WriteItem(Kind.INDENT, null, count);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getIndentCount() {
        return indentCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WriteItem)) {
            return false;
        }
        WriteItem other = (WriteItem) o;
        return kind == other.kind && indentCount == other.indentCount && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, indentCount);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TEXT -> "Text(\"" + text + "\")";
            case INDENT -> "Indent(" + indentCount + ")";
            default -> kind.name();
        };
    }
}
