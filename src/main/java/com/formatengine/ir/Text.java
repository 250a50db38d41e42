package com.formatengine.ir;

import java.util.Objects;

/**
 * Literal characters to emit as is.
 */
public final class Text implements PrintItem {
    private final String text;

    public Text(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Text of(String text) {
        return new Text(text);
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Text)) {
            return false;
        }
        return text.equals(((Text) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Text(\"" + text + "\")";
    }
}
