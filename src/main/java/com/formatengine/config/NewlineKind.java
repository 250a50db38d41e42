package com.formatengine.config;

/**
 * Which line ending the formatted output uses.
 */
public enum NewlineKind {
    /** Whatever the last line ending in the file is, {@code \n} when it has none. */
    AUTO("auto"),
    LF("lf"),
    CRLF("crlf"),
    /** The platform line separator. */
    SYSTEM("system");

    private final String value;

    NewlineKind(String value) {
        this.value = value;
    }

    /**
     * The name used in configuration files.
     */
    public String getValue() {
        return value;
    }

    /**
     * Looks up a kind by its configuration name.
     *
     * @return the kind, or {@code null} if the value is not recognized
     */
    public static NewlineKind fromValue(String value) {
        for (NewlineKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Gets the newline string to emit for a file with the given text.
     */
    public String resolve(String fileText) {
        return switch (this) {
            case AUTO -> _detect(fileText);
            case LF -> "\n";
            case CRLF -> "\r\n";
            case SYSTEM -> System.lineSeparator();
        };
    }

    private static String _detect(String fileText) {
        if (fileText == null) {
            return "\n";
        }
        int lastNewLine = fileText.lastIndexOf('\n');
        if (lastNewLine > 0 && fileText.charAt(lastNewLine - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }
}
