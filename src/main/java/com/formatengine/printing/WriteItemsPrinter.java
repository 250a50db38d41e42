package com.formatengine.printing;

import java.util.List;

/**
 * Concatenates write items into the final text. Holds no width logic.
 */
public class WriteItemsPrinter {
    private final String indentUnit;
    private final String newLine;

    public WriteItemsPrinter(int indentWidth, boolean useTabs, String newLine) {
        this.indentUnit = useTabs ? "\t" : " ".repeat(indentWidth);
        this.newLine = newLine;
    }

    public String print(List<WriteItem> items) {
        StringBuilder sb = new StringBuilder();
        for (WriteItem item : items) {
            switch (item.getKind()) {
                case TEXT -> sb.append(item.getText());
                case INDENT -> sb.append(indentUnit.repeat(item.getIndentCount()));
                case NEW_LINE -> sb.append(newLine);
                case TAB -> sb.append('\t');
                case SPACE -> sb.append(' ');
            }
        }
        return sb.toString();
    }
}
