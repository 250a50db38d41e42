package com.formatengine.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Mutable builder for a sequence of print items.
 */
public final class PrintItems implements Iterable<PrintItem> {
    private final List<PrintItem> items = new ArrayList<>();

    public PrintItems() {
    }

    public static PrintItems of(PrintItem... items) {
        PrintItems result = new PrintItems();
        for (PrintItem item : items) {
            result.push(item);
        }
        return result;
    }

    public PrintItems push(PrintItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Print item cannot be null");
        }
        items.add(item);
        return this;
    }

    /**
     * Pushes text, skipping empty strings.
     */
    public PrintItems push(String text) {
        if (!text.isEmpty()) {
            items.add(new Text(text));
        }
        return this;
    }

    public PrintItems pushAll(Iterable<PrintItem> other) {
        for (PrintItem item : other) {
            push(item);
        }
        return this;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public List<PrintItem> toList() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public Iterator<PrintItem> iterator() {
        return Collections.unmodifiableList(items).iterator();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
