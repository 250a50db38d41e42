package com.formatengine.printing;

import java.util.List;

import com.formatengine.ir.PrintItem;

/**
 * Position inside one materialized item list.
 */
final class Frame {
    final List<PrintItem> items;
    int index;

    Frame(List<PrintItem> items) {
        this(items, 0);
    }

    Frame(List<PrintItem> items, int index) {
        this.items = items;
        this.index = index;
    }

    boolean hasNext() {
        return index < items.size();
    }

    PrintItem next() {
        return items.get(index++);
    }
}
