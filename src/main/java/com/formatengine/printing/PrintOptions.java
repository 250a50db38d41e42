package com.formatengine.printing;

/**
 * Settings the resolution engine needs for a single pass.
 */
public class PrintOptions {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 10_000;

    private final int maxWidth;
    private final int indentWidth;
    private final boolean useTabs;
    private final int maxNestingDepth;

    public PrintOptions(int maxWidth, int indentWidth, boolean useTabs) {
        this(maxWidth, indentWidth, useTabs, DEFAULT_MAX_NESTING_DEPTH);
    }

    public PrintOptions(int maxWidth, int indentWidth, boolean useTabs, int maxNestingDepth) {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("Max width must be greater than zero: " + maxWidth);
        }
        if (indentWidth < 1) {
            throw new IllegalArgumentException("Indent width must be greater than zero: " + indentWidth);
        }
        this.maxWidth = maxWidth;
        this.indentWidth = indentWidth;
        this.useTabs = useTabs;
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxWidth() { return maxWidth; }
    public int getIndentWidth() { return indentWidth; }
    public boolean isUseTabs() { return useTabs; }
    public int getMaxNestingDepth() { return maxNestingDepth; }
}
