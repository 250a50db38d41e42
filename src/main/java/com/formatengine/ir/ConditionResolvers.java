package com.formatengine.ir;

/**
 * Shared resolvers for common decisions.
 */
public final class ConditionResolvers {
    private static final ConditionResolver TRUE = context -> Boolean.TRUE;
    private static final ConditionResolver FALSE = context -> Boolean.FALSE;
    private static final ConditionResolver IS_START_OF_LINE =
            context -> context.getWriterInfo().isStartOfLine();
    private static final ConditionResolver IS_NOT_START_OF_LINE =
            context -> !context.getWriterInfo().isStartOfLine();
    private static final ConditionResolver IS_START_OF_LINE_INDENTED =
            context -> context.getWriterInfo().isStartOfLineIndented();
    private static final ConditionResolver IS_START_OF_LINE_OR_IS_START_OF_LINE_INDENTED =
            context -> context.getWriterInfo().isStartOfLineIndented() || context.getWriterInfo().isStartOfLine();
    private static final ConditionResolver IS_FORCING_NO_NEW_LINES =
            ResolveConditionContext::isForcingNoNewLines;

    private ConditionResolvers() {
    }

    public static ConditionResolver trueResolver() {
        return TRUE;
    }

    public static ConditionResolver falseResolver() {
        return FALSE;
    }

    public static ConditionResolver isStartOfLine() {
        return IS_START_OF_LINE;
    }

    public static ConditionResolver isNotStartOfLine() {
        return IS_NOT_START_OF_LINE;
    }

    public static ConditionResolver isStartOfLineIndented() {
        return IS_START_OF_LINE_INDENTED;
    }

    public static ConditionResolver isStartOfLineOrIsStartOfLineIndented() {
        return IS_START_OF_LINE_OR_IS_START_OF_LINE_INDENTED;
    }

    public static ConditionResolver isForcingNoNewLines() {
        return IS_FORCING_NO_NEW_LINES;
    }
}
