package com.formatengine.ir;

/**
 * Factories for frequently used conditions.
 */
public final class Conditions {

    private Conditions() {
    }

    public static Condition ifTrue(String name, ConditionResolver resolver, Iterable<PrintItem> truePath) {
        return Condition.builder(name).resolver(resolver).truePath(truePath).build();
    }

    public static Condition ifTrueOr(String name, ConditionResolver resolver, Iterable<PrintItem> truePath,
                                     Iterable<PrintItem> falsePath) {
        return Condition.builder(name).resolver(resolver).truePath(truePath).falsePath(falsePath).build();
    }

    public static Condition ifFalse(String name, ConditionResolver resolver, Iterable<PrintItem> falsePath) {
        return Condition.builder(name).resolver(resolver).falsePath(falsePath).build();
    }

    public static Condition indentIfStartOfLine(Iterable<PrintItem> items) {
        return ifTrueOr("indentIfStartOfLine", ConditionResolvers.isStartOfLine(),
                IrHelpers.withIndent(items), items);
    }

    public static Condition indentIfStartOfLineOrStartOfLineIndented(Iterable<PrintItem> items) {
        return ifTrueOr("withIndentIfStartOfLineOrStartOfLineIndented",
                ConditionResolvers.isStartOfLineOrIsStartOfLineIndented(), IrHelpers.withIndent(items), items);
    }

    public static Condition withIndentIfStartOfLineIndented(Iterable<PrintItem> items) {
        return ifTrueOr("withIndentIfStartOfLineIndented", ConditionResolvers.isStartOfLineIndented(),
                IrHelpers.withIndent(items), items);
    }

    public static Condition spaceIfNotStartOfLine() {
        return ifTrue("spaceIfNotStartOfLine", ConditionResolvers.isNotStartOfLine(), PrintItems.of(Text.of(" ")));
    }

    public static Condition singleIndentIfStartOfLine() {
        return ifTrue("singleIndentIfStartOfLine", ConditionResolvers.isStartOfLine(),
                PrintItems.of(Signal.SINGLE_INDENT));
    }

    /**
     * A line break when the current line starts deeper than the line of {@code startInfo}.
     * A {@code null} end info compares against the condition's own position.
     */
    public static Condition newLineIfHanging(Info startInfo, Info endInfo) {
        return ifTrue("newLineIfHanging", context -> ConditionHelpers.isHanging(context, startInfo, endInfo),
                PrintItems.of(Signal.NEW_LINE));
    }

    public static Condition newLineIfHangingSpaceOtherwise(Info startInfo, Info endInfo) {
        return ifTrueOr("newLineIfHangingSpaceOtherwise",
                context -> ConditionHelpers.isHanging(context, startInfo, endInfo),
                PrintItems.of(Signal.NEW_LINE), PrintItems.of(Text.of(" ")));
    }

    public static Condition newLineIfMultipleLinesSpaceOrNewLineOtherwise(Info startInfo, Info endInfo) {
        return ifTrueOr("newLineIfMultipleLinesSpaceOrNewLineOtherwise", context -> {
            WriterInfo start = context.getResolvedInfo(startInfo);
            WriterInfo end = endInfo == null ? context.getWriterInfo() : context.getResolvedInfo(endInfo);
            if (start == null || end == null) {
                return null;
            }
            return end.getLineNumber() > start.getLineNumber();
        }, PrintItems.of(Signal.NEW_LINE), PrintItems.of(Signal.SPACE_OR_NEW_LINE));
    }

    /**
     * Prints the items when the column is more than {@code width} past the start of the line.
     */
    public static Condition ifAboveWidth(int width, Iterable<PrintItem> items) {
        return ifAboveWidthOr(width, items, null);
    }

    public static Condition ifAboveWidthOr(int width, Iterable<PrintItem> trueItems, Iterable<PrintItem> falseItems) {
        return ifTrueOr("ifAboveWidth", context -> {
            WriterInfo writerInfo = context.getWriterInfo();
            return writerInfo.getColumnNumber() > writerInfo.getLineStartColumnNumber() + width;
        }, trueItems, falseItems);
    }
}
