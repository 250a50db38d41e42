package com.formatengine.ir;

/**
 * Building blocks for resolvers that compare resolved infos.
 * Every helper returns {@code null} when one of the infos it needs has not been reached.
 */
public final class ConditionHelpers {

    private ConditionHelpers() {
    }

    public static Boolean isMultipleLines(ResolveConditionContext context, Info startInfo, Info endInfo) {
        WriterInfo start = context.getResolvedInfo(startInfo);
        WriterInfo end = context.getResolvedInfo(endInfo);
        if (start == null || end == null) {
            return null;
        }
        return end.getLineNumber() > start.getLineNumber();
    }

    /**
     * Whether the line at {@code endInfo} starts at a deeper indent than the line at {@code startInfo}.
     * A {@code null} end info means the position being resolved.
     */
    public static Boolean isHanging(ResolveConditionContext context, Info startInfo, Info endInfo) {
        WriterInfo start = context.getResolvedInfo(startInfo);
        WriterInfo end = endInfo == null ? context.getWriterInfo() : context.getResolvedInfo(endInfo);
        if (start == null || end == null) {
            return null;
        }
        return end.getLineStartIndentLevel() > start.getLineStartIndentLevel();
    }

    public static Boolean areInfosEqual(ResolveConditionContext context, Info startInfo, Info endInfo) {
        WriterInfo start = context.getResolvedInfo(startInfo);
        WriterInfo end = context.getResolvedInfo(endInfo);
        if (start == null || end == null) {
            return null;
        }
        return start.getLineNumber() == end.getLineNumber() && start.getColumnNumber() == end.getColumnNumber();
    }

    public static Boolean areInfosNotEqual(ResolveConditionContext context, Info startInfo, Info endInfo) {
        Boolean equal = areInfosEqual(context, startInfo, endInfo);
        return equal == null ? null : !equal;
    }

    public static Boolean isAtSamePosition(ResolveConditionContext context, Info info) {
        WriterInfo resolved = context.getResolvedInfo(info);
        if (resolved == null) {
            return null;
        }
        WriterInfo current = context.getWriterInfo();
        return resolved.getLineNumber() == current.getLineNumber()
                && resolved.getColumnNumber() == current.getColumnNumber();
    }

    public static Boolean isOnSameLine(ResolveConditionContext context, Info info) {
        WriterInfo resolved = context.getResolvedInfo(info);
        if (resolved == null) {
            return null;
        }
        return resolved.getLineNumber() == context.getWriterInfo().getLineNumber();
    }

    public static Boolean isOnDifferentLine(ResolveConditionContext context, Info info) {
        Boolean sameLine = isOnSameLine(context, info);
        return sameLine == null ? null : !sameLine;
    }
}
