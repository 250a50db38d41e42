package com.formatengine.ir;

/**
 * What a {@link ConditionResolver} may see while the engine is emitting.
 * Lookups never fail: anything not reached yet is reported as unresolved.
 */
public interface ResolveConditionContext {

    /**
     * Gets the value a condition resolved to, or {@code null} if it has not been resolved.
     */
    Boolean getResolvedCondition(Condition condition);

    /**
     * Gets the value a condition resolved to, or the provided default if it has not been resolved.
     */
    default boolean getResolvedCondition(Condition condition, boolean defaultValue) {
        Boolean value = getResolvedCondition(condition);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets the writer position frozen when the info was reached, or {@code null} if not reached yet.
     */
    WriterInfo getResolvedInfo(Info info);

    default WriterInfo getResolvedInfo(Info info, WriterInfo defaultValue) {
        WriterInfo value = getResolvedInfo(info);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets the writer position at the condition being resolved.
     */
    WriterInfo getWriterInfo();

    boolean isForcingNoNewLines();
}
