package com.formatengine.ir;

/**
 * Decides which branch of a {@link Condition} is taken.
 */
@FunctionalInterface
public interface ConditionResolver {
    /**
     * @return {@code true} or {@code false}, or {@code null} when the answer depends on
     *         something that has not been reached yet
     */
    Boolean resolve(ResolveConditionContext context);
}
