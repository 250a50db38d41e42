package com.formatengine.ir;

/**
 * A single node of the intermediate representation a front end emits instead of text.
 * Implemented by {@link Text}, {@link Signal}, {@link Info} and {@link Condition}.
 */
public interface PrintItem {
}
