package com.formatengine.ir;

/**
 * Payload-free instructions to the resolution engine.
 */
public enum Signal implements PrintItem {
    /** Hard line break. */
    NEW_LINE,
    /** A tab character, counted as one indentation unit wide. */
    TAB,
    /** Zero width unless the line would exceed the maximum width, in which case a line break. */
    POSSIBLE_NEW_LINE,
    /** A single space unless the line would exceed the maximum width, in which case a line break. */
    SPACE_OR_NEW_LINE,
    /** The next written item must start on a new line. */
    EXPECT_NEW_LINE,
    START_INDENT,
    FINISH_INDENT,
    /** Break opportunities inside a group are taken only after the ones outside of it. */
    START_NEW_LINE_GROUP,
    FINISH_NEW_LINE_GROUP,
    /** One indentation unit written at the current position. */
    SINGLE_INDENT,
    START_IGNORING_INDENT,
    FINISH_IGNORING_INDENT,
    /** Starts an indent that takes effect after the next written item. */
    QUEUE_START_INDENT,
    START_FORCE_NO_NEW_LINES,
    FINISH_FORCE_NO_NEW_LINES,
    /** A space that is dropped when a line break follows it. */
    SPACE_IF_NOT_TRAILING
}
