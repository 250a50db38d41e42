package com.formatengine.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WriterInfoTests {

    @Test
    void startOfLineAtIndentColumn() {
        WriterInfo info = new WriterInfo(2, 8, 2, 2, 4, false);

        assertTrue(info.isStartOfLine());
        assertEquals(8, info.getLineStartColumnNumber());
        assertFalse(info.isStartOfLineIndented());
    }

    @Test
    void pendingNewLineCountsAsStartOfLine() {
        assertTrue(new WriterInfo(0, 5, 0, 0, 4, true).isStartOfLine());
        assertFalse(new WriterInfo(0, 5, 0, 0, 4, false).isStartOfLine());
    }

    @Test
    void lineStartedDeeperThanCurrentIndentIsIndented() {
        assertTrue(new WriterInfo(1, 10, 1, 2, 4, false).isStartOfLineIndented());
    }

    @Test
    void equalityUsesAllFields() {
        assertEquals(new WriterInfo(1, 2, 3, 4, 5, false), new WriterInfo(1, 2, 3, 4, 5, false));
        assertNotEquals(new WriterInfo(1, 2, 3, 4, 5, false), new WriterInfo(1, 2, 3, 4, 5, true));
    }
}
