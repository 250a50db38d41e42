package com.formatengine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LoggerUtilTests {

    @AfterEach
    void restoreLevel() {
        LoggerUtil.setConsoleLevel(Level.WARNING);
    }

    @Test
    void verboseLevelReachesEngineLoggers() {
        Logger printingLogger = LoggerUtil.getLogger("com.formatengine.printing.Printer");

        LoggerUtil.setConsoleLevel(Level.FINE);

        assertTrue(printingLogger.isLoggable(Level.FINE));
        assertNull(Logger.getLogger("com.formatengine.printing").getLevel());
    }
}
