package com.formatengine.api.error;

public enum Severity {
    FATAL,   // the file could not be formatted
    ERROR,   // needs manual intervention
    WARNING, // formatted, but something looked off
    INFO
}
