package com.formatengine.config;

import java.util.Objects;

/**
 * A problem with one configuration property. Never fatal: the default is used instead.
 */
public class ConfigurationDiagnostic {
    private final String propertyName;
    private final String message;

    public ConfigurationDiagnostic(String propertyName, String message) {
        this.propertyName = propertyName;
        this.message = message;
    }

    public String getPropertyName() { return propertyName; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfigurationDiagnostic)) {
            return false;
        }
        ConfigurationDiagnostic other = (ConfigurationDiagnostic) o;
        return Objects.equals(propertyName, other.propertyName) && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyName, message);
    }

    @Override
    public String toString() {
        return message + " (" + propertyName + ")";
    }
}
