package com.formatengine.config;

import java.util.Collections;
import java.util.List;

/**
 * A resolved configuration together with the problems found while resolving it.
 */
public class ResolveConfigurationResult<T> {
    private final T config;
    private final List<ConfigurationDiagnostic> diagnostics;

    public ResolveConfigurationResult(T config, List<ConfigurationDiagnostic> diagnostics) {
        this.config = config;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public T getConfig() {
        return config;
    }

    public List<ConfigurationDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
