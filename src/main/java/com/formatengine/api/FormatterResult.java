package com.formatengine.api;

import java.util.ArrayList;
import java.util.List;

import com.formatengine.api.error.FormatterError;

/**
 * Result of a formatting operation.
 *
 * <p>A successful result whose {@link #isChanged()} is false means the formatted text equals the
 * input, so there is nothing to write.</p>
 */
public class FormatterResult {
    private final boolean successful;
    private final boolean changed;
    private final String formattedCode;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.changed = builder.changed;
        this.formattedCode = builder.formattedCode;
        this.errors = builder.errors;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public boolean isChanged() {
        return changed;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * A successful result that leaves the source as it is.
     */
    public static FormatterResult unchanged(String sourceCode) {
        return builder().successful(true).changed(false).formattedCode(sourceCode).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private boolean changed;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
