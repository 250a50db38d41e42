package com.formatengine.ir;

import java.util.Objects;

/**
 * A named branch node resolved to true or false while the engine emits.
 *
 * <p>The decision comes either from a {@link ConditionResolver} or from the resolved value of
 * another condition. Branches are optional and may be lazy: the engine iterates each of them
 * at most once per pass.</p>
 */
public final class Condition implements PrintItem {
    private final String name;
    private final ConditionResolver resolver;
    private final Condition reference;
    private final Iterable<PrintItem> truePath;
    private final Iterable<PrintItem> falsePath;

    private Condition(Builder builder) {
        if (builder.resolver == null && builder.reference == null) {
            throw new IllegalArgumentException(
                    "Condition '" + builder.name + "' needs a resolver or a referenced condition");
        }
        this.name = builder.name;
        this.resolver = builder.resolver;
        this.reference = builder.reference;
        this.truePath = builder.truePath;
        this.falsePath = builder.falsePath;
    }

    public Condition(String name, ConditionResolver resolver, Iterable<PrintItem> truePath,
                     Iterable<PrintItem> falsePath) {
        this(builder(name).resolver(resolver).truePath(truePath).falsePath(falsePath));
    }

    public String getName() {
        return name;
    }

    /**
     * The resolver function, or {@code null} when this condition reuses another's value.
     */
    public ConditionResolver getResolver() {
        return resolver;
    }

    /**
     * The condition whose resolved value is reused, or {@code null} when a resolver is set.
     */
    public Condition getReference() {
        return reference;
    }

    public boolean isReference() {
        return reference != null;
    }

    public Iterable<PrintItem> getTruePath() {
        return truePath;
    }

    public Iterable<PrintItem> getFalsePath() {
        return falsePath;
    }

    /**
     * Creates a condition that takes the same branch choice as {@code other}.
     */
    public static Condition reusing(String name, Condition other, Iterable<PrintItem> truePath,
                                    Iterable<PrintItem> falsePath) {
        return builder(name).reference(other).truePath(truePath).falsePath(falsePath).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "Condition(" + name + ")";
    }

    public static class Builder {
        private final String name;
        private ConditionResolver resolver;
        private Condition reference;
        private Iterable<PrintItem> truePath;
        private Iterable<PrintItem> falsePath;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder resolver(ConditionResolver resolver) {
            this.resolver = resolver;
            this.reference = null;
            return this;
        }

        public Builder reference(Condition reference) {
            this.reference = reference;
            this.resolver = null;
            return this;
        }

        public Builder truePath(Iterable<PrintItem> truePath) {
            this.truePath = truePath;
            return this;
        }

        public Builder falsePath(Iterable<PrintItem> falsePath) {
            this.falsePath = falsePath;
            return this;
        }

        public Condition build() {
            return new Condition(this);
        }
    }
}
