package com.formatengine.ir;

/**
 * Named marker. When the engine reaches it, the writer position is frozen and can be
 * looked up by conditions through {@link ResolveConditionContext#getResolvedInfo(Info)}.
 * Identity is the object itself, so two infos with the same name are distinct.
 */
public final class Info implements PrintItem {
    private final String name;

    public Info(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Info(" + name + ")";
    }
}
