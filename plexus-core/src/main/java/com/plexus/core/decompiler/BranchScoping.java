package com.plexus.core.decompiler;

/**
 * How variable bindings made inside an {@code if} branch or a {@code for} body are seen by
 * the code that follows it.
 */
public enum BranchScoping {
    /** Bindings made in a body stay visible afterwards, as at function scope. */
    SHARED,
    /** Each body starts from a snapshot of the enclosing bindings, and that snapshot is restored after it. */
    ISOLATED;

    public static BranchScoping fromName(String name) {
        for (BranchScoping s : values()) {
            if (s.name().equalsIgnoreCase(name)) return s;
        }
        throw new IllegalArgumentException("Unknown branch scoping: " + name + " (expected 'shared' or 'isolated')");
    }
}
