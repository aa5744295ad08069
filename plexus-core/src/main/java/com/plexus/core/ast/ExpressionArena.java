package com.plexus.core.ast;

/**
 * Hands out expression slots for one parse or one compile. Slots are dense, start at 0
 * and are never reused within the arena.
 */
public final class ExpressionArena {

    private int next;

    public int nextSlot() {
        return next++;
    }

    /** Number of slots handed out so far. */
    public int size() {
        return next;
    }
}
