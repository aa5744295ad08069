package com.plexus.core.decompiler;

import com.plexus.core.ir.NodeKind;

/**
 * Generates node ids following the convention:
 *   <prefix>-<n>      e.g. assign-1, print-2, compare-3
 * One counter is shared across all prefixes, so ids are unique within a graph whatever
 * their prefix.
 */
public class NodeIdGenerator {

    private int count;

    public String next(String prefix) {
        return prefix + "-" + (++count);
    }

    public String next(NodeKind kind) {
        return next(kind.idPrefix());
    }
}
