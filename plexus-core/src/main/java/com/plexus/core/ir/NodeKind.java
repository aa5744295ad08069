package com.plexus.core.ir;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of node kinds with their wire tags.
 */
public enum NodeKind {
    VARIABLE_ASSIGN("variable_assign", "assign"),
    PRINT("print", "print"),
    CALL("call_function", "call"),
    IF("if_statement", "if"),
    FOR("for_loop", "for"),
    BINARY_OP("binary_op", "binop");

    private static final Map<String, NodeKind> BY_TAG = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(NodeKind::tag, Function.identity())));

    private final String tag;
    private final String idPrefix;

    NodeKind(String tag, String idPrefix) {
        this.tag = tag;
        this.idPrefix = idPrefix;
    }

    public String tag() { return tag; }

    public String idPrefix() { return idPrefix; }

    /**
     * Value kinds are inlined where they are linked and only stand as statements when
     * nothing links to them. The others always stand as statements; a link to an assign
     * or a loop reads the name it binds.
     */
    public boolean isValueKind() {
        return this == CALL || this == BINARY_OP;
    }

    /** Returns null for an unknown tag. */
    public static NodeKind fromTag(String tag) {
        return tag == null ? null : BY_TAG.get(tag);
    }
}
