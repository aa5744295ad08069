package com.plexus.core.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeKindTest {

    @Test
    void tagsMatchWireNames() {
        assertEquals(NodeKind.VARIABLE_ASSIGN, NodeKind.fromTag("variable_assign"));
        assertEquals(NodeKind.PRINT, NodeKind.fromTag("print"));
        assertEquals(NodeKind.CALL, NodeKind.fromTag("call_function"));
        assertEquals(NodeKind.IF, NodeKind.fromTag("if_statement"));
        assertEquals(NodeKind.FOR, NodeKind.fromTag("for_loop"));
        assertEquals(NodeKind.BINARY_OP, NodeKind.fromTag("binary_op"));
        assertNull(NodeKind.fromTag("while_loop"));
    }

    @Test
    void onlyCallsAndOperatorsAreValueKinds() {
        for (NodeKind kind : NodeKind.values()) {
            boolean expected = kind == NodeKind.CALL || kind == NodeKind.BINARY_OP;
            assertEquals(expected, kind.isValueKind(), kind.name());
        }
    }
}
