package com.plexus.core.compiler;

import com.plexus.core.Plexus;
import com.plexus.core.error.MalformedGraphException;
import com.plexus.core.error.UnsupportedOperatorException;
import com.plexus.core.ir.IrModel;
import com.plexus.core.ir.IrModel.IrInput;
import com.plexus.core.ir.IrModel.IrNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphCompilerTest {

    private static IrNode node(String id, String type, IrInput... inputs) {
        IrNode n = new IrNode();
        n.id = id;
        n.type = type;
        n.inputs = new ArrayList<>(List.of(inputs));
        return n;
    }

    private static IrNode assign(String id, String target, IrInput value) {
        IrNode n = node(id, "variable_assign", value);
        n.value = target;
        return n;
    }

    private static IrNode binop(String id, String symbol, IrInput left, IrInput right) {
        IrNode n = node(id, "binary_op", left, right);
        n.value = symbol;
        return n;
    }

    private static String compile(IrNode... nodes) {
        return new GraphCompiler().compile(new IrModel.GraphIr(List.of(nodes)));
    }

    @Test
    void assignmentAndPrintOfLinkedVariable() {
        String source = compile(
                assign("node1", "message", IrInput.literal("value", "'Hello, Plexus!'")),
                node("node2", "print", IrInput.link("target", "node1")));

        assertEquals("message = 'Hello, Plexus!'\nprint(message)", source);
    }

    @Test
    void linkedBinaryOpIsInlinedNotEmitted() {
        String source = compile(
                binop("node_add", "+", IrInput.literal("left", "5"), IrInput.literal("right", "10")),
                assign("node_assign", "result", IrInput.link("value", "node_add")));

        assertEquals("result = 5 + 10", source);
    }

    @Test
    void ifElseWithLinkedComparison() {
        IrNode ifNode = node("if1", "if_statement", IrInput.link("test", "cmp1"));
        ifNode.body = List.of(node("p1", "print", IrInput.literal("target", "'Welcome'")));
        ifNode.orelse = List.of(node("p2", "print", IrInput.literal("target", "'Too young'")));

        String source = compile(
                assign("a1", "age", IrInput.literal("value", "21")),
                binop("cmp1", ">=", IrInput.link("left", "a1"), IrInput.literal("right", "18")),
                ifNode);

        assertEquals("age = 21\nif age >= 18:\n    print('Welcome')\nelse:\n    print('Too young')", source);
    }

    @Test
    void forLoopVariableIsReadThroughLinkToLoopNode() {
        IrNode loop = node("f1", "for_loop", IrInput.link("iter", "a1"));
        loop.targetVariable = "i";
        loop.body = List.of(node("p1", "print", IrInput.link("target", "f1")));

        String source = compile(assign("a1", "items", IrInput.literal("value", "[1, 2]")), loop);

        assertEquals("items = [1, 2]\nfor i in items:\n    print(i)", source);
    }

    @Test
    void emptyBodiesCompileToPass() {
        IrNode ifNode = node("if1", "if_statement", IrInput.literal("test", "True"));
        IrNode loop = node("f1", "for_loop", IrInput.literal("iter", "[]"));
        loop.targetVariable = "x";

        assertEquals("if True:\n    pass\nfor x in []:\n    pass", compile(ifNode, loop));
    }

    @Test
    void elseHoldingSingleIfIsWrittenAsElif() {
        IrNode inner = node("if2", "if_statement", IrInput.literal("test", "False"));
        inner.body = List.of(node("p2", "print", IrInput.literal("target", "2")));
        IrNode outer = node("if1", "if_statement", IrInput.literal("test", "True"));
        outer.body = List.of(node("p1", "print", IrInput.literal("target", "1")));
        outer.orelse = List.of(inner);

        assertEquals("if True:\n    print(1)\nelif False:\n    print(2)", compile(outer));
    }

    @Test
    void unlinkedCallIsAnExpressionStatement() {
        IrNode call = node("c1", "call_function", IrInput.literal("arg0", "'hello'"));
        call.funcName = "len";

        assertEquals("len('hello')", compile(call));
    }

    @Test
    void linkedCallIsInlinedIntoItsConsumer() {
        IrNode call = node("c1", "call_function", IrInput.literal("arg0", "'abc'"));
        call.funcName = "len";

        assertEquals("n = len('abc')", compile(call, assign("a1", "n", IrInput.link("value", "c1"))));
    }

    @Test
    void callArgumentsAreOrderedByNumericSuffix() {
        List<IrInput> inputs = new ArrayList<>();
        for (int i = 11; i >= 0; i--) {
            inputs.add(IrInput.literal("arg" + i, String.valueOf(i)));
        }
        IrNode call = node("c1", "call_function");
        call.funcName = "f";
        call.inputs = inputs;

        assertEquals("f(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11)", compile(call));
    }

    @Test
    void nestedOperatorsGetParenthesesOnlyWhereNeeded() {
        String source = compile(
                binop("b1", "+", IrInput.literal("left", "1"), IrInput.literal("right", "2")),
                binop("b2", "*", IrInput.link("left", "b1"), IrInput.literal("right", "3")),
                assign("a1", "x", IrInput.link("value", "b2")),
                binop("b3", "-", IrInput.literal("left", "2"), IrInput.literal("right", "3")),
                binop("b4", "-", IrInput.literal("left", "1"), IrInput.link("right", "b3")),
                assign("a2", "y", IrInput.link("value", "b4")));

        assertEquals("x = (1 + 2) * 3\ny = 1 - (2 - 3)", source);
    }

    @Test
    void literalTextIsCanonicalized() {
        String source = compile(
                assign("a1", "s", IrInput.literal("value", "\"Hello\"")),
                assign("a2", "n", IrInput.literal("value", "0x10")),
                assign("a3", "d", IrInput.literal("value", "{'k':[1,(2,)]}")));

        assertEquals("s = 'Hello'\nn = 16\nd = {'k': [1, (2,)]}", source);
    }

    @Test
    void danglingLinkIsReported() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class,
                () -> compile(node("p1", "print", IrInput.link("target", "non_existent_node"))));

        assertEquals("Node link 'non_existent_node' not found in graph.", ex.getMessage());
        assertEquals("p1", ex.nodeId());
    }

    @Test
    void missingRequiredInputNamesNodeAndSlot() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class,
                () -> compile(node("n1", "if_statement")));

        assertEquals("Node 'n1' of type 'if_statement' is missing required input: 'test'", ex.getMessage());
        assertEquals("n1", ex.nodeId());
        assertEquals("test", ex.field());
    }

    @Test
    void missingIdOrTypeIsReported() {
        MalformedGraphException noId = assertThrows(MalformedGraphException.class,
                () -> compile(node(null, "print", IrInput.literal("target", "1"))));
        assertTrue(noId.getMessage().contains("missing a required 'id' field"));

        MalformedGraphException noType = assertThrows(MalformedGraphException.class,
                () -> compile(node("n1", null, IrInput.literal("target", "1"))));
        assertEquals("Node 'n1' is missing a 'type' field", noType.getMessage());
    }

    @Test
    void unknownTypeAndDuplicateIdAreRejected() {
        assertThrows(MalformedGraphException.class, () -> compile(node("n1", "while_loop")));

        MalformedGraphException dup = assertThrows(MalformedGraphException.class, () -> compile(
                node("n1", "print", IrInput.literal("target", "1")),
                node("n1", "print", IrInput.literal("target", "2"))));
        assertTrue(dup.getMessage().contains("Duplicate node id 'n1'"));
    }

    @Test
    void inputMustHaveExactlyOneOfLinkOrValue() {
        IrInput both = IrInput.literal("target", "1");
        both.link = "n0";

        assertThrows(MalformedGraphException.class, () -> compile(node("p1", "print", both)));
    }

    @Test
    void unsupportedOperatorIsReportedWithItsSymbol() {
        UnsupportedOperatorException ex = assertThrows(UnsupportedOperatorException.class, () -> compile(
                binop("b1", "%", IrInput.literal("left", "7"), IrInput.literal("right", "2"))));

        assertEquals("%", ex.symbol());
        assertTrue(ex.getMessage().contains("Operator '%' is not implemented"));
    }

    @Test
    void linkCycleIsDetected() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class, () -> compile(
                binop("b1", "+", IrInput.link("left", "b2"), IrInput.literal("right", "1")),
                binop("b2", "+", IrInput.link("left", "b1"), IrInput.literal("right", "1")),
                assign("a1", "x", IrInput.link("value", "b1"))));

        assertTrue(ex.getMessage().contains("cycle"));
    }

    @Test
    void linkToNodeWithoutValueIsRejected() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class, () -> compile(
                node("p1", "print", IrInput.literal("target", "1")),
                assign("a1", "x", IrInput.link("value", "p1"))));

        assertTrue(ex.getMessage().contains("produces no value"));
    }

    @Test
    void literalInputCannotCarryCode() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class, () -> compile(
                assign("a1", "x", IrInput.literal("value", "__import__('os').system('ls')"))));

        assertEquals("value", ex.field());
        assertTrue(ex.getMessage().contains("is not a valid literal"));
        assertThrows(MalformedGraphException.class, () -> compile(
                assign("a1", "x", IrInput.literal("value", "1\nimport os"))));
    }

    @Test
    void emittedNamesMustBeIdentifiers() {
        assertThrows(MalformedGraphException.class, () -> compile(
                assign("a1", "x; import os", IrInput.literal("value", "1"))));

        IrNode call = node("c1", "call_function");
        call.funcName = "os.system";
        assertThrows(MalformedGraphException.class, () -> compile(call));
    }

    @Test
    void bodyOnlyAllowedOnBlockNodes() {
        IrNode p = node("p1", "print", IrInput.literal("target", "1"));
        p.body = List.of(node("p2", "print", IrInput.literal("target", "2")));

        assertThrows(MalformedGraphException.class, () -> compile(p));
    }

    @Test
    void missingNodesListIsRejected() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class,
                () -> Plexus.compileJson("{}"));
        assertEquals("Graph is missing a 'nodes' list", ex.getMessage());
    }

    @Test
    void emptyGraphCompilesToEmptySource() {
        assertEquals("", Plexus.compileJson("{\"nodes\": [], \"connections\": []}"));
    }

    @Test
    void compilesFromJsonText() {
        String json = """
                {
                  "nodes": [
                    {"id": "node1", "type": "variable_assign", "value": "message",
                     "inputs": [{"name": "value", "value": "'Hello, Plexus!'"}]},
                    {"id": "node2", "type": "print",
                     "inputs": [{"name": "target", "link": "node1"}]}
                  ],
                  "connections": []
                }
                """;

        assertEquals("message = 'Hello, Plexus!'\nprint(message)", Plexus.compileJson(json));
    }

    @Test
    void indentAndTrailingNewlineOptionsApply() {
        IrNode ifNode = node("if1", "if_statement", IrInput.literal("test", "True"));
        ifNode.body = List.of(node("p1", "print", IrInput.literal("target", "1")));

        String source = new GraphCompiler(new CompilerOptions(2, true))
                .compile(new IrModel.GraphIr(List.of(ifNode)));

        assertEquals("if True:\n  print(1)\n", source);
        assertThrows(IllegalArgumentException.class, () -> new CompilerOptions(0, false));
    }

    @Test
    void compilerInstanceIsReusable() {
        GraphCompiler compiler = new GraphCompiler();
        IrModel.GraphIr graph = new IrModel.GraphIr(List.of(
                assign("a1", "x", IrInput.literal("value", "1"))));

        assertEquals(compiler.compile(graph), compiler.compile(graph));
    }
}
