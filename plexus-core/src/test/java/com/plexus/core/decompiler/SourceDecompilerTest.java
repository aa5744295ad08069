package com.plexus.core.decompiler;

import com.plexus.core.Plexus;
import com.plexus.core.error.SourceSyntaxException;
import com.plexus.core.error.UnsupportedSyntaxException;
import com.plexus.core.ir.IrModel.GraphIr;
import com.plexus.core.ir.IrModel.IrInput;
import com.plexus.core.ir.IrModel.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceDecompilerTest {

    private static final DecompilerOptions ISOLATED = new DecompilerOptions(BranchScoping.ISOLATED);

    private static GraphIr decompile(String source) {
        return new SourceDecompiler().decompile(source);
    }

    private static IrInput input(IrNode node, String name) {
        return node.inputs.stream().filter(in -> name.equals(in.name)).findFirst()
                .orElseThrow(() -> new AssertionError("no input '" + name + "' on " + node.id));
    }

    @Test
    void simpleProgramProducesLinkedNodes() {
        GraphIr graph = decompile("message = 'Hello, Plexus!'\nprint(message)");

        assertEquals(2, graph.nodes.size());
        IrNode assign = graph.nodes.get(0);
        assertEquals("assign-1", assign.id);
        assertEquals("variable_assign", assign.type);
        assertEquals("message", assign.value);
        assertEquals("'Hello, Plexus!'", input(assign, "value").value);
        assertNull(input(assign, "value").link);

        IrNode print = graph.nodes.get(1);
        assertEquals("print-2", print.id);
        assertEquals("print", print.type);
        assertEquals("assign-1", input(print, "target").link);
        assertNull(input(print, "target").value);
        assertTrue(graph.connections.isEmpty());
    }

    @Test
    void subExpressionNodePrecedesItsConsumer() {
        GraphIr graph = decompile("x = 1 + 2");

        assertEquals(2, graph.nodes.size());
        IrNode op = graph.nodes.get(0);
        assertEquals("binop-2", op.id);
        assertEquals("binary_op", op.type);
        assertEquals("+", op.value);
        assertEquals("1", input(op, "left").value);
        assertEquals("2", input(op, "right").value);
        assertEquals("binop-2", input(graph.nodes.get(1), "value").link);
    }

    @Test
    void comparisonUsesBinaryOpTypeWithComparePrefix() {
        GraphIr graph = decompile("score = 85\nif score >= 80:\n    print('B')\nelse:\n    print('C')");

        assertEquals(List.of("assign-1", "compare-3", "if-2"),
                graph.nodes.stream().map(n -> n.id).toList());
        IrNode compare = graph.nodes.get(1);
        assertEquals("binary_op", compare.type);
        assertEquals(">=", compare.value);
        assertEquals("assign-1", input(compare, "left").link);

        IrNode ifNode = graph.nodes.get(2);
        assertEquals("if_statement", ifNode.type);
        assertEquals("compare-3", input(ifNode, "test").link);
        assertEquals(1, ifNode.body.size());
        assertEquals("'B'", input(ifNode.body.get(0), "target").value);
        assertEquals(1, ifNode.orelse.size());
        assertEquals("'C'", input(ifNode.orelse.get(0), "target").value);
    }

    @Test
    void elifBecomesNestedIfInOrelse() {
        GraphIr graph = decompile("x = 1\nif x > 1:\n    pass\nelif x > 0:\n    print(x)");

        IrNode outer = graph.nodes.get(graph.nodes.size() - 1);
        assertTrue(outer.body.isEmpty());
        IrNode nested = outer.orelse.get(outer.orelse.size() - 1);
        assertEquals("if_statement", nested.type);
        // the nested test node lives in the orelse list, just before the nested if
        assertEquals("binary_op", outer.orelse.get(0).type);
    }

    @Test
    void callAssignedToVariableIsLinked() {
        GraphIr graph = decompile("n = len('abc')");

        IrNode call = graph.nodes.get(0);
        assertEquals("call-2", call.id);
        assertEquals("call_function", call.type);
        assertEquals("len", call.funcName);
        assertEquals("'abc'", input(call, "arg0").value);
        assertEquals("call-2", input(graph.nodes.get(1), "value").link);
    }

    @Test
    void printWithSeveralArgumentsIsAGeneralCall() {
        GraphIr graph = decompile("print('a', 1)");

        IrNode call = graph.nodes.get(0);
        assertEquals("call_function", call.type);
        assertEquals("print", call.funcName);
        assertEquals("'a'", input(call, "arg0").value);
        assertEquals("1", input(call, "arg1").value);
    }

    @Test
    void loopVariableLinksToForNode() {
        GraphIr graph = decompile("items = [1, 2]\nfor i in items:\n    print(i)");

        IrNode loop = graph.nodes.get(1);
        assertEquals("for-2", loop.id);
        assertEquals("for_loop", loop.type);
        assertEquals("i", loop.targetVariable);
        assertEquals("assign-1", input(loop, "iter").link);
        assertEquals("for-2", input(loop.body.get(0), "target").link);
    }

    @Test
    void loopVariableBindingEndsWithTheLoop() {
        GraphIr graph = decompile("i = 0\nfor i in [1, 2]:\n    print(i)\nprint(i)");

        assertEquals("for-2", input(graph.nodes.get(1).body.get(0), "target").link);
        assertEquals("assign-1", input(graph.nodes.get(2), "target").link);

        assertThrows(UnsupportedSyntaxException.class,
                () -> decompile("for i in [1]:\n    pass\nprint(i)"));
    }

    @Test
    void sharedScopingKeepsBranchBindings() {
        GraphIr graph = decompile("x = 1\nif True:\n    x = 2\nprint(x)");

        IrNode ifNode = graph.nodes.get(1);
        assertEquals(ifNode.body.get(0).id, input(graph.nodes.get(2), "target").link);
    }

    @Test
    void isolatedScopingRestoresBindingsAfterBranch() {
        GraphIr graph = new SourceDecompiler(ISOLATED).decompile("x = 1\nif True:\n    x = 2\nprint(x)");
        assertEquals("assign-1", input(graph.nodes.get(2), "target").link);

        UnsupportedSyntaxException ex = assertThrows(UnsupportedSyntaxException.class,
                () -> new SourceDecompiler(ISOLATED).decompile("x = 1\nif x > 0:\n    y = 2\nprint(y)"));
        assertTrue(ex.getMessage().contains("Variable 'y' used before assignment"));
    }

    @Test
    void useBeforeAssignmentReportsLine() {
        UnsupportedSyntaxException ex = assertThrows(UnsupportedSyntaxException.class,
                () -> decompile("x = 1\ny = z"));

        assertEquals(2, ex.line());
        assertEquals("Variable 'z' used before assignment (line 2)", ex.getMessage());
    }

    @Test
    void invalidSourceIsASyntaxError() {
        SourceSyntaxException ex = assertThrows(SourceSyntaxException.class,
                () -> decompile("message = 'missing quote"));
        assertTrue(ex.getMessage().startsWith("Invalid Python code provided"));
    }

    @Test
    void unsupportedConstructsAreRejected() {
        assertUnsupported("a = b = 1", "Assignment to non-simple targets");
        assertUnsupported("a, b = 1, 2", "Assignment to non-simple targets");
        assertUnsupported("print('x', end='')", "Keyword arguments are not yet supported");
        assertUnsupported("for i in [1]:\n    pass\nelse:\n    pass", "For-loop else clauses");
        assertUnsupported("for a, b in [(1, 2)]:\n    pass", "For-loop targets other than a simple name");
        assertUnsupported("while True:\n    pass", "'while' statements are not supported");
        assertUnsupported("x = 1 % 2", "Operator '%' is not supported");
        assertUnsupported("x = 1 < 2 < 3", "Chained comparisons are not supported");
        assertUnsupported("x = 1\nx", "Expression statements other than calls and operators");
    }

    private static void assertUnsupported(String source, String expected) {
        UnsupportedSyntaxException ex = assertThrows(UnsupportedSyntaxException.class,
                () -> decompile(source), source);
        assertTrue(ex.getMessage().contains(expected), ex.getMessage());
    }

    @Test
    void emptySourceGivesEmptyGraph() {
        assertTrue(decompile("").nodes.isEmpty());
        assertTrue(decompile("# only a comment\n").nodes.isEmpty());
    }

    @Test
    void resultIsImmutable() {
        GraphIr graph = decompile("x = 1");

        assertThrows(UnsupportedOperationException.class, () -> graph.nodes.add(new IrNode()));
        assertThrows(UnsupportedOperationException.class,
                () -> graph.nodes.get(0).inputs.add(IrInput.literal("extra", "1")));
    }

    @Test
    void idsRestartForEachCall() {
        SourceDecompiler decompiler = new SourceDecompiler();
        decompiler.decompile("x = 1\ny = 2");

        assertEquals("assign-1", decompiler.decompile("z = 3").nodes.get(0).id);
    }

    @Test
    void jsonOutputUsesWireFieldNames() {
        String json = Plexus.decompileToJson("for i in [1]:\n    print(i)");

        assertTrue(json.contains("\"type\": \"for_loop\""));
        assertTrue(json.contains("\"target_variable\": \"i\""));
        assertTrue(json.contains("\"connections\": []"));
        assertFalse(json.contains("func_name"));
    }
}
