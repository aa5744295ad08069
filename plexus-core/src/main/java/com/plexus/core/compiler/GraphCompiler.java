package com.plexus.core.compiler;

import com.plexus.core.ast.Ast;
import com.plexus.core.ast.ExpressionArena;
import com.plexus.core.ast.SourceParser;
import com.plexus.core.ast.SourceWriter;
import com.plexus.core.error.MalformedGraphException;
import com.plexus.core.ir.IrModel.GraphIr;
import com.plexus.core.ir.IrModel.IrInput;
import com.plexus.core.ir.IrModel.IrNode;
import com.plexus.core.ir.NodeKind;
import com.plexus.core.ops.ArithmeticOperator;
import com.plexus.core.ops.ComparisonOperator;
import com.plexus.core.ops.LiteralParser;
import com.plexus.core.ops.Operators;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles a Graph IR into source text.
 *
 * Phases, each over the whole graph before the next starts:
 *   1. discovery   - index every node (nested ones included) by id, validating shape
 *   2. links       - resolve every link target and record which nodes are linked
 *   3. statements  - build the AST from the top-level list in order, pulling linked
 *                    value nodes in as expressions where they are consumed
 *   4. emission    - unparse the module
 *
 * All state lives in a per-call {@link Run}; one instance may compile many graphs.
 */
public class GraphCompiler {

    private static final Pattern ARG_SLOT = Pattern.compile("arg(\\d+)");

    private final CompilerOptions options;

    public GraphCompiler() {
        this(CompilerOptions.defaults());
    }

    public GraphCompiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * @throws MalformedGraphException if the graph is structurally invalid
     */
    public String compile(GraphIr graph) {
        if (graph == null || graph.nodes == null) {
            throw new MalformedGraphException("Graph is missing a 'nodes' list");
        }
        Run run = new Run();
        run.discover(graph.nodes);
        run.collectLinks();
        Ast.Module module = new Ast.Module(run.buildBlock(graph.nodes));

        String source = new SourceWriter(options.indent).write(module);
        return options.trailingNewline && !source.isEmpty() ? source + "\n" : source;
    }

    private static final class Run {

        private final ExpressionArena arena = new ExpressionArena();
        private final Map<String, IrNode> nodeIndex = new LinkedHashMap<>();
        private final Map<String, NodeKind> kinds = new HashMap<>();
        private final Set<String> linkedIds = new HashSet<>();
        private final Map<String, Ast.Expression> expressionCache = new HashMap<>();
        private final Set<String> compiledStatements = new HashSet<>();
        private final Set<String> inProgress = new HashSet<>();

        // -------------------------------------------------------------------
        // Discovery
        // -------------------------------------------------------------------

        void discover(List<IrNode> nodes) {
            for (IrNode node : nodes) {
                if (node == null) {
                    throw new MalformedGraphException("Graph contains a null node");
                }
                if (node.id == null || node.id.isBlank()) {
                    throw new MalformedGraphException("Node is missing a required 'id' field", null, "id");
                }
                if (node.type == null) {
                    throw new MalformedGraphException(
                            "Node '" + node.id + "' is missing a 'type' field", node.id, "type");
                }
                NodeKind kind = NodeKind.fromTag(node.type);
                if (kind == null) {
                    throw new MalformedGraphException(
                            "Node '" + node.id + "' has unknown type '" + node.type + "'", node.id, "type");
                }
                if (nodeIndex.containsKey(node.id)) {
                    throw new MalformedGraphException("Duplicate node id '" + node.id + "'", node.id, "id");
                }
                validateInputs(node);
                if (kind != NodeKind.IF && kind != NodeKind.FOR && !node.bodyOrEmpty().isEmpty()) {
                    throw nodeError(node, "cannot have a 'body'", "body");
                }
                if (kind != NodeKind.IF && !node.orelseOrEmpty().isEmpty()) {
                    throw nodeError(node, "cannot have an 'orelse'", "orelse");
                }

                nodeIndex.put(node.id, node);
                kinds.put(node.id, kind);
                discover(node.bodyOrEmpty());
                discover(node.orelseOrEmpty());
            }
        }

        private void validateInputs(IrNode node) {
            for (IrInput input : node.inputsOrEmpty()) {
                if (input == null || input.name == null || input.name.isBlank()) {
                    throw new MalformedGraphException(
                            "Node '" + node.id + "' has an input without a 'name'", node.id, "inputs");
                }
                if ((input.link == null) == (input.value == null)) {
                    throw new MalformedGraphException("Node '" + node.id + "' input '" + input.name
                            + "' must have exactly one of 'link' or 'value'", node.id, input.name);
                }
            }
        }

        void collectLinks() {
            for (IrNode node : nodeIndex.values()) {
                for (IrInput input : node.inputsOrEmpty()) {
                    if (!input.isLink()) continue;
                    if (!nodeIndex.containsKey(input.link)) {
                        throw new MalformedGraphException(
                                "Node link '" + input.link + "' not found in graph.", node.id, input.name);
                    }
                    linkedIds.add(input.link);
                }
            }
        }

        // -------------------------------------------------------------------
        // Statements
        // -------------------------------------------------------------------

        List<Ast.Statement> buildBlock(List<IrNode> nodes) {
            List<Ast.Statement> out = new ArrayList<>();
            for (IrNode node : nodes) {
                Ast.Statement statement = buildStatement(node);
                if (statement != null) {
                    out.add(statement);
                }
            }
            return out;
        }

        /** Returns null for a node already emitted or one consumed through a link. */
        private Ast.Statement buildStatement(IrNode node) {
            NodeKind kind = kinds.get(node.id);
            if (compiledStatements.contains(node.id)) return null;
            if (kind.isValueKind() && linkedIds.contains(node.id)) return null;

            Ast.Statement statement = switch (kind) {
                case VARIABLE_ASSIGN -> {
                    String target = identifier(node, "value", node.value);
                    yield new Ast.Assign(0, target, resolveInput(node, "value"));
                }
                case PRINT -> new Ast.ExpressionStatement(0,
                        new Ast.Call(arena.nextSlot(), "print", List.of(resolveInput(node, "target"))));
                case CALL, BINARY_OP -> new Ast.ExpressionStatement(0, buildExpression(node));
                case IF -> {
                    Ast.Expression test = resolveInput(node, "test");
                    List<Ast.Statement> body = orPass(buildBlock(node.bodyOrEmpty()));
                    List<Ast.Statement> orelse = buildBlock(node.orelseOrEmpty());
                    yield new Ast.IfStatement(0, test, body, orelse);
                }
                case FOR -> {
                    String loopVariable = identifier(node, "target_variable", node.targetVariable);
                    Ast.Expression iterable = resolveInput(node, "iter");
                    yield new Ast.ForStatement(0, loopVariable, iterable, orPass(buildBlock(node.bodyOrEmpty())));
                }
            };
            compiledStatements.add(node.id);
            return statement;
        }

        private static List<Ast.Statement> orPass(List<Ast.Statement> block) {
            return block.isEmpty() ? List.of(new Ast.Pass(0)) : block;
        }

        // -------------------------------------------------------------------
        // Expressions
        // -------------------------------------------------------------------

        private Ast.Expression buildExpression(IrNode node) {
            Ast.Expression cached = expressionCache.get(node.id);
            if (cached != null) return cached;
            if (!inProgress.add(node.id)) {
                throw new MalformedGraphException("Link cycle detected at node '" + node.id + "'", node.id, null);
            }

            NodeKind kind = kinds.get(node.id);
            Ast.Expression expr = switch (kind) {
                // a link to a binder reads the name it binds
                case VARIABLE_ASSIGN -> new Ast.VariableRef(arena.nextSlot(), identifier(node, "value", node.value));
                case FOR -> new Ast.VariableRef(arena.nextSlot(),
                        identifier(node, "target_variable", node.targetVariable));
                case BINARY_OP -> buildOperator(node);
                case CALL -> {
                    String funcName = identifier(node, "func_name", node.funcName);
                    List<Ast.Expression> args = orderedArguments(node).stream()
                            .map(in -> toExpression(node, in))
                            .collect(Collectors.toList());
                    yield new Ast.Call(arena.nextSlot(), funcName, args);
                }
                case PRINT, IF -> throw nodeError(node, "produces no value and cannot be linked", null);
            };

            inProgress.remove(node.id);
            expressionCache.put(node.id, expr);
            return expr;
        }

        private Ast.Expression buildOperator(IrNode node) {
            String symbol = requireField(node, "value", node.value);
            Operators.Family family = Operators.classify(symbol, node.id);
            Ast.Expression left = resolveInput(node, "left");
            Ast.Expression right = resolveInput(node, "right");
            if (family == Operators.Family.ARITHMETIC) {
                return new Ast.BinaryOp(arena.nextSlot(), ArithmeticOperator.fromSymbol(symbol), left, right);
            }
            return new Ast.CompareOp(arena.nextSlot(), ComparisonOperator.fromSymbol(symbol), left, right);
        }

        /** {@code argN} slots in numeric order, then any other names lexicographically. */
        private static List<IrInput> orderedArguments(IrNode node) {
            List<IrInput> inputs = new ArrayList<>(node.inputsOrEmpty());
            inputs.sort(Comparator
                    .comparingLong((IrInput in) -> argIndex(in.name))
                    .thenComparing(in -> in.name));
            return inputs;
        }

        private static long argIndex(String name) {
            Matcher m = ARG_SLOT.matcher(name);
            if (!m.matches()) return Long.MAX_VALUE;
            try {
                return Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                return Long.MAX_VALUE - 1;
            }
        }

        private Ast.Expression resolveInput(IrNode node, String slot) {
            for (IrInput input : node.inputsOrEmpty()) {
                if (slot.equals(input.name)) {
                    return toExpression(node, input);
                }
            }
            throw new MalformedGraphException("Node '" + node.id + "' of type '" + node.type
                    + "' is missing required input: '" + slot + "'", node.id, slot);
        }

        private Ast.Expression toExpression(IrNode owner, IrInput input) {
            if (input.isLink()) {
                return buildExpression(nodeIndex.get(input.link));
            }
            try {
                return new Ast.Literal(arena.nextSlot(), LiteralParser.parse(input.value));
            } catch (IllegalArgumentException e) {
                throw new MalformedGraphException("Node '" + owner.id + "' input '" + input.name
                        + "' is not a valid literal: " + e.getMessage(), owner.id, input.name);
            }
        }

        // -------------------------------------------------------------------
        // Field checks
        // -------------------------------------------------------------------

        private static String requireField(IrNode node, String field, String value) {
            if (value == null || value.isBlank()) {
                throw nodeError(node, "is missing required field: '" + field + "'", field);
            }
            return value;
        }

        private static String identifier(IrNode node, String field, String value) {
            requireField(node, field, value);
            if (!SourceParser.isIdentifier(value)) {
                throw new MalformedGraphException("Node '" + node.id + "' field '" + field
                        + "' is not a valid identifier: '" + value + "'", node.id, field);
            }
            return value;
        }

        private static MalformedGraphException nodeError(IrNode node, String problem, String field) {
            return new MalformedGraphException(
                    "Node '" + node.id + "' of type '" + node.type + "' " + problem, node.id, field);
        }
    }
}
