package com.plexus.core.decompiler;

import com.plexus.core.ast.Ast;
import com.plexus.core.ast.ExpressionVisitor;
import com.plexus.core.ast.SourceParser;
import com.plexus.core.ast.StatementVisitor;
import com.plexus.core.error.SourceSyntaxException;
import com.plexus.core.error.UnsupportedSyntaxException;
import com.plexus.core.ir.IrModel.GraphIr;
import com.plexus.core.ir.IrModel.IrInput;
import com.plexus.core.ir.IrModel.IrNode;
import com.plexus.core.ir.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decompiles source text into a Graph IR.
 *
 * Walks the parsed module statement by statement. Each variable use becomes a link to the
 * node that currently provides the variable (the latest assignment, or an enclosing
 * {@code for} for its loop variable). Operator and call sub-expressions become their own
 * nodes, placed in the current statement list just before the statement consuming them.
 *
 * All state lives in a per-call {@link Run}; one instance may decompile many sources.
 */
public class SourceDecompiler {

    private final DecompilerOptions options;

    public SourceDecompiler() {
        this(DecompilerOptions.defaults());
    }

    public SourceDecompiler(DecompilerOptions options) {
        this.options = options;
    }

    /**
     * @throws SourceSyntaxException if the text does not parse
     * @throws UnsupportedSyntaxException if it uses a construct outside the supported subset
     */
    public GraphIr decompile(String source) {
        if (source == null) {
            throw new SourceSyntaxException("no source text");
        }
        Ast.Module module = new SourceParser(source).parseModule();
        Run run = new Run();
        return new GraphIr(freeze(run.block(module.body())));
    }

    private static List<IrNode> freeze(List<IrNode> nodes) {
        for (IrNode node : nodes) {
            node.inputs = Collections.unmodifiableList(node.inputs);
            if (node.body != null) node.body = freeze(node.body);
            if (node.orelse != null) node.orelse = freeze(node.orelse);
        }
        return Collections.unmodifiableList(nodes);
    }

    private final class Run implements StatementVisitor<Void> {

        private final NodeIdGenerator ids = new NodeIdGenerator();
        private Map<String, String> providers = new HashMap<>();
        private final Map<Integer, String> expressionMap = new HashMap<>();
        private List<IrNode> current;
        private int line;

        List<IrNode> block(List<Ast.Statement> statements) {
            List<IrNode> saved = current;
            current = new ArrayList<>();
            for (Ast.Statement statement : statements) {
                line = statement.line();
                statement.accept(this);
            }
            List<IrNode> out = current;
            current = saved;
            return out;
        }

        // -------------------------------------------------------------------
        // Statements
        // -------------------------------------------------------------------

        @Override
        public Void visitAssign(Ast.Assign stmt) {
            IrNode node = newNode(ids.next(NodeKind.VARIABLE_ASSIGN), NodeKind.VARIABLE_ASSIGN);
            node.value = stmt.target();
            node.inputs.add(inputFromAst(stmt.value(), "value"));
            current.add(node);
            providers.put(stmt.target(), node.id);
            return null;
        }

        @Override
        public Void visitExpressionStatement(Ast.ExpressionStatement stmt) {
            Ast.Expression expr = stmt.expression();
            if (expr instanceof Ast.Call) {
                Ast.Call call = (Ast.Call) expr;
                if ("print".equals(call.funcName()) && call.args().size() == 1) {
                    IrNode node = newNode(ids.next(NodeKind.PRINT), NodeKind.PRINT);
                    node.inputs.add(inputFromAst(call.args().get(0), "target"));
                    current.add(node);
                } else {
                    emitCall(call);
                }
            } else if (expr instanceof Ast.BinaryOp || expr instanceof Ast.CompareOp) {
                inputFromAst(expr, "value");
            } else {
                throw new UnsupportedSyntaxException(
                        "Expression statements other than calls and operators are not supported", line);
            }
            return null;
        }

        @Override
        public Void visitIf(Ast.IfStatement stmt) {
            IrNode node = newNode(ids.next(NodeKind.IF), NodeKind.IF);
            node.inputs.add(inputFromAst(stmt.test(), "test"));
            int ifLine = line;

            Map<String, String> snapshot = snapshot();
            node.body = block(stmt.body());
            restore(snapshot);
            node.orelse = block(stmt.orelse());
            restore(snapshot);

            line = ifLine;
            current.add(node);
            return null;
        }

        @Override
        public Void visitFor(Ast.ForStatement stmt) {
            IrNode node = newNode(ids.next(NodeKind.FOR), NodeKind.FOR);
            node.targetVariable = stmt.loopVariable();
            node.inputs.add(inputFromAst(stmt.iterable(), "iter"));
            int forLine = line;

            Map<String, String> snapshot = snapshot();
            String previous = providers.put(stmt.loopVariable(), node.id);
            node.body = block(stmt.body());
            if (snapshot != null) {
                restore(snapshot);
            } else if (previous != null) {
                providers.put(stmt.loopVariable(), previous);
            } else {
                providers.remove(stmt.loopVariable());
            }

            line = forLine;
            current.add(node);
            return null;
        }

        @Override
        public Void visitPass(Ast.Pass stmt) {
            return null;
        }

        private Map<String, String> snapshot() {
            return options.branchScoping == BranchScoping.ISOLATED ? new HashMap<>(providers) : null;
        }

        private void restore(Map<String, String> snapshot) {
            if (snapshot != null) {
                providers = new HashMap<>(snapshot);
            }
        }

        // -------------------------------------------------------------------
        // Expressions
        // -------------------------------------------------------------------

        private IrInput inputFromAst(Ast.Expression expr, String slot) {
            return expr.accept(new InputResolver(slot));
        }

        /** Turns an expression into a literal input, or a link to the node producing it. */
        private final class InputResolver implements ExpressionVisitor<IrInput> {

            private final String slot;

            InputResolver(String slot) {
                this.slot = slot;
            }

            @Override
            public IrInput visitLiteral(Ast.Literal expr) {
                return IrInput.literal(slot, expr.text());
            }

            @Override
            public IrInput visitVariableRef(Ast.VariableRef expr) {
                String provider = providers.get(expr.name());
                if (provider == null) {
                    throw new UnsupportedSyntaxException("Variable '" + expr.name() + "' used before assignment", line);
                }
                return IrInput.link(slot, provider);
            }

            @Override
            public IrInput visitBinaryOp(Ast.BinaryOp expr) {
                return IrInput.link(slot, emitOperator(expr.slot(), "binop", expr.op().symbol(), expr.left(), expr.right()));
            }

            @Override
            public IrInput visitCompareOp(Ast.CompareOp expr) {
                return IrInput.link(slot, emitOperator(expr.slot(), "compare", expr.op().symbol(), expr.left(), expr.right()));
            }

            @Override
            public IrInput visitCall(Ast.Call expr) {
                return IrInput.link(slot, emitCall(expr));
            }
        }

        private String emitOperator(int exprSlot, String prefix, String symbol, Ast.Expression left, Ast.Expression right) {
            String known = expressionMap.get(exprSlot);
            if (known != null) return known;

            IrNode node = newNode(ids.next(prefix), NodeKind.BINARY_OP);
            node.value = symbol;
            node.inputs.add(inputFromAst(left, "left"));
            node.inputs.add(inputFromAst(right, "right"));
            current.add(node);
            expressionMap.put(exprSlot, node.id);
            return node.id;
        }

        private String emitCall(Ast.Call call) {
            String known = expressionMap.get(call.slot());
            if (known != null) return known;

            IrNode node = newNode(ids.next(NodeKind.CALL), NodeKind.CALL);
            node.funcName = call.funcName();
            for (int i = 0; i < call.args().size(); i++) {
                node.inputs.add(inputFromAst(call.args().get(i), "arg" + i));
            }
            current.add(node);
            expressionMap.put(call.slot(), node.id);
            return node.id;
        }

        private IrNode newNode(String id, NodeKind kind) {
            IrNode node = new IrNode();
            node.id = id;
            node.type = kind.tag();
            node.inputs = new ArrayList<>();
            return node;
        }
    }
}
