package com.plexus.core.ast;

import com.plexus.core.ops.ComparisonOperator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST back to source text. Parenthesizes only where precedence requires it,
 * prints an else-branch holding a single {@code if} as {@code elif}, and never emits an
 * empty block.
 */
public class SourceWriter {

    private static final int ATOM = 10;

    private final String indentUnit;

    public SourceWriter() {
        this(4);
    }

    public SourceWriter(int indent) {
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be positive: " + indent);
        }
        this.indentUnit = " ".repeat(indent);
    }

    /** Statements joined by newlines, without a trailing newline. */
    public String write(Ast.Module module) {
        StringBuilder sb = new StringBuilder();
        writeBlock(module.body(), 0, sb);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '\n') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    public String write(Ast.Expression expression) {
        return expression.accept(new ExpressionPrinter());
    }

    private void writeBlock(List<Ast.Statement> statements, int depth, StringBuilder sb) {
        if (statements.isEmpty() && depth > 0) {
            line(depth, "pass", sb);
            return;
        }
        StatementPrinter printer = new StatementPrinter(depth, sb);
        for (Ast.Statement statement : statements) {
            statement.accept(printer);
        }
    }

    private void line(int depth, String text, StringBuilder sb) {
        sb.append(indentUnit.repeat(depth)).append(text).append('\n');
    }

    private final class StatementPrinter implements StatementVisitor<Void> {

        private final int depth;
        private final StringBuilder sb;

        StatementPrinter(int depth, StringBuilder sb) {
            this.depth = depth;
            this.sb = sb;
        }

        @Override
        public Void visitAssign(Ast.Assign node) {
            line(depth, node.target() + " = " + write(node.value()), sb);
            return null;
        }

        @Override
        public Void visitExpressionStatement(Ast.ExpressionStatement node) {
            line(depth, write(node.expression()), sb);
            return null;
        }

        @Override
        public Void visitIf(Ast.IfStatement node) {
            writeIf(node, "if");
            return null;
        }

        private void writeIf(Ast.IfStatement node, String keyword) {
            line(depth, keyword + " " + write(node.test()) + ":", sb);
            writeBlock(node.body(), depth + 1, sb);
            List<Ast.Statement> orelse = node.orelse();
            if (orelse.size() == 1 && orelse.get(0) instanceof Ast.IfStatement) {
                writeIf((Ast.IfStatement) orelse.get(0), "elif");
            } else if (!orelse.isEmpty()) {
                line(depth, "else:", sb);
                writeBlock(orelse, depth + 1, sb);
            }
        }

        @Override
        public Void visitFor(Ast.ForStatement node) {
            line(depth, "for " + node.loopVariable() + " in " + write(node.iterable()) + ":", sb);
            writeBlock(node.body(), depth + 1, sb);
            return null;
        }

        @Override
        public Void visitPass(Ast.Pass node) {
            line(depth, "pass", sb);
            return null;
        }
    }

    private static final class ExpressionPrinter implements ExpressionVisitor<String> {

        @Override
        public String visitVariableRef(Ast.VariableRef node) {
            return node.name();
        }

        @Override
        public String visitLiteral(Ast.Literal node) {
            return node.text();
        }

        // left-associative: a right operand of equal precedence keeps its parentheses
        @Override
        public String visitBinaryOp(Ast.BinaryOp node) {
            int prec = node.op().precedence();
            return operand(node.left(), prec) + " " + node.op().symbol() + " " + operand(node.right(), prec + 1);
        }

        // comparison operands that are themselves comparisons are always parenthesized
        @Override
        public String visitCompareOp(Ast.CompareOp node) {
            int prec = ComparisonOperator.PRECEDENCE + 1;
            return operand(node.left(), prec) + " " + node.op().symbol() + " " + operand(node.right(), prec);
        }

        @Override
        public String visitCall(Ast.Call node) {
            return node.funcName() + "(" + node.args().stream()
                    .map(a -> a.accept(this))
                    .collect(Collectors.joining(", ")) + ")";
        }

        private String operand(Ast.Expression expr, int minPrecedence) {
            String text = expr.accept(this);
            return precedenceOf(expr) < minPrecedence ? "(" + text + ")" : text;
        }

        private static int precedenceOf(Ast.Expression expr) {
            if (expr instanceof Ast.BinaryOp) return ((Ast.BinaryOp) expr).op().precedence();
            if (expr instanceof Ast.CompareOp) return ComparisonOperator.PRECEDENCE;
            return ATOM;
        }
    }
}
