package com.plexus.core.ast;

import com.plexus.core.ops.ArithmeticOperator;
import com.plexus.core.ops.ComparisonOperator;

import java.util.List;

/**
 * Source AST for the supported subset. Built and discarded within a single compile or
 * decompile call.
 *
 * Every expression carries a {@code slot} handed out by the {@link ExpressionArena} of the
 * call that built it; memo tables key on the slot rather than on object identity.
 */
public final class Ast {

    private Ast() {}

    public record Module(List<Statement> body) {}

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    public interface Statement {
        /** 1-based source line, 0 for synthesized statements. */
        int line();
        <R> R accept(StatementVisitor<R> visitor);
    }

    public record Assign(int line, String target, Expression value) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitAssign(this); }
    }

    public record ExpressionStatement(int line, Expression expression) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitExpressionStatement(this); }
    }

    public record IfStatement(int line, Expression test, List<Statement> body, List<Statement> orelse)
            implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitIf(this); }
    }

    public record ForStatement(int line, String loopVariable, Expression iterable, List<Statement> body)
            implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitFor(this); }
    }

    public record Pass(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitPass(this); }
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    public interface Expression {
        int slot();
        <R> R accept(ExpressionVisitor<R> visitor);
    }

    public record VariableRef(int slot, String name) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitVariableRef(this); }
    }

    /** Constant or collection-of-constants literal, held as canonical source text. */
    public record Literal(int slot, String text) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitLiteral(this); }

        /** True for int/float text, optionally signed. */
        public boolean isNumeric() {
            int i = 0;
            while (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) i++;
            return i < text.length() && Character.isDigit(text.charAt(i));
        }
    }

    public record BinaryOp(int slot, ArithmeticOperator op, Expression left, Expression right)
            implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitBinaryOp(this); }
    }

    public record CompareOp(int slot, ComparisonOperator op, Expression left, Expression right)
            implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitCompareOp(this); }
    }

    public record Call(int slot, String funcName, List<Expression> args) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitCall(this); }
    }
}
