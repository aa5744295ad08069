package com.plexus.core.ast;

public interface StatementVisitor<R> {
    R visitAssign(Ast.Assign node);
    R visitExpressionStatement(Ast.ExpressionStatement node);
    R visitIf(Ast.IfStatement node);
    R visitFor(Ast.ForStatement node);
    R visitPass(Ast.Pass node);
}
