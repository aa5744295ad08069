package com.plexus.core.ast;

public interface ExpressionVisitor<R> {
    R visitVariableRef(Ast.VariableRef node);
    R visitLiteral(Ast.Literal node);
    R visitBinaryOp(Ast.BinaryOp node);
    R visitCompareOp(Ast.CompareOp node);
    R visitCall(Ast.Call node);
}
