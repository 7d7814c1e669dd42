package com.tdtl.query;

/**
 * Visitor over the closed set of {@link Expr} node families. Adding a node family
 * adds a method here, so every traversal is revisited by the compiler.
 *
 * @param <R> result type
 */
public interface ExprVisitor<R> {

    R visitSelect(Expr.SelectStatement select);

    R visitFields(Expr.Fields fields);

    R visitField(Expr.Field field);

    R visitTopic(Expr.Topic topic);

    R visitFilter(Expr.Filter filter);

    R visitDimensions(Expr.Dimensions dimensions);

    R visitWindow(Expr.Window window);

    R visitBinary(Expr.BinaryExpr binary);

    R visitCall(Expr.CallExpr call);

    R visitSwitch(Expr.SwitchExpr switchExpr);

    R visitCase(Expr.CaseExpr caseExpr);

    R visitJsonPath(Expr.JsonPathExpr path);

    R visitLiteral(Expr.Literal literal);
}
