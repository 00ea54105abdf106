package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.ir.expression.literal.P4BoolLiteral;
import org.p4c.p4Compiler.ir.expression.literal.P4IntLiteral;

/** A function defined by cases over all kinds of expressions.
 * Adding a new kind of expression requires every implementation to handle it. */
public interface IExpressionFunction<T> {
    default T apply(P4Expression expression) {
        return expression.accept(this);
    }

    T apply(P4BoolLiteral expression);
    T apply(P4IntLiteral expression);
    T apply(P4PathExpression expression);
    T apply(P4TypeNameExpression expression);
    T apply(P4Member expression);
    T apply(P4ArrayIndex expression);
    T apply(P4UnaryExpression expression);
    T apply(P4CastExpression expression);
    T apply(P4BinaryExpression expression);
    T apply(P4LAnd expression);
    T apply(P4LOr expression);
    T apply(P4MuxExpression expression);
    T apply(P4MethodCallExpression expression);
    T apply(P4SelectExpression expression);
}
