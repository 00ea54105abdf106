package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationConstant;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.expression.P4ArrayIndex;
import org.p4c.p4Compiler.ir.expression.P4BinaryExpression;
import org.p4c.p4Compiler.ir.expression.P4CastExpression;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MuxExpression;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.expression.P4ShortCircuitExpression;
import org.p4c.p4Compiler.ir.expression.P4TypeNameExpression;
import org.p4c.p4Compiler.ir.expression.P4UnaryExpression;
import org.p4c.p4Compiler.ir.expression.literal.P4Literal;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;

import java.util.HashSet;
import java.util.Set;

/** Computes the left-value and compile-time constant flags of all expressions
 * and stores them in the TypeMap.  Requires resolved references. */
public class ComputeExpressionFlags extends InnerVisitor {
    /** Directionless action parameters are bound by the control plane, so they are not constants. */
    final Set<P4Parameter> actionParameters;

    public ComputeExpressionFlags(P4Compiler compiler) {
        super(compiler);
        this.actionParameters = new HashSet<>();
    }

    @Override
    public VisitDecision preorder(P4Action action) {
        this.actionParameters.addAll(action.getParameters());
        return VisitDecision.CONTINUE;
    }

    boolean isConstant(IP4Node node) {
        return this.typeMap().isCompileTimeConstant(node);
    }

    @Override
    public void postorder(P4Literal literal) {
        this.typeMap().setCompileTimeConstant(literal);
    }

    @Override
    public void postorder(P4TypeNameExpression expression) {
        this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4PathExpression path) {
        IP4Declaration declaration = this.refMap().getDeclaration(path);
        if (declaration.is(P4DeclarationVariable.class)) {
            this.typeMap().setLeftValue(path);
        } else if (declaration.is(P4DeclarationConstant.class)) {
            this.typeMap().setCompileTimeConstant(path);
        } else if (declaration.is(P4Parameter.class)) {
            P4Parameter parameter = declaration.to(P4Parameter.class);
            if (parameter.direction.isOut())
                this.typeMap().setLeftValue(path);
            else if (parameter.direction == P4Direction.NONE && !this.actionParameters.contains(parameter))
                this.typeMap().setCompileTimeConstant(path);
        }
    }

    @Override
    public void postorder(P4Member member) {
        if (member.expr.is(P4TypeNameExpression.class)) {
            this.typeMap().setCompileTimeConstant(member);
            return;
        }
        if (member.type.is(P4TypeMethod.class))
            return;
        this.typeMap().cloneFlags(member.expr, member);
    }

    @Override
    public void postorder(P4ArrayIndex expression) {
        if (this.typeMap().isLeftValue(expression.array))
            this.typeMap().setLeftValue(expression);
        if (this.isConstant(expression.array) && this.isConstant(expression.index))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4UnaryExpression expression) {
        if (this.isConstant(expression.source))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4CastExpression expression) {
        if (this.isConstant(expression.source))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4BinaryExpression expression) {
        if (this.isConstant(expression.left) && this.isConstant(expression.right))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4ShortCircuitExpression expression) {
        if (this.isConstant(expression.left) && this.isConstant(expression.right))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void postorder(P4MuxExpression expression) {
        if (this.isConstant(expression.condition) &&
                this.isConstant(expression.ifTrue) &&
                this.isConstant(expression.ifFalse))
            this.typeMap().setCompileTimeConstant(expression);
    }

    @Override
    public void startVisit(IP4Node node) {
        this.typeMap().clear();
        this.actionParameters.clear();
        super.startVisit(node);
    }
}
