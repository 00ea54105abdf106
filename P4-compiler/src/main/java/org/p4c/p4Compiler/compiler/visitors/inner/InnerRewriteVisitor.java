/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Control;
import org.p4c.p4Compiler.ir.declaration.P4Declaration;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationConstant;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Parser;
import org.p4c.p4Compiler.ir.declaration.P4ParserState;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.p4c.p4Compiler.ir.statement.P4Statement;
import org.p4c.p4Compiler.ir.statement.P4SwitchCase;
import org.p4c.p4Compiler.ir.statement.P4SwitchStatement;
import org.p4c.util.IWritesLogs;
import org.p4c.util.Linq;
import org.p4c.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Base class for Inner visitors which rewrite statements and declarations.
 * This class recurses over the structure of statements and containers
 * and if any fields have changed builds a new version of the object.
 * Expressions, types, parameters and extern declarations are leaves.
 * Classes that extend this should override the preorder methods and ignore the postorder
 * methods. */
public abstract class InnerRewriteVisitor
        extends InnerVisitor
        implements IWritesLogs {
    protected InnerRewriteVisitor(P4Compiler compiler) {
        super(compiler);
    }

    /** Result produced by the last preorder invocation. */
    @Nullable
    protected IP4Node lastResult;

    IP4Node getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public IP4Node apply(IP4Node node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /**
     * Replace the 'old' IR node with the 'newOp' IR node if
     * any of its fields differs. */
    protected void map(IP4Node old, IP4Node newOp) {
        if ((old == newOp) || old.sameFields(newOp)) {
            // Ignore new op.
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    @Override
    public VisitDecision preorder(IP4Node node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    @Nullable
    protected P4Expression transformN(@Nullable P4Expression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    protected P4Expression transform(P4Expression expression) {
        expression.accept(this);
        return this.getResult().to(P4Expression.class);
    }

    protected P4Statement transform(P4Statement statement) {
        statement.accept(this);
        return this.getResult().to(P4Statement.class);
    }

    @Nullable
    protected P4Statement transformN(@Nullable P4Statement statement) {
        if (statement == null)
            return null;
        return this.transform(statement);
    }

    protected P4BlockStatement transform(P4BlockStatement block) {
        block.accept(this);
        return this.getResult().to(P4BlockStatement.class);
    }

    protected IP4StatOrDecl transformComponent(IP4StatOrDecl component) {
        component.accept(this);
        return this.getResult().to(IP4StatOrDecl.class);
    }

    /** Transform the components of a block or of a parser state. */
    protected List<IP4StatOrDecl> transformComponents(List<IP4StatOrDecl> components) {
        return Linq.map(components, this::transformComponent);
    }

    protected P4Declaration transformDeclaration(P4Declaration declaration) {
        declaration.accept(this);
        return this.getResult().to(P4Declaration.class);
    }

    /////////////////////// Statements ////////////////////////////////

    @Override
    public VisitDecision preorder(P4AssignmentStatement statement) {
        this.push(statement);
        P4Expression left = this.transform(statement.left);
        P4Expression right = this.transform(statement.right);
        this.pop(statement);
        P4Statement result = new P4AssignmentStatement(statement.position, left, right);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4MethodCallStatement statement) {
        this.push(statement);
        P4MethodCallExpression call = this.transform(statement.methodCall).to(P4MethodCallExpression.class);
        this.pop(statement);
        P4Statement result = new P4MethodCallStatement(statement.position, call);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4IfStatement statement) {
        this.push(statement);
        P4Expression condition = this.transform(statement.condition);
        P4Statement ifTrue = this.transform(statement.ifTrue);
        P4Statement ifFalse = this.transformN(statement.ifFalse);
        this.pop(statement);
        P4Statement result = new P4IfStatement(statement.position, condition, ifTrue, ifFalse);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4BlockStatement statement) {
        this.push(statement);
        List<IP4StatOrDecl> components = this.transformComponents(statement.components);
        this.pop(statement);
        P4Statement result = new P4BlockStatement(statement.position, components);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4ReturnStatement statement) {
        this.push(statement);
        P4Expression expression = this.transformN(statement.expression);
        this.pop(statement);
        P4Statement result = new P4ReturnStatement(statement.position, expression);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4SwitchCase switchCase) {
        this.push(switchCase);
        P4BlockStatement body = null;
        if (switchCase.body != null)
            body = this.transform(switchCase.body);
        this.pop(switchCase);
        this.map(switchCase, switchCase.replaceBody(body));
        return VisitDecision.STOP;
    }

    protected List<P4SwitchCase> transformCases(List<P4SwitchCase> cases) {
        return Linq.map(cases, c -> {
            c.accept(this);
            return this.getResult().to(P4SwitchCase.class);
        });
    }

    @Override
    public VisitDecision preorder(P4SwitchStatement statement) {
        this.push(statement);
        P4Expression expression = this.transform(statement.expression);
        List<P4SwitchCase> cases = this.transformCases(statement.cases);
        this.pop(statement);
        P4Statement result = new P4SwitchStatement(statement.position, expression, cases);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    /////////////////////// Declarations ////////////////////////////////

    @Override
    public VisitDecision preorder(P4DeclarationVariable declaration) {
        this.push(declaration);
        P4Expression initializer = this.transformN(declaration.initializer);
        this.pop(declaration);
        this.map(declaration, declaration.withInitializer(initializer));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4DeclarationConstant declaration) {
        this.push(declaration);
        P4Expression initializer = this.transform(declaration.initializer);
        this.pop(declaration);
        P4Declaration result = new P4DeclarationConstant(
                declaration.position, declaration.type, declaration.name, initializer);
        this.map(declaration, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Function function) {
        this.push(function);
        P4BlockStatement body = this.transform(function.body);
        this.pop(function);
        this.map(function, function.withBody(body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Action action) {
        this.push(action);
        P4BlockStatement body = this.transform(action.body);
        this.pop(action);
        this.map(action, action.withBody(body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Control control) {
        this.push(control);
        List<P4Declaration> locals = Linq.map(control.controlLocals, this::transformDeclaration);
        P4BlockStatement body = this.transform(control.body);
        this.pop(control);
        P4Declaration result = new P4Control(
                control.position, control.name, control.applyParameters, locals, body);
        this.map(control, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4ParserState state) {
        this.push(state);
        List<IP4StatOrDecl> components = this.transformComponents(state.components);
        P4SelectExpression select = null;
        if (state.selectExpression != null)
            select = this.transform(state.selectExpression).to(P4SelectExpression.class);
        this.pop(state);
        P4Declaration result = new P4ParserState(
                state.position, state.name, components, select, state.nextState);
        this.map(state, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Parser parser) {
        this.push(parser);
        List<P4Declaration> locals = Linq.map(parser.parserLocals, this::transformDeclaration);
        List<P4ParserState> states = Linq.map(parser.states,
                s -> this.transformDeclaration(s).to(P4ParserState.class));
        this.pop(parser);
        P4Declaration result = new P4Parser(
                parser.position, parser.name, parser.applyParameters, locals, states);
        this.map(parser, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Program program) {
        this.push(program);
        List<IP4Declaration> declarations = Linq.map(program.declarations, d -> {
            d.accept(this);
            return this.getResult().to(IP4Declaration.class);
        });
        this.pop(program);
        this.map(program, new P4Program(program.position, declarations));
        return VisitDecision.STOP;
    }
}
