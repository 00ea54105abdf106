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

import org.p4c.p4Compiler.compiler.ICompilerComponent;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Control;
import org.p4c.p4Compiler.ir.declaration.P4Declaration;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationConstant;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Instance;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.declaration.P4Parser;
import org.p4c.p4Compiler.ir.declaration.P4ParserState;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4ArrayIndex;
import org.p4c.p4Compiler.ir.expression.P4BinaryExpression;
import org.p4c.p4Compiler.ir.expression.P4CastExpression;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4LAnd;
import org.p4c.p4Compiler.ir.expression.P4LOr;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4MuxExpression;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.expression.P4SelectCase;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.p4Compiler.ir.expression.P4ShortCircuitExpression;
import org.p4c.p4Compiler.ir.expression.P4TypeNameExpression;
import org.p4c.p4Compiler.ir.expression.P4UnaryExpression;
import org.p4c.p4Compiler.ir.expression.literal.P4BoolLiteral;
import org.p4c.p4Compiler.ir.expression.literal.P4IntLiteral;
import org.p4c.p4Compiler.ir.expression.literal.P4Literal;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.statement.P4EmptyStatement;
import org.p4c.p4Compiler.ir.statement.P4ExitStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.p4c.p4Compiler.ir.statement.P4Statement;
import org.p4c.p4Compiler.ir.statement.P4SwitchCase;
import org.p4c.p4Compiler.ir.statement.P4SwitchStatement;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IHasId;
import org.p4c.util.IWritesLogs;
import org.p4c.util.Logger;
import org.p4c.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of a P4 IR tree. */
@SuppressWarnings({"SameReturnValue, EmptyMethod", "unused"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static long crtId = 0;
    public final P4Compiler compiler;
    protected final List<IP4Node> context;

    public InnerVisitor(P4Compiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public P4Compiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public ReferenceMap refMap() {
        return this.compiler.getReferenceMap();
    }

    public TypeMap typeMap() {
        return this.compiler.getTypeMap();
    }

    public void push(IP4Node node) {
        this.context.add(node);
    }

    public void pop(IP4Node node) {
        IP4Node last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public IP4Node getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IP4Node node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node.getId())
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should stop right away at the current node.
    public VisitDecision preorder(IP4Node ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(P4Type node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4Parameter node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4Argument node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4Program node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4SelectCase node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4SwitchCase node) {
        return this.preorder((IP4Node) node);
    }

    // Expressions

    public VisitDecision preorder(P4Expression node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4Literal node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4BoolLiteral node) {
        return this.preorder((P4Literal) node);
    }

    public VisitDecision preorder(P4IntLiteral node) {
        return this.preorder((P4Literal) node);
    }

    public VisitDecision preorder(P4PathExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4TypeNameExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4Member node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4ArrayIndex node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4UnaryExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4CastExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4BinaryExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4ShortCircuitExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4LAnd node) {
        return this.preorder((P4ShortCircuitExpression) node);
    }

    public VisitDecision preorder(P4LOr node) {
        return this.preorder((P4ShortCircuitExpression) node);
    }

    public VisitDecision preorder(P4MuxExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4MethodCallExpression node) {
        return this.preorder((P4Expression) node);
    }

    public VisitDecision preorder(P4SelectExpression node) {
        return this.preorder((P4Expression) node);
    }

    // Statements

    public VisitDecision preorder(P4Statement node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4AssignmentStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4MethodCallStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4IfStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4BlockStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4ReturnStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4SwitchStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4ExitStatement node) {
        return this.preorder((P4Statement) node);
    }

    public VisitDecision preorder(P4EmptyStatement node) {
        return this.preorder((P4Statement) node);
    }

    // Declarations

    public VisitDecision preorder(P4Declaration node) {
        return this.preorder((IP4Node) node);
    }

    public VisitDecision preorder(P4DeclarationVariable node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4DeclarationConstant node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Function node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Action node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Control node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Parser node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4ParserState node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Method node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Table node) {
        return this.preorder((P4Declaration) node);
    }

    public VisitDecision preorder(P4Instance node) {
        return this.preorder((P4Declaration) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IP4Node ignored) {}

    public void postorder(P4Type node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4Parameter node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4Argument node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4Program node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4SelectCase node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4SwitchCase node) {
        this.postorder((IP4Node) node);
    }

    // Expressions

    public void postorder(P4Expression node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4Literal node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4BoolLiteral node) {
        this.postorder((P4Literal) node);
    }

    public void postorder(P4IntLiteral node) {
        this.postorder((P4Literal) node);
    }

    public void postorder(P4PathExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4TypeNameExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4Member node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4ArrayIndex node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4UnaryExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4CastExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4BinaryExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4ShortCircuitExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4LAnd node) {
        this.postorder((P4ShortCircuitExpression) node);
    }

    public void postorder(P4LOr node) {
        this.postorder((P4ShortCircuitExpression) node);
    }

    public void postorder(P4MuxExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4MethodCallExpression node) {
        this.postorder((P4Expression) node);
    }

    public void postorder(P4SelectExpression node) {
        this.postorder((P4Expression) node);
    }

    // Statements

    public void postorder(P4Statement node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4AssignmentStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4MethodCallStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4IfStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4BlockStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4ReturnStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4SwitchStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4ExitStatement node) {
        this.postorder((P4Statement) node);
    }

    public void postorder(P4EmptyStatement node) {
        this.postorder((P4Statement) node);
    }

    // Declarations

    public void postorder(P4Declaration node) {
        this.postorder((IP4Node) node);
    }

    public void postorder(P4DeclarationVariable node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4DeclarationConstant node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Function node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Action node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Control node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Parser node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4ParserState node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Method node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Table node) {
        this.postorder((P4Declaration) node);
    }

    public void postorder(P4Instance node) {
        this.postorder((P4Declaration) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public IP4Node apply(IP4Node node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
