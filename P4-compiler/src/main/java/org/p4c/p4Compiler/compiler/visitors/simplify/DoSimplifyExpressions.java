package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerRewriteVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Control;
import org.p4c.p4Compiler.ir.declaration.P4Declaration;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Parser;
import org.p4c.p4Compiler.ir.declaration.P4ParserState;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.p4c.p4Compiler.ir.statement.P4Statement;
import org.p4c.p4Compiler.ir.statement.P4SwitchCase;
import org.p4c.p4Compiler.ir.statement.P4SwitchStatement;
import org.p4c.util.Linq;
import org.p4c.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites every statement whose expressions have side effects, short-circuit
 * operators, or conditional expressions into a block of simple statements.
 * The temporaries are declared at the beginning of the enclosing function or action body,
 * at the end of the locals of the enclosing control or parser, or at the beginning of the
 * enclosing parser state.  Control and parser locals whose initializer needs rewriting
 * are initialized at the start of the apply body or of the start state.
 * Statements that need no rewriting are left unchanged.
 * Requires the reference map and the expression flags to be up to date.
 */
public class DoSimplifyExpressions extends InnerRewriteVisitor {
    final DismantleExpression dismantle;
    /** Temporaries created for each enclosing declaration scope. */
    final List<List<P4DeclarationVariable>> toInsert;

    public DoSimplifyExpressions(P4Compiler compiler) {
        super(compiler);
        this.dismantle = new DismantleExpression(compiler);
        this.toInsert = new ArrayList<>();
    }

    void insert(IP4Node node, EvaluationOrder order) {
        if (this.toInsert.isEmpty())
            throw new InternalCompilerError("Expression with side effects outside of a declaration scope", node);
        Utilities.last(this.toInsert).addAll(order.getTemporaries());
    }

    /** Replace a statement with the statements computed by the evaluation order,
     * followed by the statement itself. */
    void replace(P4Statement statement, EvaluationOrder order, P4Statement rewritten) {
        this.insert(statement, order);
        order.addStatement(rewritten);
        this.map(statement, order.toBlock(statement.position));
    }

    @Override
    public void startVisit(IP4Node node) {
        this.toInsert.clear();
        super.startVisit(node);
    }

    @Override
    public void endVisit() {
        Utilities.enforce(this.toInsert.isEmpty());
        super.endVisit();
    }

    /////////////////////// Statements ////////////////////////////////

    @Override
    public VisitDecision preorder(P4AssignmentStatement statement) {
        EvaluationOrder order = new EvaluationOrder(this.compiler);
        P4Expression left = this.dismantle.dismantle(order, statement.left, true, false);
        P4Expression right = this.dismantle.dismantle(order, statement.right, false, false);
        if (order.simple()) {
            this.map(statement, statement);
        } else {
            P4Statement result = new P4AssignmentStatement(
                    statement.position, statement.checkNull(left), statement.checkNull(right));
            this.replace(statement, order, result);
        }
        return VisitDecision.STOP;
    }

    /** True if the order only contains the call statement itself. */
    static boolean unchangedCall(P4MethodCallStatement statement, EvaluationOrder order) {
        if (!order.getTemporaries().isEmpty() || order.getStatements().size() != 1)
            return false;
        P4MethodCallStatement call = order.getStatements().get(0).as(P4MethodCallStatement.class);
        return call != null && call.methodCall == statement.methodCall;
    }

    @Override
    public VisitDecision preorder(P4MethodCallStatement statement) {
        EvaluationOrder order = this.dismantle.dismantle(statement.methodCall, false, true);
        if (order.simple() || unchangedCall(statement, order)) {
            this.map(statement, statement);
        } else {
            this.insert(statement, order);
            this.map(statement, order.toBlock(statement.position));
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4IfStatement statement) {
        // The condition is evaluated before the branches, so its temporaries come first
        EvaluationOrder order = this.dismantle.dismantle(statement.condition, false);
        if (!order.simple())
            this.insert(statement, order);
        this.push(statement);
        P4Statement ifTrue = this.transform(statement.ifTrue);
        P4Statement ifFalse = this.transformN(statement.ifFalse);
        this.pop(statement);
        if (order.simple()) {
            this.map(statement, new P4IfStatement(statement.position, statement.condition, ifTrue, ifFalse));
        } else {
            P4Statement result = new P4IfStatement(
                    statement.position, statement.checkNull(order.getFinal()), ifTrue, ifFalse);
            order.addStatement(result);
            this.map(statement, order.toBlock(statement.position));
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4SwitchStatement statement) {
        EvaluationOrder order = this.dismantle.dismantle(statement.expression, false);
        if (!order.simple())
            this.insert(statement, order);
        this.push(statement);
        List<P4SwitchCase> cases = this.transformCases(statement.cases);
        this.pop(statement);
        if (order.simple()) {
            this.map(statement, new P4SwitchStatement(statement.position, statement.expression, cases));
        } else {
            P4Statement result = new P4SwitchStatement(
                    statement.position, statement.checkNull(order.getFinal()), cases);
            order.addStatement(result);
            this.map(statement, order.toBlock(statement.position));
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4ReturnStatement statement) {
        if (statement.expression == null) {
            this.map(statement, statement);
            return VisitDecision.STOP;
        }
        EvaluationOrder order = this.dismantle.dismantle(statement.expression, false);
        if (order.simple()) {
            this.map(statement, statement);
        } else {
            P4Statement result = new P4ReturnStatement(statement.position, statement.checkNull(order.getFinal()));
            this.replace(statement, order, result);
        }
        return VisitDecision.STOP;
    }

    /** Evaluate the initializer of a declaration 'T x = e' into 'x'.
     * @return The statements that compute 'e' and assign it to 'x',
     * or null if the initializer needs no rewriting. */
    @Nullable
    EvaluationOrder initialize(P4DeclarationVariable declaration) {
        if (declaration.initializer == null)
            return null;
        EvaluationOrder order = this.dismantle.dismantle(declaration.initializer, false);
        if (order.simple())
            return null;
        this.insert(declaration, order);
        P4Expression value = declaration.checkNull(order.getFinal());
        P4PathExpression variable = new P4PathExpression(
                declaration.position, declaration.type, declaration.name);
        this.refMap().declare(variable, declaration);
        this.typeMap().setLeftValue(variable);
        order.addStatement(new P4AssignmentStatement(declaration.position, variable, value));
        return order;
    }

    /** Rewrite the statements and declarations of a block or parser state.
     * A variable declaration 'T x = e' whose initializer needs rewriting becomes
     * 'T x' followed by a block that evaluates 'e' and assigns it to 'x'. */
    List<IP4StatOrDecl> simplifyComponents(List<IP4StatOrDecl> components) {
        List<IP4StatOrDecl> result = new ArrayList<>();
        for (IP4StatOrDecl component: components) {
            P4DeclarationVariable declaration = component.as(P4DeclarationVariable.class);
            EvaluationOrder order = declaration != null ? this.initialize(declaration) : null;
            if (order != null) {
                result.add(declaration.withInitializer(null));
                result.add(order.toBlock(declaration.position));
            } else {
                result.add(this.transformComponent(component));
            }
        }
        return result;
    }

    /** Rewrite the locals of a control or parser.  Variables whose initializer
     * needs rewriting lose the initializer; the blocks that compute the initial
     * values are added to 'initializers', in declaration order. */
    List<P4Declaration> moveInitializers(List<P4Declaration> locals, List<IP4StatOrDecl> initializers) {
        List<P4Declaration> result = new ArrayList<>();
        for (P4Declaration local: locals) {
            P4DeclarationVariable variable = local.as(P4DeclarationVariable.class);
            EvaluationOrder order = variable != null ? this.initialize(variable) : null;
            if (order != null) {
                result.add(variable.withInitializer(null));
                initializers.add(order.toBlock(variable.position));
            } else {
                result.add(this.transformDeclaration(local));
            }
        }
        return result;
    }

    @Override
    public VisitDecision preorder(P4BlockStatement statement) {
        this.push(statement);
        List<IP4StatOrDecl> components = this.simplifyComponents(statement.components);
        this.pop(statement);
        this.map(statement, new P4BlockStatement(statement.position, components));
        return VisitDecision.STOP;
    }

    /////////////////////// Declarations ////////////////////////////////

    /** Declarations of the temporaries followed by the body. */
    static P4BlockStatement prepend(List<P4DeclarationVariable> temporaries, P4BlockStatement body) {
        if (temporaries.isEmpty())
            return body;
        return new P4BlockStatement(body.position, Utilities.<IP4StatOrDecl>concat(temporaries, body.components));
    }

    @Override
    public VisitDecision preorder(P4Function function) {
        this.toInsert.add(new ArrayList<>());
        this.push(function);
        P4BlockStatement body = this.transform(function.body);
        this.pop(function);
        body = prepend(Utilities.removeLast(this.toInsert), body);
        this.map(function, function.withBody(body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Action action) {
        this.toInsert.add(new ArrayList<>());
        this.push(action);
        P4BlockStatement body = this.transform(action.body);
        this.pop(action);
        body = prepend(Utilities.removeLast(this.toInsert), body);
        this.map(action, action.withBody(body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Control control) {
        this.toInsert.add(new ArrayList<>());
        this.push(control);
        // Actions declared in the control have their own temporaries
        List<IP4StatOrDecl> initializers = new ArrayList<>();
        List<P4Declaration> locals = this.moveInitializers(control.controlLocals, initializers);
        P4BlockStatement body = this.transform(control.body);
        this.pop(control);
        locals = Utilities.concat(locals, Utilities.removeLast(this.toInsert));
        if (!initializers.isEmpty())
            body = new P4BlockStatement(body.position, Utilities.concat(initializers, body.components));
        P4Declaration result = new P4Control(
                control.position, control.name, control.applyParameters, locals, body);
        this.map(control, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Parser parser) {
        this.toInsert.add(new ArrayList<>());
        this.push(parser);
        List<IP4StatOrDecl> initializers = new ArrayList<>();
        List<P4Declaration> locals = this.moveInitializers(parser.parserLocals, initializers);
        List<P4ParserState> states = Linq.map(parser.states,
                s -> this.transformDeclaration(s).to(P4ParserState.class));
        this.pop(parser);
        locals = Utilities.concat(locals, Utilities.removeLast(this.toInsert));
        if (!initializers.isEmpty()) {
            // The locals are initialized on entry to the start state
            P4ParserState start = Linq.first(states, s -> s.name.equals(P4ParserState.START));
            if (start == null)
                throw new InternalCompilerError("Parser has no start state", parser);
            P4ParserState initialized = new P4ParserState(start.position, start.name,
                    Utilities.concat(initializers, start.components), start.selectExpression, start.nextState);
            states = Linq.map(states, s -> s == start ? initialized : s);
        }
        P4Declaration result = new P4Parser(
                parser.position, parser.name, parser.applyParameters, locals, states);
        this.map(parser, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4ParserState state) {
        this.toInsert.add(new ArrayList<>());
        this.push(state);
        List<IP4StatOrDecl> components = this.simplifyComponents(state.components);
        P4SelectExpression select = state.selectExpression;
        if (select != null) {
            EvaluationOrder order = this.dismantle.dismantle(select, false);
            if (!order.simple()) {
                this.insert(state, order);
                components.addAll(order.getStatements());
                select = state.checkNull(order.getFinal()).to(P4SelectExpression.class);
            }
        }
        this.pop(state);
        List<P4DeclarationVariable> temporaries = Utilities.removeLast(this.toInsert);
        components = Utilities.concat(temporaries, components);
        P4Declaration result = new P4ParserState(
                state.position, state.name, components, select, state.nextState);
        this.map(state, result);
        return VisitDecision.STOP;
    }
}
