package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Control;
import org.p4c.p4Compiler.ir.declaration.P4Declaration;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.declaration.P4Parser;
import org.p4c.p4Compiler.ir.declaration.P4ParserState;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.type.P4Type;

/** Binds every path expression to its declaration in the ReferenceMap.
 * All declared names are recorded, so that fresh names never clash with them. */
public class ResolveReferences extends InnerVisitor {
    final Scopes<String, IP4Declaration> scopes;

    public ResolveReferences(P4Compiler compiler) {
        super(compiler);
        this.scopes = new Scopes<>();
    }

    void declare(IP4Declaration declaration) {
        this.scopes.substitute(declaration.getName(), declaration);
        this.refMap().declareName(declaration.getName());
    }

    @Override
    public VisitDecision preorder(P4PathExpression path) {
        IP4Declaration declaration = this.scopes.get(path.name);
        if (declaration == null)
            throw new InternalCompilerError("Could not resolve " + path.name, path);
        this.refMap().declare(path, declaration);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Program program) {
        // Top-level declarations can be used before they appear
        for (IP4Declaration declaration: program.declarations)
            this.declare(declaration);
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(P4Type type) {
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(P4Parameter parameter) {
        this.declare(parameter);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Declaration declaration) {
        this.declare(declaration);
    }

    void enter() {
        this.scopes.newContext();
    }

    void exit(P4Declaration declaration) {
        this.scopes.popContext();
        this.declare(declaration);
    }

    @Override
    public VisitDecision preorder(P4Function function) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Function function) {
        this.exit(function);
    }

    @Override
    public VisitDecision preorder(P4Action action) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Action action) {
        this.exit(action);
    }

    @Override
    public VisitDecision preorder(P4Method method) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Method method) {
        this.exit(method);
    }

    @Override
    public VisitDecision preorder(P4Control control) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Control control) {
        this.exit(control);
    }

    @Override
    public VisitDecision preorder(P4Parser parser) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4Parser parser) {
        this.exit(parser);
    }

    @Override
    public VisitDecision preorder(P4ParserState state) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4ParserState state) {
        this.exit(state);
    }

    @Override
    public VisitDecision preorder(P4BlockStatement block) {
        this.enter();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(P4BlockStatement block) {
        this.scopes.popContext();
    }

    @Override
    public void startVisit(IP4Node node) {
        this.scopes.clear();
        this.scopes.newContext();
        this.refMap().clear();
        super.startVisit(node);
    }

    @Override
    public void endVisit() {
        this.scopes.popContext();
        this.scopes.mustBeEmpty();
        super.endVisit();
    }
}
