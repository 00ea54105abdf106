package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.simplify.MethodCallDescription;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;

/** Determines whether evaluating an expression may modify state.
 * The only expressions with side effects are calls to methods that are not pure. */
public class SideEffects extends InnerVisitor {
    boolean found;

    public SideEffects(P4Compiler compiler) {
        super(compiler);
        this.found = false;
    }

    @Override
    public VisitDecision preorder(IP4Node node) {
        return this.found ? VisitDecision.STOP : VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(P4MethodCallExpression call) {
        if (this.found)
            return VisitDecision.STOP;
        MethodCallDescription description = MethodCallDescription.resolve(this.compiler, call);
        if (!description.isPure()) {
            this.found = true;
            return VisitDecision.STOP;
        }
        // The arguments may still have side effects
        return VisitDecision.CONTINUE;
    }

    public boolean hasSideEffects() {
        return this.found;
    }

    @Override
    public void startVisit(IP4Node node) {
        this.found = false;
        super.startVisit(node);
    }

    /** True if the node contains a call with side effects. */
    public static boolean check(P4Compiler compiler, IP4Node node) {
        SideEffects visitor = new SideEffects(compiler);
        visitor.apply(node);
        return visitor.hasSideEffects();
    }
}
