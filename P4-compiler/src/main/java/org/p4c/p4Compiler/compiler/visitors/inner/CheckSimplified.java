package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.simplify.MethodCallDescription;
import org.p4c.p4Compiler.compiler.visitors.simplify.TableApplySolver;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4MuxExpression;
import org.p4c.p4Compiler.ir.expression.P4ShortCircuitExpression;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;

import java.util.Objects;

/** Checks that a program only contains simple expressions:
 * no short-circuit or conditional operators, and calls with side effects
 * only at the top of a call statement or of the right-hand side of an assignment. */
public class CheckSimplified extends InnerVisitor {
    public CheckSimplified(P4Compiler compiler) {
        super(compiler);
    }

    @Override
    public VisitDecision preorder(P4ShortCircuitExpression expression) {
        throw new InternalCompilerError("Logical operator not removed", expression);
    }

    @Override
    public VisitDecision preorder(P4MuxExpression expression) {
        throw new InternalCompilerError("Conditional expression not removed", expression);
    }

    boolean isAllowedPosition(P4MethodCallExpression call) {
        IP4Node parent = Objects.requireNonNull(this.getParent());
        if (parent.is(P4MethodCallStatement.class))
            return true;
        P4AssignmentStatement assignment = parent.as(P4AssignmentStatement.class);
        if (assignment != null)
            return assignment.right == call;
        P4Member member = parent.as(P4Member.class);
        if (member != null)
            return TableApplySolver.isHit(member) || TableApplySolver.isActionRun(member);
        return false;
    }

    @Override
    public VisitDecision preorder(P4MethodCallExpression call) {
        MethodCallDescription description = MethodCallDescription.resolve(this.compiler, call);
        if (!description.isPure() && !this.isAllowedPosition(call))
            throw new InternalCompilerError("Call with side effects is not the top of a statement", call);
        return VisitDecision.CONTINUE;
    }
}
