package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.util.IIndentStream;

/** A call whose result, if any, is discarded. */
public class P4MethodCallStatement extends P4Statement {
    public final P4MethodCallExpression methodCall;

    public P4MethodCallStatement(SourcePositionRange position, P4MethodCallExpression methodCall) {
        super(position);
        this.methodCall = methodCall;
    }

    public P4MethodCallStatement(P4MethodCallExpression methodCall) {
        this(methodCall.position, methodCall);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.methodCall.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4MethodCallStatement o = other.as(P4MethodCallStatement.class);
        if (o == null)
            return false;
        return this.methodCall == o.methodCall;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.methodCall).append(";");
    }
}
