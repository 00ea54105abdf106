package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;

public class P4AssignmentStatement extends P4Statement {
    public final P4Expression left;
    public final P4Expression right;

    public P4AssignmentStatement(SourcePositionRange position, P4Expression left, P4Expression right) {
        super(position);
        this.left = left;
        this.right = right;
    }

    public P4AssignmentStatement(P4Expression left, P4Expression right) {
        this(left.position, left, right);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4AssignmentStatement o = other.as(P4AssignmentStatement.class);
        if (o == null)
            return false;
        return this.left == o.left && this.right == o.right;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.left)
                .append(" = ")
                .append(this.right)
                .append(";");
    }
}
