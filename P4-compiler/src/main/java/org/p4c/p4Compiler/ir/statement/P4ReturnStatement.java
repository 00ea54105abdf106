package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;

import javax.annotation.Nullable;

public class P4ReturnStatement extends P4Statement {
    @Nullable
    public final P4Expression expression;

    public P4ReturnStatement(SourcePositionRange position, @Nullable P4Expression expression) {
        super(position);
        this.expression = expression;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.expression != null)
            this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4ReturnStatement o = other.as(P4ReturnStatement.class);
        if (o == null)
            return false;
        return this.expression == o.expression;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("return");
        if (this.expression != null)
            builder.append(" ").append(this.expression);
        return builder.append(";");
    }
}
