package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;

import javax.annotation.Nullable;

public class P4IfStatement extends P4Statement {
    public final P4Expression condition;
    public final P4Statement ifTrue;
    @Nullable
    public final P4Statement ifFalse;

    public P4IfStatement(SourcePositionRange position, P4Expression condition,
                         P4Statement ifTrue, @Nullable P4Statement ifFalse) {
        super(position);
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.condition.accept(visitor);
        this.ifTrue.accept(visitor);
        if (this.ifFalse != null)
            this.ifFalse.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4IfStatement o = other.as(P4IfStatement.class);
        if (o == null)
            return false;
        return this.condition == o.condition &&
                this.ifTrue == o.ifTrue &&
                this.ifFalse == o.ifFalse;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if (")
                .append(this.condition)
                .append(") ")
                .append(this.ifTrue);
        if (this.ifFalse != null)
            builder.append(" else ")
                    .append(this.ifFalse);
        return builder;
    }
}
