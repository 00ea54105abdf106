package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Node;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;

/** A label of a switch statement.  A case without a body falls through to the next one. */
public class P4SwitchCase extends P4Node {
    /** Null for the default label. */
    @Nullable
    public final P4Expression label;
    @Nullable
    public final P4BlockStatement body;

    public P4SwitchCase(SourcePositionRange position, @Nullable P4Expression label, @Nullable P4BlockStatement body) {
        super(position);
        this.label = label;
        this.body = body;
    }

    @CheckReturnValue
    public P4SwitchCase replaceBody(@Nullable P4BlockStatement body) {
        if (body == this.body)
            return this;
        return new P4SwitchCase(this.position, this.label, body);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.label != null)
            this.label.accept(visitor);
        if (this.body != null)
            this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4SwitchCase o = other.as(P4SwitchCase.class);
        if (o == null)
            return false;
        return this.label == o.label && this.body == o.body;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.label == null)
            builder.append("default");
        else
            builder.append(this.label);
        builder.append(":");
        if (this.body != null)
            builder.append(" ").append(this.body);
        return builder;
    }
}
