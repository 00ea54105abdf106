package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Node;
import org.p4c.util.IIndentStream;

import javax.annotation.Nullable;

/** A clause of a select expression: keyset and next state. */
public class P4SelectCase extends P4Node {
    /** Null for the default clause. */
    @Nullable
    public final P4Expression keyset;
    public final String state;

    public P4SelectCase(SourcePositionRange position, @Nullable P4Expression keyset, String state) {
        super(position);
        this.keyset = keyset;
        this.state = state;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.keyset != null)
            this.keyset.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4SelectCase o = other.as(P4SelectCase.class);
        if (o == null)
            return false;
        return this.keyset == o.keyset && this.state.equals(o.state);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.keyset == null)
            builder.append("default");
        else
            builder.append(this.keyset);
        return builder.append(": ")
                .append(this.state)
                .append(";");
    }
}
