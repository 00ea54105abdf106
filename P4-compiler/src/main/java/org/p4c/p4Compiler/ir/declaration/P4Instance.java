package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4TypeExtern;
import org.p4c.util.IIndentStream;

/** An instance of an extern object type. */
public class P4Instance extends P4Declaration {
    public final P4TypeExtern type;

    public P4Instance(SourcePositionRange position, String name, P4TypeExtern type) {
        super(position, name);
        this.type = type;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Instance o = other.as(P4Instance.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.type)
                .append("() ")
                .append(this.name)
                .append(";");
    }
}
