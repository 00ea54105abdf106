package org.p4c.p4Compiler.ir;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

public class P4Parameter extends P4Node implements IP4Declaration {
    public final String name;
    public final P4Direction direction;
    public final P4Type type;

    public P4Parameter(SourcePositionRange position, P4Direction direction, P4Type type, String name) {
        super(position);
        this.name = name;
        this.direction = direction;
        this.type = type;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Parameter o = other.as(P4Parameter.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.direction == o.direction &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.direction != P4Direction.NONE)
            builder.append(this.direction.toString()).append(" ");
        return builder.append(this.type)
                .append(" ")
                .append(this.name);
    }
}
