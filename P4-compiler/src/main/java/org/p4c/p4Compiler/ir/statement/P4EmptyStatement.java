package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.util.IIndentStream;

public class P4EmptyStatement extends P4Statement {
    public P4EmptyStatement(SourcePositionRange position) {
        super(position);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        return other.is(P4EmptyStatement.class);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(";");
    }
}
