package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

/** A sequence of statements and local declarations; also a scope. */
public class P4BlockStatement extends P4Statement {
    public final List<IP4StatOrDecl> components;

    public P4BlockStatement(SourcePositionRange position, List<IP4StatOrDecl> components) {
        super(position);
        this.components = components;
    }

    public boolean isEmpty() {
        return this.components.isEmpty();
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (IP4StatOrDecl component: this.components)
            component.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4BlockStatement o = other.as(P4BlockStatement.class);
        if (o == null)
            return false;
        return Linq.same(this.components, o.components);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.components.isEmpty())
            return builder.append("{ }");
        builder.append("{").increase();
        for (IP4StatOrDecl component: this.components)
            builder.append(component).newline();
        return builder.decrease().append("}");
    }
}
