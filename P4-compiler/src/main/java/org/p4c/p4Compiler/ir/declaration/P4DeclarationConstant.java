package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

/** A compile-time constant. */
public class P4DeclarationConstant extends P4Declaration implements IP4StatOrDecl {
    public final P4Type type;
    public final P4Expression initializer;

    public P4DeclarationConstant(SourcePositionRange position, P4Type type, String name, P4Expression initializer) {
        super(position, name);
        this.type = type;
        this.initializer = initializer;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.initializer.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4DeclarationConstant o = other.as(P4DeclarationConstant.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.initializer == o.initializer;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("const ")
                .append(this.type)
                .append(" ")
                .append(this.name)
                .append(" = ")
                .append(this.initializer)
                .append(";");
    }
}
