package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;

/** A variable declaration, optionally with an initializer. */
public class P4DeclarationVariable extends P4Declaration implements IP4StatOrDecl {
    public final P4Type type;
    @Nullable
    public final P4Expression initializer;

    public P4DeclarationVariable(SourcePositionRange position, P4Type type, String name,
                                 @Nullable P4Expression initializer) {
        super(position, name);
        this.type = type;
        this.initializer = initializer;
        if (!type.isDeclarable())
            this.error("Cannot declare a variable with type " + type);
    }

    @CheckReturnValue
    public P4DeclarationVariable withInitializer(@Nullable P4Expression initializer) {
        if (initializer == this.initializer)
            return this;
        return new P4DeclarationVariable(this.position, this.type, this.name, initializer);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.initializer != null)
            this.initializer.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4DeclarationVariable o = other.as(P4DeclarationVariable.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.initializer == o.initializer;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.type)
                .append(" ")
                .append(this.name);
        if (this.initializer != null)
            builder.append(" = ").append(this.initializer);
        return builder.append(";");
    }
}
