package org.p4c.p4Compiler.ir;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.type.IP4TypeDeclaration;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** A whole program: a list of top-level declarations. */
public class P4Program extends P4Node {
    public final List<IP4Declaration> declarations;

    public P4Program(SourcePositionRange position, List<IP4Declaration> declarations) {
        super(position);
        this.declarations = declarations;
    }

    public P4Program(List<IP4Declaration> declarations) {
        this(SourcePositionRange.INVALID, declarations);
    }

    @Nullable
    public IP4Declaration getDeclaration(String name) {
        return Linq.first(this.declarations, d -> d.getName().equals(name));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (IP4Declaration declaration: this.declarations)
            declaration.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Program o = other.as(P4Program.class);
        if (o == null)
            return false;
        return Linq.same(this.declarations, o.declarations);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        for (IP4Declaration declaration: this.declarations) {
            if (declaration.is(IP4TypeDeclaration.class))
                declaration.to(IP4TypeDeclaration.class).declare(builder);
            else if (declaration.is(P4Method.class))
                builder.append("extern ").append(declaration);
            else
                builder.append(declaration);
            builder.newline();
        }
        return builder;
    }
}
