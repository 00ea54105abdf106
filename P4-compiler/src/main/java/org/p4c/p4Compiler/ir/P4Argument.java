package org.p4c.p4Compiler.ir;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.util.Objects;

/** An argument of a call.  Arguments with a name are matched to parameters by name. */
public class P4Argument extends P4Node {
    @Nullable
    public final String name;
    public final P4Expression expression;

    public P4Argument(SourcePositionRange position, @Nullable String name, P4Expression expression) {
        super(position);
        this.name = name;
        this.expression = expression;
    }

    public P4Argument(P4Expression expression) {
        this(expression.position, null, expression);
    }

    @CheckReturnValue
    public P4Argument withExpression(P4Expression expression) {
        if (expression == this.expression)
            return this;
        return new P4Argument(this.position, this.name, expression);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Argument o = other.as(P4Argument.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                Objects.equals(this.name, o.name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.name != null)
            builder.append(this.name).append(" = ");
        return builder.append(this.expression);
    }
}
